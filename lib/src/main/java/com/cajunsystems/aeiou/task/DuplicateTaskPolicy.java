package com.cajunsystems.aeiou.task;

/**
 * What to do when a spawn request names a task id that is still live.
 */
public enum DuplicateTaskPolicy {
    /** The new task takes the slot; the running one is dropped without being resumed again. */
    REPLACE,
    /** Fail with {@link com.cajunsystems.aeiou.exception.DuplicateTaskException}. */
    REJECT,
    /** Keep the running task and discard the request. */
    IGNORE
}
