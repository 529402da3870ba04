package com.cajunsystems.aeiou;

/**
 * Performs one kind of effect. Implementations may keep private state across calls (open
 * connections, counters). Failures are not caught by the runtime: a recoverable failure belongs in
 * the result type.
 */
@FunctionalInterface
public interface Handler<I, O> {
    O handle(I request);
}
