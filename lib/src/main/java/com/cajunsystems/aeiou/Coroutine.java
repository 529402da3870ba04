package com.cajunsystems.aeiou;

/**
 * A restartable body of control flow. Each call runs until the next request or until the body
 * finishes; callers must not invoke it again after it has returned {@link Step.Completed}.
 */
@FunctionalInterface
public interface Coroutine<Y> {
    Step<Y> resume();
}
