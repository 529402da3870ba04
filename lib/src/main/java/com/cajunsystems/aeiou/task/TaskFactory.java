package com.cajunsystems.aeiou.task;

import com.cajunsystems.aeiou.Computation;

/**
 * Materializes the sub-computation for a spawn request.
 */
@FunctionalInterface
public interface TaskFactory<T, F, R> {
    Computation<TaskYield<F, R>, R> create(T task);
}
