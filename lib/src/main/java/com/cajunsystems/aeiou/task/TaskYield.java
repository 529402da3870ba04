package com.cajunsystems.aeiou.task;

/**
 * What a sub-task yields: an effect request to forward outward, or a value for the root.
 */
public sealed interface TaskYield<F, O> {

    record Forward<F, O>(F request) implements TaskYield<F, O> {}

    record Output<F, O>(O value) implements TaskYield<F, O> {}

    static <F, O> TaskYield<F, O> forward(F request) {
        return new Forward<>(request);
    }

    static <F, O> TaskYield<F, O> output(O value) {
        return new Output<>(value);
    }
}
