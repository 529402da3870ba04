package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.exception.ContractViolationException;

/**
 * Outcome of one resumption: the next pending request, or completion.
 */
public sealed interface Step<Y> {

    record Yielded<Y>(Y request) implements Step<Y> {
        public Yielded {
            if (request == null) {
                throw new ContractViolationException("A computation yielded a null request");
            }
        }
    }

    record Completed<Y>() implements Step<Y> {}

    static <Y> Step<Y> yielded(Y request) {
        return new Yielded<>(request);
    }

    static <Y> Step<Y> completed() {
        return new Completed<>();
    }

    default boolean isCompleted() {
        return this instanceof Completed<Y>;
    }
}
