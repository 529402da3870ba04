package com.cajunsystems.aeiou.runtime;

import com.cajunsystems.aeiou.Computation;
import com.cajunsystems.aeiou.Step;
import com.cajunsystems.aeiou.algebra.Never;
import com.cajunsystems.aeiou.exception.ContractViolationException;

/**
 * Asserts at run time that every request has been handled by an inner layer.
 */
public final class CheckedComputation<Y, R> extends Computation<Never, R> {
    private final Computation<Y, R> inner;

    public CheckedComputation(Computation<Y, R> inner) {
        super(inner.mailbox());
        this.inner = claim(inner);
    }

    @Override
    protected Step<Never> advance() {
        if (step(inner) instanceof Step.Yielded<Y> yielded) {
            throw ContractViolationException.unhandled(yielded.request());
        }
        return Step.completed();
    }
}
