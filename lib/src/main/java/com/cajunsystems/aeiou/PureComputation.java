package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.algebra.Never;
import com.cajunsystems.aeiou.exception.ContractViolationException;

/**
 * A computation whose request type is uninhabited: every effect has been handled, so it can be
 * driven to completion in a single {@link #run()}.
 */
public final class PureComputation<R> extends Computation<Never, R> {
    private final Computation<Never, R> inner;

    PureComputation(Computation<Never, R> inner) {
        super(inner.mailbox());
        this.inner = claim(inner);
    }

    public void run() {
        if (resume() instanceof Step.Yielded<Never> yielded) {
            throw ContractViolationException.unhandled(yielded.request());
        }
    }

    @Override
    protected Step<Never> advance() {
        return step(inner);
    }
}
