package com.cajunsystems.aeiou.runtime;

import com.cajunsystems.aeiou.Computation;
import com.cajunsystems.aeiou.Coroutine;
import com.cajunsystems.aeiou.Mailbox;
import com.cajunsystems.aeiou.Step;

import java.util.Objects;

/**
 * Leaf computation around a user-written body.
 */
public final class CoroutineComputation<Y, R> extends Computation<Y, R> {
    private final Coroutine<Y> body;

    public CoroutineComputation(Mailbox<R> mailbox, Coroutine<Y> body) {
        super(mailbox);
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    protected Step<Y> advance() {
        return Objects.requireNonNull(body.resume(), "coroutine returned no step");
    }
}
