package com.cajunsystems.aeiou.runtime;

import com.cajunsystems.aeiou.Computation;
import com.cajunsystems.aeiou.Handler;
import com.cajunsystems.aeiou.Step;
import com.cajunsystems.aeiou.data.Either;

/**
 * Handler layer that resolves some requests and rewrites the others into a new request type.
 */
public final class TranslatedComputation<Y, N, R> extends Computation<N, R> {
    private final Computation<Y, R> inner;
    private final Handler<? super Y, Either<N, R>> handler;

    public TranslatedComputation(Computation<Y, R> inner, Handler<? super Y, Either<N, R>> handler) {
        super(inner.mailbox());
        this.inner = claim(inner);
        this.handler = handler;
    }

    @Override
    protected Step<N> advance() {
        while (true) {
            Step<Y> step = step(inner);
            if (!(step instanceof Step.Yielded<Y> yielded)) {
                return Step.completed();
            }
            Either<N, R> outcome = handler.handle(yielded.request());
            if (outcome instanceof Either.Left<N, R> rewritten) {
                return Step.yielded(rewritten.value());
            }
            mailbox().put(((Either.Right<N, R>) outcome).value());
        }
    }
}
