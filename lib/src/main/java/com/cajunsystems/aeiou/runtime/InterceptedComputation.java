package com.cajunsystems.aeiou.runtime;

import com.cajunsystems.aeiou.Computation;
import com.cajunsystems.aeiou.PartialHandler;
import com.cajunsystems.aeiou.Step;
import com.cajunsystems.aeiou.data.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handler layer that keeps the request type: the handler either answers or declines, and declined
 * requests are surfaced unchanged.
 */
public final class InterceptedComputation<Y, R> extends Computation<Y, R> {
    private static final Logger log = LoggerFactory.getLogger(InterceptedComputation.class);

    private final Computation<Y, R> inner;
    private final PartialHandler<Y, R> handler;

    public InterceptedComputation(Computation<Y, R> inner, PartialHandler<Y, R> handler) {
        super(inner.mailbox());
        this.inner = claim(inner);
        this.handler = handler;
    }

    @Override
    protected Step<Y> advance() {
        while (true) {
            Step<Y> step = step(inner);
            if (!(step instanceof Step.Yielded<Y> yielded)) {
                return step;
            }
            Either<Y, R> outcome = handler.handle(yielded.request());
            if (outcome instanceof Either.Left<Y, R> declined) {
                log.trace("Declined {}", declined.value());
                return Step.yielded(declined.value());
            }
            mailbox().put(((Either.Right<Y, R>) outcome).value());
        }
    }
}
