package com.cajunsystems.aeiou.runtime;

import com.cajunsystems.aeiou.Computation;
import com.cajunsystems.aeiou.Handler;
import com.cajunsystems.aeiou.Step;
import com.cajunsystems.aeiou.algebra.Inject;
import com.cajunsystems.aeiou.algebra.Select;
import com.cajunsystems.aeiou.data.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One handler layer. Requests of the selected kind are handled synchronously and the inner
 * computation is resumed without surfacing anything; every other request is surfaced as this
 * layer's own yield.
 */
public final class HandledComputation<Y, P, Rest, O, R> extends Computation<Rest, R> {
    private static final Logger log = LoggerFactory.getLogger(HandledComputation.class);

    private final Computation<Y, R> inner;
    private final Select<Y, P, Rest> select;
    private final Inject<R, O> inject;
    private final Handler<? super P, ? extends O> handler;

    public HandledComputation(
            Computation<Y, R> inner,
            Select<Y, P, Rest> select,
            Inject<R, O> inject,
            Handler<? super P, ? extends O> handler
    ) {
        super(inner.mailbox());
        this.inner = claim(inner);
        this.select = select;
        this.inject = inject;
        this.handler = handler;
    }

    @Override
    protected Step<Rest> advance() {
        while (true) {
            Step<Y> step = step(inner);
            if (!(step instanceof Step.Yielded<Y> yielded)) {
                return Step.completed();
            }
            Either<Rest, P> selected = select.select(yielded.request());
            if (selected instanceof Either.Left<Rest, P> rest) {
                return Step.yielded(rest.value());
            }
            P part = ((Either.Right<Rest, P>) selected).value();
            O result = handler.handle(part);
            log.trace("Handled {} -> {}", part, result);
            mailbox().put(inject.inject(result));
        }
    }
}
