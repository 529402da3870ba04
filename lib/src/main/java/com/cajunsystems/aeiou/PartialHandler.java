package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.data.Either;

/**
 * A handler that may decline. {@code Right} carries the result, {@code Left} hands back the
 * original request unchanged for an outer layer.
 */
@FunctionalInterface
public interface PartialHandler<I, O> {
    Either<I, O> handle(I request);

    static <I, O> PartialHandler<I, O> total(Handler<? super I, ? extends O> handler) {
        return request -> Either.right(handler.handle(request));
    }

    static <I, O> PartialHandler<I, O> declineAll() {
        return Either::left;
    }

    default PartialHandler<I, O> orElse(PartialHandler<I, O> fallback) {
        return request -> {
            Either<I, O> first = handle(request);
            if (first instanceof Either.Left<I, O> declined) {
                return fallback.handle(declined.value());
            }
            return first;
        };
    }
}
