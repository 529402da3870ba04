package com.cajunsystems.aeiou.data;

import java.util.function.Function;

/**
 * Disjoint union of two values. By convention {@code Right} is the value a caller was looking for
 * (a selected part, a handled result) and {@code Left} is what is passed on.
 */
public sealed interface Either<L, R> {

    record Left<L, R>(L value) implements Either<L, R> {}

    record Right<L, R>(R value) implements Either<L, R> {}

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    default boolean isRight() {
        return this instanceof Right<L, R>;
    }

    default <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
        if (this instanceof Right<L, R> right) {
            return onRight.apply(right.value());
        }
        return onLeft.apply(((Left<L, R>) this).value());
    }

    default <L2> Either<L2, R> mapLeft(Function<? super L, ? extends L2> f) {
        if (this instanceof Left<L, R> left) {
            return new Left<>(f.apply(left.value()));
        }
        return new Right<>(((Right<L, R>) this).value());
    }
}
