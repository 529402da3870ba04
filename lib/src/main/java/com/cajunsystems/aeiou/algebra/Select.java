package com.cajunsystems.aeiou.algebra;

import com.cajunsystems.aeiou.data.Either;

/**
 * Partition of a closed sum {@code W} into one kind {@code P} and the remainder {@code R}.
 *
 * <p>Every value of {@code W} is classified as exactly one of the two. Once every kind of a sum has
 * been selected the remainder is {@link Never} and no value can fall through. Implementations are
 * pure and total.
 *
 * @param <W> the whole sum
 * @param <P> the selected part
 * @param <R> everything else
 */
public interface Select<W, P, R> extends Inject<W, P>, CoSelect<W, R> {

    /**
     * Classifies a value: {@code Right} if it is the selected part, {@code Left} otherwise.
     */
    Either<R, P> select(W whole);

    /**
     * Selects the first kind of a sum.
     */
    static <P, T> Select<Sum<P, T>, P, T> here() {
        return new Select<>() {
            @Override
            public Either<T, P> select(Sum<P, T> whole) {
                if (whole instanceof Sum.Here<P, T> here) {
                    return Either.right(here.value());
                }
                return Either.left(((Sum.There<P, T>) whole).value());
            }

            @Override
            public Sum<P, T> inject(P part) {
                return Sum.here(part);
            }

            @Override
            public Sum<P, T> widen(T rest) {
                return Sum.there(rest);
            }
        };
    }

    /**
     * Selects a kind further down a sum. The head stays in the remainder.
     */
    static <H, T, P, R> Select<Sum<H, T>, P, Sum<H, R>> there(Select<T, P, R> inner) {
        return new Select<>() {
            @Override
            public Either<Sum<H, R>, P> select(Sum<H, T> whole) {
                if (whole instanceof Sum.Here<H, T> here) {
                    return Either.left(Sum.here(here.value()));
                }
                T tail = ((Sum.There<H, T>) whole).value();
                return inner.select(tail).mapLeft(r -> Sum.<H, R>there(r));
            }

            @Override
            public Sum<H, T> inject(P part) {
                return Sum.there(inner.inject(part));
            }

            @Override
            public Sum<H, T> widen(Sum<H, R> rest) {
                if (rest instanceof Sum.Here<H, R> here) {
                    return Sum.here(here.value());
                }
                return Sum.there(inner.widen(((Sum.There<H, R>) rest).value()));
            }
        };
    }

    /**
     * A single kind selected from itself; nothing remains.
     */
    static <P> Select<P, P, Never> identity() {
        return new Select<>() {
            @Override
            public Either<Never, P> select(P whole) {
                return Either.right(whole);
            }

            @Override
            public P inject(P part) {
                return part;
            }

            @Override
            public P widen(Never rest) {
                return Never.absurd(rest);
            }
        };
    }

    /**
     * Partition of a sealed hierarchy by runtime type. {@code part} and {@code rest} must be
     * unrelated subtypes of {@code whole}; classification fails loudly on a value matching neither.
     */
    static <W, P extends W, R extends W> Select<W, P, R> sealed(Class<W> whole, Class<P> part, Class<R> rest) {
        return new SealedSelect<>(whole, part, rest);
    }
}
