package com.cajunsystems.aeiou.algebra;

import com.cajunsystems.aeiou.data.Either;
import com.cajunsystems.aeiou.exception.ContractViolationException;

final class SealedSelect<W, P extends W, R extends W> implements Select<W, P, R> {
    private final Class<W> whole;
    private final Class<P> part;
    private final Class<R> rest;

    SealedSelect(Class<W> whole, Class<P> part, Class<R> rest) {
        if (part.isAssignableFrom(rest) || rest.isAssignableFrom(part)) {
            throw new IllegalArgumentException(
                    "Overlapping partition of " + whole.getName() + ": " + part.getName() + " / " + rest.getName()
            );
        }
        if (!whole.isAssignableFrom(part) || !whole.isAssignableFrom(rest)) {
            throw new IllegalArgumentException(
                    part.getName() + " and " + rest.getName() + " must both extend " + whole.getName()
            );
        }
        checkCovered(whole, part, rest);
        this.whole = whole;
        this.part = part;
        this.rest = rest;
    }

    /**
     * Every permitted subtype of a sealed {@code type} must fall under {@code part} or {@code rest},
     * either directly or through all of its own permitted subtypes.
     */
    private static void checkCovered(Class<?> type, Class<?> part, Class<?> rest) {
        if (!type.isSealed()) {
            return;
        }
        for (Class<?> permitted : type.getPermittedSubclasses()) {
            if (part.isAssignableFrom(permitted) || rest.isAssignableFrom(permitted)) {
                continue;
            }
            if (!permitted.isSealed()) {
                throw new IllegalArgumentException(
                        permitted.getName() + " is covered by neither " + part.getName() + " nor " + rest.getName()
                );
            }
            checkCovered(permitted, part, rest);
        }
    }

    @Override
    public Either<R, P> select(W value) {
        boolean isPart = part.isInstance(value);
        boolean isRest = rest.isInstance(value);
        if (isPart == isRest) {
            throw new ContractViolationException(
                    "Value " + value + " of " + whole.getSimpleName() + " matches "
                            + (isPart ? "both " : "neither ") + part.getSimpleName() + " and " + rest.getSimpleName()
            );
        }
        return isPart ? Either.right(part.cast(value)) : Either.left(rest.cast(value));
    }

    @Override
    public W inject(P value) {
        return value;
    }

    @Override
    public W widen(R value) {
        return value;
    }
}
