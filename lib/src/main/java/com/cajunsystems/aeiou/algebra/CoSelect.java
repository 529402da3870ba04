package com.cajunsystems.aeiou.algebra;

/**
 * Rebuilds an outer composite value from the remainder left over by a {@link Select}.
 */
@FunctionalInterface
public interface CoSelect<W, R> {
    W widen(R rest);
}
