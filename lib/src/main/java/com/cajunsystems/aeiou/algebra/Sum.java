package com.cajunsystems.aeiou.algebra;

/**
 * Closed sum of effect kinds, built as a right-nested list terminated by {@link Never}:
 * {@code Sum<Read, Sum<Write, Sum<Print, Never>>>}. Request sums and result sums are index-aligned,
 * the result of kind {@code i} lives at position {@code i} of the result sum.
 */
public sealed interface Sum<H, T> {

    record Here<H, T>(H value) implements Sum<H, T> {}

    record There<H, T>(T value) implements Sum<H, T> {}

    static <H, T> Sum<H, T> here(H value) {
        return new Here<>(value);
    }

    static <H, T> Sum<H, T> there(T value) {
        return new There<>(value);
    }
}
