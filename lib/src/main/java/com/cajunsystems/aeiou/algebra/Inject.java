package com.cajunsystems.aeiou.algebra;

/**
 * Rebuilds a composite value from one of its parts.
 */
@FunctionalInterface
public interface Inject<W, P> {
    W inject(P part);

    static <W> Inject<W, W> identity() {
        return part -> part;
    }
}
