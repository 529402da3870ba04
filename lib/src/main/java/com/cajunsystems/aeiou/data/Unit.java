package com.cajunsystems.aeiou.data;

/**
 * The value of a step that produces nothing, e.g. a request whose result is not read.
 */
public record Unit() {
    private static final Unit INSTANCE = new Unit();

    public static Unit unit() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "()";
    }
}
