package com.cajunsystems.aeiou.algebra;

import com.cajunsystems.aeiou.exception.ContractViolationException;

/**
 * The uninhabited type. A computation whose request type is {@code Never} cannot yield.
 */
public enum Never {
    ;

    public static <T> T absurd(Never never) {
        throw ContractViolationException.impossible();
    }
}
