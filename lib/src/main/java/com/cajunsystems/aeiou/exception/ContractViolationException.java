package com.cajunsystems.aeiou.exception;

/**
 * A broken static guarantee of the runtime: resuming a completed or moved computation, re-entrant
 * resumption, a yield from a computation proven unable to yield. Never recoverable.
 */
public class ContractViolationException extends IllegalStateException {
    public ContractViolationException(String message) {
        super(message);
    }

    public static ContractViolationException unhandled(Object request) {
        return new ContractViolationException("unhandled: " + request);
    }

    public static ContractViolationException impossible() {
        return new ContractViolationException("a value of an uninhabited type was observed");
    }
}
