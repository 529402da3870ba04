package com.cajunsystems.aeiou;

/**
 * Stands up a fresh computation body around the mailbox it will read its results from.
 */
@FunctionalInterface
public interface ComputationBuilder<Y, R> {
    Coroutine<Y> build(Mailbox<R> mailbox);
}
