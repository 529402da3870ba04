package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.algebra.Select;
import com.cajunsystems.aeiou.data.Either;

import java.util.Objects;
import java.util.Optional;

/**
 * Single-slot cell carrying the most recent effect result from a handler back to a suspended
 * computation. Shared by the computation and every layer wrapped around it.
 *
 * <p>A second {@link #put} before a {@link #take} discards the first value. Nothing here blocks;
 * waiting is expressed only by the owning computation's next suspension.
 *
 * <p>Not thread-safe: computations are driven from one logical thread, so at most one writer and
 * one reader are ever active.
 */
public final class Mailbox<T> {
    private T value;

    private Mailbox() {
    }

    public static <T> Mailbox<T> empty() {
        return new Mailbox<>();
    }

    public void put(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Optional<T> take() {
        T taken = value;
        value = null;
        return Optional.ofNullable(taken);
    }

    /**
     * Takes the pending value only if it is the selected part; any other value stays in the slot.
     */
    public <P> Optional<P> take(Select<T, P, ?> select) {
        if (value == null) {
            return Optional.empty();
        }
        Either<?, P> selected = select.select(value);
        if (selected instanceof Either.Right<?, P> right) {
            value = null;
            return Optional.of(right.value());
        }
        return Optional.empty();
    }

    public Optional<T> peek() {
        return Optional.ofNullable(value);
    }

    public boolean isEmpty() {
        return value == null;
    }

    @Override
    public String toString() {
        return value == null ? "Mailbox[empty]" : "Mailbox[" + value + "]";
    }
}
