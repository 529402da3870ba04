package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.algebra.Select;
import com.cajunsystems.aeiou.data.Unit;
import com.cajunsystems.aeiou.exception.ContractViolationException;

import java.util.Iterator;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Sequential description of a computation body: a chain of plain steps and effect requests.
 *
 * <p>Scripts are data; nothing runs until a {@link com.cajunsystems.aeiou.runtime.ScriptInterpreter}
 * steps through them, suspending at every {@link Perform}. Interpretation is trampolined, so long
 * chains and unbounded loops do not grow the Java stack.
 *
 * <pre>{@code
 * Computation<Req, Res> echo = Computation.script(mailbox ->
 *         Script.<Req, Res>perform(new Read(), mailbox)
 *                 .flatMap(line -> Script.perform(new Print(line))));
 * }</pre>
 *
 * @param <Y> the request type
 * @param <A> the value this script produces
 */
public sealed interface Script<Y, A> {

    record Pure<Y, A>(A value) implements Script<Y, A> {}

    record Suspend<Y, A>(Supplier<A> thunk) implements Script<Y, A> {}

    record Perform<Y>(Y request) implements Script<Y, Unit> {}

    record FlatMap<Y, A, B>(
            Script<Y, A> source,
            Function<A, Script<Y, B>> f
    ) implements Script<Y, B> {}

    static <Y, A> Script<Y, A> pure(A value) {
        return new Pure<>(value);
    }

    static <Y> Script<Y, Unit> done() {
        return new Pure<>(Unit.unit());
    }

    static <Y, A> Script<Y, A> suspend(Supplier<A> thunk) {
        return new Suspend<>(thunk);
    }

    static <Y> Script<Y, Unit> act(Runnable action) {
        return new Suspend<>(() -> {
            action.run();
            return Unit.unit();
        });
    }

    static <Y, A> Script<Y, A> defer(Supplier<Script<Y, A>> script) {
        return Script.<Y>done().flatMap(u -> script.get());
    }

    /**
     * Yields a request; the script continues when the computation is next resumed.
     */
    static <Y> Script<Y, Unit> perform(Y request) {
        return new Perform<>(request);
    }

    /**
     * Yields a request and reads its result from the mailbox on resumption. A missing result is a
     * contract violation: some layer must have handled the request.
     */
    static <Y, R> Script<Y, R> perform(Y request, Mailbox<R> mailbox) {
        return Script.perform(request).flatMap(u -> suspend(() -> mailbox.take().orElseThrow(
                () -> new ContractViolationException("No result delivered for " + request)
        )));
    }

    /**
     * Yields a request and reads the selected part of its result.
     */
    static <Y, R, P> Script<Y, P> perform(Y request, Mailbox<R> mailbox, Select<R, P, ?> select) {
        return Script.perform(request).flatMap(u -> suspend(() -> mailbox.take(select).orElseThrow(
                () -> new ContractViolationException("No matching result delivered for " + request + ", found " + mailbox)
        )));
    }

    static <Y> Script<Y, Unit> forever(Supplier<? extends Script<Y, ?>> body) {
        return Script.<Y, Unit>defer(() -> body.get().flatMap(a -> forever(body)));
    }

    static <Y> Script<Y, Unit> whileTrue(BooleanSupplier condition, Supplier<? extends Script<Y, ?>> body) {
        return Script.<Y, Unit>defer(() -> condition.getAsBoolean()
                ? body.get().flatMap(a -> whileTrue(condition, body))
                : Script.<Y>done());
    }

    static <Y> Script<Y, Unit> repeat(int times, IntFunction<? extends Script<Y, ?>> body) {
        return repeatFrom(0, times, body);
    }

    private static <Y> Script<Y, Unit> repeatFrom(int index, int times, IntFunction<? extends Script<Y, ?>> body) {
        if (index >= times) {
            return done();
        }
        return Script.<Y, Unit>defer(() -> body.apply(index).flatMap(a -> repeatFrom(index + 1, times, body)));
    }

    static <Y, T> Script<Y, Unit> forEach(Iterable<T> items, Function<? super T, ? extends Script<Y, ?>> body) {
        Iterator<T> iterator = items.iterator();
        return whileTrue(iterator::hasNext, () -> body.apply(iterator.next()));
    }

    default <B> Script<Y, B> map(Function<A, B> f) {
        return flatMap(a -> pure(f.apply(a)));
    }

    default <B> Script<Y, B> flatMap(Function<A, Script<Y, B>> f) {
        return new FlatMap<>(this, f);
    }

    default <B> Script<Y, B> then(Supplier<Script<Y, B>> next) {
        return flatMap(a -> next.get());
    }

    default Script<Y, Unit> discard() {
        return map(a -> Unit.unit());
    }
}
