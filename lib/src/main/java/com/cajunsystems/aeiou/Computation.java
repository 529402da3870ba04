package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.algebra.Inject;
import com.cajunsystems.aeiou.algebra.Never;
import com.cajunsystems.aeiou.algebra.Select;
import com.cajunsystems.aeiou.data.Either;
import com.cajunsystems.aeiou.exception.ContractViolationException;
import com.cajunsystems.aeiou.runtime.CheckedComputation;
import com.cajunsystems.aeiou.runtime.CoroutineComputation;
import com.cajunsystems.aeiou.runtime.HandledComputation;
import com.cajunsystems.aeiou.runtime.InterceptedComputation;
import com.cajunsystems.aeiou.runtime.ScriptInterpreter;
import com.cajunsystems.aeiou.runtime.TranslatedComputation;
import com.cajunsystems.aeiou.task.SchedulerOptions;
import com.cajunsystems.aeiou.task.Task;
import com.cajunsystems.aeiou.task.TaskFactory;
import com.cajunsystems.aeiou.task.TaskScheduler;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * A restartable unit of control flow that suspends at each effect request.
 *
 * <p>Lifecycle: {@code CREATED -> SUSPENDED -> ... -> COMPLETED}. Exactly one suspension is
 * outstanding at a time. Resuming after completion, resuming re-entrantly or from a second thread
 * while a step is running, or resuming a computation that another layer has taken over all throw
 * {@link ContractViolationException}.
 *
 * <p>Every combinator ({@link #handle}, {@link #intercept}, {@link #translate}, {@link #spawn},
 * {@link #assertHandled}) consumes this computation: afterwards only the returned layer may drive it.
 *
 * @param <Y> the request type yielded at each suspension
 * @param <R> the result type delivered through the {@link Mailbox}
 */
public abstract class Computation<Y, R> {

    public enum State {
        CREATED,
        SUSPENDED,
        RUNNING,
        COMPLETED,
        FAILED
    }

    private final Mailbox<R> mailbox;
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private boolean moved;

    protected Computation(Mailbox<R> mailbox) {
        this.mailbox = mailbox;
    }

    /**
     * The standard entry point: creates the mailbox, hands it to the builder and wraps the body.
     */
    public static <Y, R> Computation<Y, R> create(ComputationBuilder<Y, R> builder) {
        Mailbox<R> mailbox = Mailbox.empty();
        return new CoroutineComputation<>(mailbox, builder.build(mailbox));
    }

    public static <Y, R> Computation<Y, R> script(Function<Mailbox<R>, Script<Y, ?>> body) {
        return create(mailbox -> new ScriptInterpreter<>(body.apply(mailbox)));
    }

    public static <R> PureComputation<R> pure(Computation<Never, R> computation) {
        return new PureComputation<>(computation);
    }

    /**
     * Drives a computation that cannot yield to completion.
     */
    public static <R> void run(Computation<Never, R> computation) {
        pure(computation).run();
    }

    public final Step<Y> resume() {
        if (moved) {
            throw new ContractViolationException("Computation was consumed by an outer layer and can only be driven through it");
        }
        return step(this);
    }

    /**
     * Advances a computation owned by the calling layer.
     */
    protected static <T> Step<T> step(Computation<T, ?> computation) {
        State current = computation.state.get();
        switch (current) {
            case COMPLETED -> throw new ContractViolationException("Computation resumed after completion");
            case FAILED -> throw new ContractViolationException("Computation resumed after failure");
            case RUNNING -> throw new ContractViolationException("Computation resumed while already running");
            default -> {
            }
        }
        // Two callers racing from the same state: only one may enter
        if (!computation.state.compareAndSet(current, State.RUNNING)) {
            throw new ContractViolationException("Computation resumed concurrently");
        }
        Step<T> next = null;
        try {
            next = computation.advance();
        } finally {
            if (next == null) {
                computation.state.set(State.FAILED);
            } else {
                computation.state.set(next.isCompleted() ? State.COMPLETED : State.SUSPENDED);
            }
        }
        return next;
    }

    /**
     * Takes ownership of a computation; it can no longer be resumed directly.
     */
    protected static <C extends Computation<?, ?>> C claim(C computation) {
        Computation<?, ?> owned = computation;
        if (owned.moved) {
            throw new ContractViolationException("Computation was already consumed by another layer");
        }
        owned.moved = true;
        return computation;
    }

    /**
     * Runs until the next request this layer surfaces, or until completion. Never returns null.
     */
    protected abstract Step<Y> advance();

    public final Mailbox<R> mailbox() {
        return mailbox;
    }

    public final void put(R value) {
        mailbox.put(value);
    }

    public final State state() {
        return state.get();
    }

    public final boolean isCompleted() {
        return state.get() == State.COMPLETED;
    }

    /**
     * Attaches a handler for the kind {@code P} selected out of {@code Y}. Requests of that kind are
     * handled in place and never reach the caller; the rest are surfaced as {@code Rest}.
     */
    public final <P, Rest, O> Computation<Rest, R> handle(
            Select<Y, P, Rest> select,
            Inject<R, O> inject,
            Handler<? super P, ? extends O> handler
    ) {
        return new HandledComputation<>(this, select, inject, handler);
    }

    /**
     * Attaches a handler that sees every request and may decline; declined requests surface unchanged.
     */
    public final Computation<Y, R> intercept(PartialHandler<Y, R> handler) {
        return new InterceptedComputation<>(this, handler);
    }

    /**
     * Attaches a handler that either resolves a request or rewrites it into a request of a new type.
     */
    public final <N> Computation<N, R> translate(Handler<? super Y, Either<N, R>> handler) {
        return new TranslatedComputation<>(this, handler);
    }

    /**
     * Treats any further yield as a fatal "unhandled" failure.
     */
    public final PureComputation<R> assertHandled() {
        return new PureComputation<>(new CheckedComputation<>(this));
    }

    public final <K extends Comparable<? super K>, T extends Task<K>, F> TaskScheduler<K, T, F, R> spawn(
            Select<Y, T, F> select,
            TaskFactory<? super T, F, R> factory
    ) {
        return spawn(select, factory, SchedulerOptions.defaults());
    }

    /**
     * Runs this computation as the root of a task scheduler. Requests selected as {@code T} spawn
     * sub-tasks; the rest are forwarded outward.
     */
    public final <K extends Comparable<? super K>, T extends Task<K>, F> TaskScheduler<K, T, F, R> spawn(
            Select<Y, T, F> select,
            TaskFactory<? super T, F, R> factory,
            SchedulerOptions options
    ) {
        return new TaskScheduler<>(this, select, factory, options);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + state.get() + (moved ? ", moved" : "") + "]";
    }
}
