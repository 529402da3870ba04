package com.cajunsystems.aeiou.task;

import com.cajunsystems.aeiou.Computation;
import com.cajunsystems.aeiou.Mailbox;
import com.cajunsystems.aeiou.Step;
import com.cajunsystems.aeiou.algebra.Select;
import com.cajunsystems.aeiou.data.Either;
import com.cajunsystems.aeiou.exception.DuplicateTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Cooperative scheduler multiplexing a root computation with the sub-tasks it spawns, all on the
 * caller's thread.
 *
 * <p>Each tick resumes the root once, then polls every live task once in ascending id order:
 * <ul>
 *   <li>a spawn request from the root inserts a task into the table;</li>
 *   <li>a forwarded request, from the root or a task, is surfaced as this scheduler's own yield and
 *   the tick continues where it stopped on the next resume;</li>
 *   <li>a task output is written to the root's mailbox, overwriting any unread value;</li>
 *   <li>completed tasks are dropped from the table at the end of the tick.</li>
 * </ul>
 * The scheduler completes once the root has completed and no task is left.
 *
 * <p>The mailbox of this scheduler is the one outer handlers answer into. On the resume following
 * a forwarded request its value is moved to the root, or to the issuing task under
 * {@link ResultRouting#ISSUER}.
 */
public final class TaskScheduler<K extends Comparable<? super K>, T extends Task<K>, F, R>
        extends Computation<F, R> {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private enum Phase {
        ROOT,
        POLL
    }

    private final Computation<?, R> root;
    private final Supplier<Optional<Either<F, T>>> resumeRoot;
    private final TaskFactory<? super T, F, R> factory;
    private final SchedulerOptions options;

    private TreeMap<K, Computation<TaskYield<F, R>, R>> live = new TreeMap<>();
    private TreeMap<K, Computation<TaskYield<F, R>, R>> rebuilt;
    private Iterator<Map.Entry<K, Computation<TaskYield<F, R>, R>>> cursor;
    private Phase phase = Phase.ROOT;
    private boolean rootAlive = true;
    private boolean forwardPending;
    private K forwardingTask;
    private long ticks;

    public <Y> TaskScheduler(
            Computation<Y, R> root,
            Select<Y, T, F> select,
            TaskFactory<? super T, F, R> factory,
            SchedulerOptions options
    ) {
        super(Mailbox.empty());
        this.root = claim(root);
        this.resumeRoot = () -> step(root) instanceof Step.Yielded<Y> yielded
                ? Optional.of(select.select(yielded.request()))
                : Optional.empty();
        this.factory = factory;
        this.options = options;
    }

    @Override
    protected Step<F> advance() {
        deliverPendingResult();
        while (true) {
            if (phase == Phase.ROOT) {
                ticks++;
                phase = Phase.POLL;
                if (rootAlive) {
                    Optional<Either<F, T>> next = resumeRoot.get();
                    if (next.isEmpty()) {
                        rootAlive = false;
                        log.debug("Root completed at tick {}, {} task(s) still live", ticks, live.size());
                    } else if (next.get() instanceof Either.Right<F, T> spawn) {
                        insert(spawn.value());
                    } else {
                        F request = ((Either.Left<F, T>) next.get()).value();
                        log.trace("Forwarding {} from root", request);
                        forwardPending = true;
                        forwardingTask = null;
                        return Step.yielded(request);
                    }
                }
            }

            if (cursor == null) {
                cursor = live.entrySet().iterator();
                rebuilt = new TreeMap<>();
            }
            while (cursor.hasNext()) {
                Map.Entry<K, Computation<TaskYield<F, R>, R>> entry = cursor.next();
                K id = entry.getKey();
                Computation<TaskYield<F, R>, R> task = entry.getValue();
                if (!(step(task) instanceof Step.Yielded<TaskYield<F, R>> yielded)) {
                    log.debug("Task {} completed", id);
                    continue;
                }
                rebuilt.put(id, task);
                if (yielded.request() instanceof TaskYield.Forward<F, R> forward) {
                    log.trace("Forwarding {} from task {}", forward.request(), id);
                    forwardPending = true;
                    forwardingTask = id;
                    return Step.yielded(forward.request());
                }
                deliverToRoot(((TaskYield.Output<F, R>) yielded.request()).value());
            }

            live = rebuilt;
            rebuilt = null;
            cursor = null;
            phase = Phase.ROOT;
            if (!rootAlive && live.isEmpty()) {
                log.debug("Scheduler finished after {} tick(s)", ticks);
                return Step.completed();
            }
        }
    }

    private void insert(T task) {
        K id = task.id();
        if (live.containsKey(id)) {
            switch (options.duplicates()) {
                case REJECT -> throw new DuplicateTaskException(id);
                case IGNORE -> {
                    log.debug("Ignoring spawn of task {}: already live", id);
                    return;
                }
                case REPLACE -> log.debug("Replacing live task {}", id);
            }
        }
        live.put(id, claim(factory.create(task)));
        log.debug("Spawned task {} at tick {}", id, ticks);
    }

    private void deliverPendingResult() {
        Optional<R> result = mailbox().take();
        K issuer = forwardingTask;
        boolean pending = forwardPending;
        forwardPending = false;
        forwardingTask = null;
        if (result.isEmpty()) {
            return;
        }
        if (pending && issuer != null && options.routing() == ResultRouting.ISSUER) {
            rebuilt.get(issuer).put(result.get());
        } else {
            deliverToRoot(result.get());
        }
    }

    private void deliverToRoot(R value) {
        if (rootAlive) {
            root.put(value);
        } else {
            log.debug("Dropping {}: root already completed", value);
        }
    }

    public long ticks() {
        return ticks;
    }

    public boolean isRootAlive() {
        return rootAlive;
    }

    /**
     * Ids of the live task table in polling order. During a tick this is the table the tick
     * started from.
     */
    public List<K> liveTaskIds() {
        return List.copyOf(live.keySet());
    }
}
