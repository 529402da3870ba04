package com.cajunsystems.aeiou.runtime;

import com.cajunsystems.aeiou.Coroutine;
import com.cajunsystems.aeiou.Script;
import com.cajunsystems.aeiou.Step;
import com.cajunsystems.aeiou.data.Unit;
import com.cajunsystems.aeiou.exception.ContractViolationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Function;

/**
 * Trampolined interpreter for {@link Script}. Runs plain steps until the next {@link Script.Perform},
 * saves its position (current script plus the continuation stack) and yields the request.
 *
 * <p>Continuations live on an explicit deque, so neither deep {@code flatMap} chains nor scripted
 * loops consume Java stack.
 */
public final class ScriptInterpreter<Y> implements Coroutine<Y> {
    private final Deque<Function<Object, Script<?, ?>>> continuations = new ArrayDeque<>();
    private Script<?, ?> current;
    private Object value;
    private boolean finished;

    public ScriptInterpreter(Script<Y, ?> script) {
        this.current = script;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Step<Y> resume() {
        if (finished) {
            throw new ContractViolationException("Script resumed after it finished");
        }
        while (true) {
            if (current == null) {
                if (continuations.isEmpty()) {
                    finished = true;
                    return Step.completed();
                }
                current = Objects.requireNonNull(continuations.pop().apply(value), "flatMap returned no script");
                continue;
            }

            Script<?, ?> script = current;
            if (script instanceof Script.Pure<?, ?> pure) {
                value = pure.value();
                current = null;
            } else if (script instanceof Script.Suspend<?, ?> suspend) {
                value = suspend.thunk().get();
                current = null;
            } else if (script instanceof Script.FlatMap<?, ?, ?> flatMap) {
                Function<?, ?> f = flatMap.f();
                continuations.push((Function<Object, Script<?, ?>>) f);
                current = flatMap.source();
            } else if (script instanceof Script.Perform<?> perform) {
                // Resumption continues with the unit value of the perform itself
                value = Unit.unit();
                current = null;
                return Step.yielded((Y) perform.request());
            }
        }
    }
}
