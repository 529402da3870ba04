package com.cajunsystems.aeiou;

import com.cajunsystems.aeiou.algebra.Inject;
import com.cajunsystems.aeiou.algebra.Select;
import com.cajunsystems.aeiou.data.Either;
import com.cajunsystems.aeiou.exception.ContractViolationException;
import com.cajunsystems.aeiou.task.ResultRouting;
import com.cajunsystems.aeiou.task.SchedulerOptions;
import com.cajunsystems.aeiou.task.Task;
import com.cajunsystems.aeiou.task.TaskFactory;
import com.cajunsystems.aeiou.task.TaskYield;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A server and a client exchanging a message over an in-memory network, run as two tasks of one
 * scheduler with the network and the console handled outside of it.
 */
class EndToEndTest {
    sealed interface Request permits Launch, Net {}

    record Launch(Integer id, String role) implements Request, Task<Integer> {}

    sealed interface Net extends Request permits Io, Print {}

    sealed interface Io extends Net permits Send, Receive {}

    record Send(String to, String data) implements Io {}

    record Receive(String at) implements Io {}

    record Print(String line) implements Net {}

    private static final Select<Request, Launch, Net> LAUNCHES = Select.sealed(Request.class, Launch.class, Net.class);
    private static final Select<Net, Print, Io> PRINTS = Select.sealed(Net.class, Print.class, Io.class);

    /**
     * Answers sends and receives; an empty string means nothing has arrived yet.
     */
    static final class InMemoryNetwork implements PartialHandler<Net, String> {
        private final Map<String, Deque<String>> inboxes = new HashMap<>();
        private int receives;

        @Override
        public Either<Net, String> handle(Net request) {
            if (request instanceof Send send) {
                inboxes.computeIfAbsent(send.to(), address -> new ArrayDeque<>()).add(send.data());
                return Either.right("sent");
            }
            if (request instanceof Receive receive) {
                receives++;
                Deque<String> inbox = inboxes.get(receive.at());
                return Either.right(inbox == null || inbox.isEmpty() ? "" : inbox.poll());
            }
            return Either.left(request);
        }
    }

    private final List<String> printed = new ArrayList<>();
    private InMemoryNetwork network;

    @BeforeEach
    void setUp() {
        printed.clear();
        network = new InMemoryNetwork();
    }

    private static Computation<TaskYield<Net, String>, String> server() {
        AtomicReference<String> received = new AtomicReference<>();
        return Computation.script(mailbox -> Script.<TaskYield<Net, String>>whileTrue(
                        () -> received.get() == null,
                        () -> Script.<TaskYield<Net, String>, String>perform(TaskYield.forward(new Receive("server")), mailbox)
                                .map(data -> {
                                    if (!data.isEmpty()) {
                                        received.set(data);
                                    }
                                    return data;
                                }))
                .then(() -> Script.<TaskYield<Net, String>>perform(
                        TaskYield.forward(new Print("server got: " + received.get())))));
    }

    private static Computation<TaskYield<Net, String>, String> client() {
        return Computation.script(mailbox ->
                Script.<TaskYield<Net, String>>perform(TaskYield.forward(new Send("server", "hello world!")))
                        .then(() -> Script.<TaskYield<Net, String>>perform(TaskYield.forward(new Print("client sent")))));
    }

    private static Computation<Request, String> boot() {
        return Computation.script(mailbox -> Script.<Request>perform(new Launch(1, "server"))
                .then(() -> Script.perform(new Launch(2, "client"))));
    }

    private final TaskFactory<Launch, Net, String> roles = launch -> "server".equals(launch.role()) ? server() : client();

    private String print(Print print) {
        printed.add(print.line());
        return "printed";
    }

    @Test
    void testServerReceivesClientMessage() {
        boot().spawn(LAUNCHES, roles, SchedulerOptions.defaults().withRouting(ResultRouting.ISSUER))
                .intercept(network)
                .handle(PRINTS, Inject.identity(), this::print)
                .assertHandled()
                .run();

        assertEquals(List.of("client sent", "server got: hello world!"), printed);
        // The server polls an empty inbox twice before the client's send lands
        assertEquals(3, network.receives);
    }

    @Test
    void testHandlerOrderDoesNotChangeOutcome() {
        Computation<Net, String> printedFirst = boot()
                .spawn(LAUNCHES, roles, SchedulerOptions.defaults().withRouting(ResultRouting.ISSUER))
                .<Net>translate(request -> request instanceof Print print
                        ? Either.right(print(print))
                        : Either.left(request));

        printedFirst.intercept(network).assertHandled().run();

        assertEquals(List.of("client sent", "server got: hello world!"), printed);
    }

    @Test
    void testMissingConsoleHandlerFailsAtRunTime() {
        PureComputation<String> computation = boot()
                .spawn(LAUNCHES, roles, SchedulerOptions.defaults().withRouting(ResultRouting.ISSUER))
                .intercept(network)
                .assertHandled();

        ContractViolationException thrown = assertThrows(ContractViolationException.class, computation::run);
        assertEquals("unhandled: " + new Print("client sent"), thrown.getMessage());
    }
}
