package ai.rshell.session;

import static org.junit.jupiter.api.Assertions.*;

import ai.rshell.events.SessionEvent;
import ai.rshell.events.SessionEventBus;
import ai.rshell.events.Topic;
import ai.rshell.parser.ParsedTree;
import ai.rshell.parser.ParsingEngine;
import ai.rshell.parser.SourceRange;
import ai.rshell.parser.SyntaxNode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

    /** Treats every line as one command; the hook runs before each parse. */
    private static final class LineEngine implements ParsingEngine<String> {
        private final Runnable beforeParse;

        LineEngine(Runnable beforeParse) {
            this.beforeParse = beforeParse;
        }

        @Override
        public ParsedTree<String> reparse(@Nullable String previousTree, String previousSource, String source) {
            beforeParse.run();
            return new ParsedTree<>(source, false);
        }

        @Override
        public String name() {
            return "lines";
        }
    }

    private static SyntaxNode lines(String source, String ignored) {
        var children = new ArrayList<SyntaxNode>();
        var rows = source.split("\n", -1);
        for (int row = 0; row < rows.length; row++) {
            if (!rows[row].isBlank()) {
                children.add(SyntaxNode.of("command", new SourceRange(row, 0, row, rows[row].length()), rows[row], List.of()));
            }
        }
        int lastRow = rows.length - 1;
        return SyntaxNode.of("program", new SourceRange(0, 0, lastRow, rows[lastRow].length()), source, children);
    }

    private ExecutorService executor;
    private SessionEventBus bus;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        bus = new SessionEventBus();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    private SessionManager lineManager(Runnable beforeParse) {
        SessionFactory factory = (id, config, b) ->
                new ParseSession<>(id, config, new LineEngine(beforeParse), SessionManagerTest::lines, b);
        return new SessionManager(bus, factory, executor);
    }

    @Test
    void appendsToOneSessionRunInSubmissionOrder() throws Exception {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults());
        var statements = new CopyOnWriteArrayList<Integer>();
        bus.subscribe("a", EnumSet.of(Topic.STATEMENTS), e ->
                statements.add(((SessionEvent.StatementReady) e).statement().sequence()));

        var futures = new ArrayList<CompletableFuture<AppendOutcome>>();
        var expected = new StringBuilder();
        for (int i = 0; i < 25; i++) {
            var line = "echo " + i + "\n";
            expected.append(line);
            futures.add(manager.append("a", line));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertEquals(expected.toString(), manager.accumulatedInput("a").get(1, TimeUnit.SECONDS));
        for (int i = 0; i < 25; i++) {
            var updated = (AppendOutcome.Updated) futures.get(i).get();
            assertEquals(List.of(i + 1), updated.statements().stream().map(ExecutableStatement::sequence).toList());
        }
        assertEquals(25, statements.size());
        manager.close();
    }

    @Test
    void differentSessionsRunInParallel() throws Exception {
        var bothStarted = new CountDownLatch(2);
        var timedOut = new CopyOnWriteArrayList<String>();
        var manager = lineManager(() -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(2, TimeUnit.SECONDS)) {
                    timedOut.add(Thread.currentThread().getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        manager.open("a", SessionConfig.defaults());
        manager.open("b", SessionConfig.defaults());

        var a = manager.append("a", "ls\n");
        var b = manager.append("b", "pwd\n");

        assertInstanceOf(AppendOutcome.Updated.class, a.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AppendOutcome.Updated.class, b.get(5, TimeUnit.SECONDS));
        assertTrue(timedOut.isEmpty(), "sessions did not overlap");
        manager.close();
    }

    @Test
    void unknownSessionFailsTheFuture() {
        var manager = lineManager(() -> {});
        var future = manager.append("missing", "ls\n");
        var ex = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSessionException.class, ex.getCause());
        assertEquals("No open session 'missing'", ex.getCause().getMessage());
    }

    @Test
    void openingTwiceIsRejected() {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults());
        assertThrows(IllegalStateException.class, () -> manager.open("a", SessionConfig.defaults()));
        manager.close();
    }

    @Test
    void closedSessionIsForgotten() throws Exception {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults());
        bus.subscribe("a", e -> {});
        manager.close("a").get(1, TimeUnit.SECONDS);

        assertFalse(manager.isOpen("a"));
        assertEquals(Set.of(), manager.sessionIds());
        assertEquals(0, bus.subscriberCount("a", Topic.TREE));
        var ex = assertThrows(ExecutionException.class, () -> manager.reset("a").get(1, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSessionException.class, ex.getCause());
    }

    @Test
    void operationQueuedBehindCloseSeesUnknownSession() {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults());
        manager.close("a");
        var late = manager.append("a", "ls\n");
        var ex = assertThrows(ExecutionException.class, () -> late.get(1, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSessionException.class, ex.getCause());
    }

    @Test
    void resetAndStreamEnd() throws Exception {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults());
        manager.append("a", "ls\n");
        manager.reset("a").get(1, TimeUnit.SECONDS);
        assertEquals("", manager.accumulatedInput("a").get(1, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), manager.currentTree("a").get(1, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), manager.streamEnd("a").get(1, TimeUnit.SECONDS));
        manager.close();
    }

    @Test
    void submitLineWaitsForCompleteInput() throws Exception {
        try (var manager = new SessionManager(bus)) {
            manager.open("sh", SessionConfig.defaults());

            assertEquals(Optional.empty(), manager.submitLine("sh", "if true; then").get(5, TimeUnit.SECONDS));
            assertEquals(Optional.empty(), manager.submitLine("sh", "  echo yes").get(5, TimeUnit.SECONDS));
            assertEquals("", manager.accumulatedInput("sh").get(5, TimeUnit.SECONDS));

            var outcome = manager.submitLine("sh", "fi").get(5, TimeUnit.SECONDS).orElseThrow();
            var updated = assertInstanceOf(AppendOutcome.Updated.class, outcome);
            assertEquals(1, updated.statements().size());
            assertEquals("if true; then\n  echo yes\nfi", updated.statements().get(0).node().text());
            assertTrue(manager.currentTree("sh").get(5, TimeUnit.SECONDS).isPresent());
        }
    }

    @Test
    void rejectedChunkStaysHeldInTheGate() throws Exception {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults().withMaxBufferBytes(20));

        assertEquals(Optional.empty(), manager.submitLine("a", "if true; then").get(1, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), manager.submitLine("a", "  echo a long body line").get(1, TimeUnit.SECONDS));
        var outcome = manager.submitLine("a", "fi").get(1, TimeUnit.SECONDS).orElseThrow();

        var rejected = assertInstanceOf(AppendOutcome.Rejected.class, outcome);
        assertEquals(0, rejected.currentSize());
        assertEquals(41, rejected.fragmentSize());
        assertEquals("", manager.accumulatedInput("a").get(1, TimeUnit.SECONDS));
        assertEquals("if true; then\n  echo a long body line\nfi\n", manager.pendingInput("a").get(1, TimeUnit.SECONDS));

        manager.reset("a").get(1, TimeUnit.SECONDS);
        assertEquals("", manager.pendingInput("a").get(1, TimeUnit.SECONDS));
        manager.close();
    }

    @Test
    void acceptedChunkLeavesTheGateEmpty() throws Exception {
        var manager = lineManager(() -> {});
        manager.open("a", SessionConfig.defaults());
        assertTrue(manager.submitLine("a", "ls").get(1, TimeUnit.SECONDS).isPresent());
        assertEquals("", manager.pendingInput("a").get(1, TimeUnit.SECONDS));
        assertEquals("ls\n", manager.accumulatedInput("a").get(1, TimeUnit.SECONDS));
        manager.close();
    }
}
