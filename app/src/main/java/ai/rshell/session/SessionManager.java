package ai.rshell.session;

import ai.rshell.events.SessionEventBus;
import ai.rshell.input.InputGate;
import ai.rshell.parse.Classification;
import ai.rshell.parser.SyntaxNode;
import ai.rshell.util.ExecutorServiceUtil;
import ai.rshell.util.SerialByKeyExecutor;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Registry of named parse sessions. Every operation on a session runs on the session's own key of a shared worker
 * pool: operations on one session run strictly in submission order, different sessions run in parallel.
 *
 * <p>Futures complete exceptionally only on misuse, with {@link UnknownSessionException} for an id that is not
 * open. Parse failures are reported as {@link AppendOutcome.Failed} values.
 */
public final class SessionManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SessionManager.class);

    private record Entry(ParseSession<?> session, InputGate gate) {}

    private final SessionEventBus bus;
    private final SessionFactory factory;
    private final SerialByKeyExecutor serial;
    private final @Nullable ExecutorService ownedExecutor;
    private final ConcurrentHashMap<String, Entry> sessions = new ConcurrentHashMap<>();

    /** Tree-sitter sessions on a private pool sized to the available processors. */
    public SessionManager(SessionEventBus bus) {
        this(bus, ParseSession::treeSitter, ExecutorServiceUtil.newFixedThreadExecutor(
                Math.max(2, Runtime.getRuntime().availableProcessors()), "rshell-session"), true);
    }

    /** Sessions from {@code factory} on a caller-owned executor, which {@link #close()} leaves running. */
    public SessionManager(SessionEventBus bus, SessionFactory factory, ExecutorService executor) {
        this(bus, factory, executor, false);
    }

    private SessionManager(SessionEventBus bus, SessionFactory factory, ExecutorService executor, boolean owned) {
        this.bus = bus;
        this.factory = factory;
        this.serial = new SerialByKeyExecutor(executor);
        this.ownedExecutor = owned ? executor : null;
    }

    public SessionEventBus bus() {
        return bus;
    }

    /** Opens a session with {@link SessionConfig#load()}. */
    public void open(String sessionId) {
        open(sessionId, SessionConfig.load());
    }

    public void open(String sessionId, SessionConfig config) {
        sessions.compute(sessionId, (id, existing) -> {
            if (existing != null) {
                throw new IllegalStateException("Session '%s' is already open".formatted(id));
            }
            return new Entry(factory.create(id, config, bus), new InputGate());
        });
        logger.debug("Opened session {} with {}", sessionId, config);
    }

    public boolean isOpen(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    /** Appends a raw fragment straight to the session. */
    public CompletableFuture<AppendOutcome> append(String sessionId, String fragment) {
        return onSession(sessionId, entry -> entry.session().append(fragment));
    }

    /**
     * Feeds a line through the session's input gate. The future holds an outcome only when the line completed the
     * held text and it was handed to the session; it is empty while the gate is still waiting for more lines. A
     * chunk the session rejects stays held in the gate, see {@link #pendingInput}.
     */
    public CompletableFuture<Optional<AppendOutcome>> submitLine(String sessionId, String line) {
        return onSession(sessionId, entry -> entry.gate().offerLine(line).map(chunk -> {
            var outcome = entry.session().append(chunk);
            if (outcome instanceof AppendOutcome.Rejected) {
                entry.gate().restore(chunk);
            }
            return outcome;
        }));
    }

    /** Text held by the session's input gate and not yet handed to the session. */
    public CompletableFuture<String> pendingInput(String sessionId) {
        return onSession(sessionId, entry -> entry.gate().pending());
    }

    public CompletableFuture<Void> reset(String sessionId) {
        return onSession(sessionId, entry -> {
            entry.gate().clear();
            entry.session().reset();
            return null;
        });
    }

    public CompletableFuture<Optional<SyntaxNode>> currentTree(String sessionId) {
        return onSession(sessionId, entry -> entry.session().currentTree());
    }

    public CompletableFuture<String> accumulatedInput(String sessionId) {
        return onSession(sessionId, entry -> entry.session().accumulatedInput());
    }

    public CompletableFuture<Optional<Classification>> streamEnd(String sessionId) {
        return onSession(sessionId, entry -> entry.session().streamEnd());
    }

    /** Closes the session after its queued operations and drops its subscriptions. */
    public CompletableFuture<Void> close(String sessionId) {
        return onSession(sessionId, entry -> {
            sessions.remove(sessionId, entry);
            entry.session().close();
            bus.closeSession(sessionId);
            logger.debug("Closed session {}", sessionId);
            return null;
        });
    }

    private <R> CompletableFuture<R> onSession(String sessionId, Function<Entry, R> operation) {
        if (!sessions.containsKey(sessionId)) {
            return CompletableFuture.failedFuture(new UnknownSessionException(sessionId));
        }
        Callable<R> task = () -> {
            // re-check: a queued close may have run first
            var entry = sessions.get(sessionId);
            if (entry == null) {
                throw new UnknownSessionException(sessionId);
            }
            return operation.apply(entry);
        };
        return serial.submit(sessionId, task);
    }

    @Override
    public void close() {
        for (var id : sessionIds()) {
            close(id).join();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }
}
