package ai.rshell.session;

import ai.rshell.events.SessionEvent;
import ai.rshell.events.SessionEventBus;
import ai.rshell.parse.Classification;
import ai.rshell.parse.CompletenessClassifier;
import ai.rshell.parse.SyntaxTreeJson;
import ai.rshell.parser.ParseEngineException;
import ai.rshell.parser.ParsedTree;
import ai.rshell.parser.ParsingEngine;
import ai.rshell.parser.SyntaxNode;
import ai.rshell.parser.TreeConverter;
import ai.rshell.treesitter.TreeSitterBashEngine;
import ai.rshell.treesitter.TreeSitterConverter;
import com.google.common.base.CharMatcher;
import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSTree;

/**
 * One incremental parse session: the append-only input buffer, the latest tree built from it, and the bookkeeping
 * that makes every top-level statement come out exactly once, in order.
 *
 * <p>Not thread-safe. {@link SessionManager} drives each session from a single serialized context. Events are
 * published synchronously on the calling thread, so subscribers see a call's {@code TreeUpdated} and
 * {@code AppendFinished} before {@link #append} returns.
 *
 * @param <T> the engine's native tree type
 */
public final class ParseSession<T> implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ParseSession.class);

    private static final CharMatcher NEWLINE = CharMatcher.is('\n');

    private final String sessionId;
    private final SessionConfig config;
    private final ParsingEngine<T> engine;
    private final TreeConverter<T> converter;
    private final SessionEventBus bus;

    private String buffer = "";
    private int bufferBytes;
    private @Nullable T engineTree;
    private @Nullable SyntaxNode tree;
    private boolean hasErrors;
    private @Nullable Classification classification;
    private int emittedCount;
    private int lastEmittedRow = -1;

    public ParseSession(
            String sessionId,
            SessionConfig config,
            ParsingEngine<T> engine,
            TreeConverter<T> converter,
            SessionEventBus bus) {
        this.sessionId = Objects.requireNonNull(sessionId);
        this.config = Objects.requireNonNull(config);
        this.engine = Objects.requireNonNull(engine);
        this.converter = Objects.requireNonNull(converter);
        this.bus = Objects.requireNonNull(bus);
    }

    /** A session over the bash grammar with its own Tree-sitter parser. */
    public static ParseSession<TSTree> treeSitter(String sessionId, SessionConfig config, SessionEventBus bus) {
        return new ParseSession<>(sessionId, config, new TreeSitterBashEngine(), new TreeSitterConverter(), bus);
    }

    /**
     * Appends a fragment, re-parses the whole buffer incrementally and publishes the results. Always produces exactly
     * one outcome, which is also published as {@code AppendFinished}.
     */
    public AppendOutcome append(String fragment) {
        var outcome = doAppend(fragment);
        bus.publish(new SessionEvent.AppendFinished(sessionId, outcome));
        return outcome;
    }

    private AppendOutcome doAppend(String fragment) {
        int fragmentBytes = Utf8.encodedLength(fragment);
        if ((long) bufferBytes + fragmentBytes > config.maxBufferBytes()) {
            logger.warn(
                    "Session {}: rejecting {} byte fragment, buffer holds {} of {} bytes",
                    sessionId,
                    fragmentBytes,
                    bufferBytes,
                    config.maxBufferBytes());
            return new AppendOutcome.Rejected(
                    AppendOutcome.RejectionReason.BUFFER_OVERFLOW, bufferBytes, fragmentBytes, config.maxBufferBytes());
        }

        var newBuffer = buffer + fragment;
        ParsedTree<T> parsed;
        try {
            parsed = engine.reparse(engineTree, buffer, newBuffer);
        } catch (ParseEngineException | RuntimeException e) {
            return fail(AppendOutcome.Stage.PARSE, e);
        }
        SyntaxNode newTree;
        try {
            newTree = converter.convert(parsed.tree(), newBuffer);
        } catch (RuntimeException e) {
            return fail(AppendOutcome.Stage.CONVERT, e);
        }
        var newClassification = CompletenessClassifier.classify(newTree, parsed.hasErrors());

        var previousTree = tree;
        buffer = newBuffer;
        bufferBytes += fragmentBytes;
        engineTree = parsed.tree();
        tree = newTree;
        hasErrors = parsed.hasErrors();
        classification = newClassification;
        logger.debug(
                "Session {}: appended {} bytes, buffer {} bytes, {}",
                sessionId,
                fragmentBytes,
                bufferBytes,
                newClassification.kind());
        if (logger.isTraceEnabled()) {
            logger.trace("Session {} tree: {}", sessionId, SyntaxTreeJson.render(newTree));
        }

        bus.publish(new SessionEvent.TreeUpdated(sessionId, newTree, newClassification));

        List<ExecutableStatement> statements = List.of();
        if (newClassification instanceof Classification.Complete && config.emitStatements()) {
            statements = emitNewStatements(newTree);
        }
        return new AppendOutcome.Updated(newTree, newClassification, changedNodes(previousTree, newTree), statements);
    }

    /**
     * Publishes root statements that end below the last emitted row and whose line has been terminated. A statement
     * on the line still being typed is held back, since later text on that line may extend it.
     */
    private List<ExecutableStatement> emitNewStatements(SyntaxNode root) {
        int terminatedLines = NEWLINE.countIn(buffer);
        int threshold = lastEmittedRow;
        var emitted = new ArrayList<ExecutableStatement>();
        for (var node : root.children()) {
            if (!node.statementType().isExecutable() || node.endRow() <= threshold) {
                continue;
            }
            if (node.endRow() >= terminatedLines && !node.text().endsWith("\n")) {
                continue;
            }
            var statement = new ExecutableStatement(node, ++emittedCount);
            emitted.add(statement);
            lastEmittedRow = Math.max(lastEmittedRow, node.endRow());
            bus.publish(new SessionEvent.StatementReady(sessionId, statement));
        }
        if (!emitted.isEmpty()) {
            logger.debug("Session {}: emitted {} statement(s), {} total", sessionId, emitted.size(), emittedCount);
        }
        return emitted;
    }

    /** Root children of {@code current} that are not present, unchanged, among the root children of {@code previous}. */
    static List<SyntaxNode> changedNodes(@Nullable SyntaxNode previous, SyntaxNode current) {
        if (previous == null) {
            return current.children();
        }
        var before = new HashSet<>(previous.children());
        return current.children().stream().filter(node -> !before.contains(node)).toList();
    }

    private AppendOutcome fail(AppendOutcome.Stage stage, Exception e) {
        // the engine may already have edited the previous tree in place
        engineTree = null;
        logger.error("Session {}: {} failed on {} engine", sessionId, stage, engine.name(), e);
        var message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
        return new AppendOutcome.Failed(stage, message);
    }

    /** Discards all input and trees; statement numbering starts over. */
    public void reset() {
        buffer = "";
        bufferBytes = 0;
        engineTree = null;
        tree = null;
        hasErrors = false;
        classification = null;
        emittedCount = 0;
        lastEmittedRow = -1;
        logger.debug("Session {} reset", sessionId);
        bus.publish(new SessionEvent.SessionReset(sessionId));
    }

    /** Marks the end of input and publishes the final classification. Leaves state untouched. */
    public Optional<Classification> streamEnd() {
        logger.debug(
                "Session {}: stream ended, {}",
                sessionId,
                classification == null ? "nothing parsed" : classification.kind());
        bus.publish(new SessionEvent.StreamEnded(sessionId, classification));
        return Optional.ofNullable(classification);
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionConfig config() {
        return config;
    }

    public String accumulatedInput() {
        return buffer;
    }

    /** Buffered input size in UTF-8 bytes. */
    public int bufferSize() {
        return bufferBytes;
    }

    public Optional<SyntaxNode> currentTree() {
        return Optional.ofNullable(tree);
    }

    public boolean hasErrors() {
        return hasErrors;
    }

    public Optional<Classification> classification() {
        return Optional.ofNullable(classification);
    }

    public int emittedCount() {
        return emittedCount;
    }

    /** End row of the last emitted statement, -1 when nothing has been emitted. */
    public int lastEmittedRow() {
        return lastEmittedRow;
    }

    @Override
    public void close() {
        engine.close();
    }
}
