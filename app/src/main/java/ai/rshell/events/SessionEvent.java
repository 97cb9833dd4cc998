package ai.rshell.events;

import ai.rshell.parse.Classification;
import ai.rshell.parser.SyntaxNode;
import ai.rshell.session.AppendOutcome;
import ai.rshell.session.ExecutableStatement;
import org.jetbrains.annotations.Nullable;

/** Something that happened in one parse session. */
public sealed interface SessionEvent
        permits SessionEvent.TreeUpdated,
                SessionEvent.StatementReady,
                SessionEvent.AppendFinished,
                SessionEvent.SessionReset,
                SessionEvent.StreamEnded {

    String sessionId();

    Topic topic();

    record TreeUpdated(String sessionId, SyntaxNode tree, Classification classification) implements SessionEvent {
        @Override
        public Topic topic() {
            return Topic.TREE;
        }
    }

    record StatementReady(String sessionId, ExecutableStatement statement) implements SessionEvent {
        @Override
        public Topic topic() {
            return Topic.STATEMENTS;
        }
    }

    record AppendFinished(String sessionId, AppendOutcome outcome) implements SessionEvent {
        @Override
        public Topic topic() {
            return Topic.OUTCOMES;
        }
    }

    record SessionReset(String sessionId) implements SessionEvent {
        @Override
        public Topic topic() {
            return Topic.LIFECYCLE;
        }
    }

    /**
     * The caller signalled that no more input will follow.
     *
     * @param classification classification of the final buffer, null if nothing was ever parsed
     */
    record StreamEnded(String sessionId, @Nullable Classification classification) implements SessionEvent {
        @Override
        public Topic topic() {
            return Topic.LIFECYCLE;
        }
    }
}
