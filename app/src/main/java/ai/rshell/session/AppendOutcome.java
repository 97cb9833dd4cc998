package ai.rshell.session;

import ai.rshell.parse.Classification;
import ai.rshell.parser.SourceRange;
import ai.rshell.parser.SyntaxNode;
import java.util.List;

/** Result of {@link ParseSession#append(String)}. Exactly one is produced per call. */
public sealed interface AppendOutcome permits AppendOutcome.Updated, AppendOutcome.Rejected, AppendOutcome.Failed {

    /**
     * The fragment was appended and parsed.
     *
     * @param tree the full tree for the accumulated input
     * @param classification completeness of the accumulated input
     * @param changedNodes top-level nodes that are new or differ from the previous tree
     * @param statements statements that became executable with this fragment, in emission order
     */
    record Updated(
            SyntaxNode tree,
            Classification classification,
            List<SyntaxNode> changedNodes,
            List<ExecutableStatement> statements)
            implements AppendOutcome {

        public Updated {
            changedNodes = List.copyOf(changedNodes);
            statements = List.copyOf(statements);
        }

        public List<String> changedNodeIds() {
            return changedNodes.stream().map(SyntaxNode::id).toList();
        }

        public List<SourceRange> changedRanges() {
            return changedNodes.stream().map(SyntaxNode::range).toList();
        }
    }

    enum RejectionReason {
        BUFFER_OVERFLOW
    }

    /**
     * The fragment was refused before touching session state. Sizes are UTF-8 bytes.
     */
    record Rejected(RejectionReason reason, int currentSize, int fragmentSize, int maxSize) implements AppendOutcome {}

    enum Stage {
        PARSE,
        CONVERT
    }

    /**
     * The engine or the tree conversion failed unexpectedly. Session state is as it was before the call.
     */
    record Failed(Stage stage, String message) implements AppendOutcome {}
}
