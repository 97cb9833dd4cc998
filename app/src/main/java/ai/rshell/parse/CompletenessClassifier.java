package ai.rshell.parse;

import ai.rshell.parser.Opener;
import ai.rshell.parser.SyntaxNode;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tells apart a tree that is complete, one that is merely unfinished and one that contains a real syntax error.
 *
 * <p>The engine raises one whole-tree error flag for both unfinished and invalid input. The only reliable signal is
 * structural: an error-recovering grammar keeps a typed compound-statement node for a prefix that can still be
 * completed, but produces an {@code ERROR} node for text no completion can fix. An {@code ERROR} node anywhere in
 * the tree therefore always wins.
 */
public final class CompletenessClassifier {
    private static final Logger logger = LogManager.getLogger(CompletenessClassifier.class);

    private static final Classification COMPLETE = new Classification.Complete();

    private CompletenessClassifier() {}

    public static Classification classify(SyntaxNode root, boolean treeHasErrors) {
        var errorNode = smallestErrorNode(root);
        if (errorNode.isPresent()) {
            logger.trace("Error node at {}", errorNode.get().range());
            return new Classification.SyntaxError(errorNode.get());
        }
        if (treeHasErrors) {
            return new Classification.Incomplete(lastOpenStructure(root));
        }
        return COMPLETE;
    }

    /** First error node in pre-order, narrowed to the innermost error node nested inside it. */
    static Optional<SyntaxNode> smallestErrorNode(SyntaxNode root) {
        var found = root.findFirst(SyntaxNode::isError);
        if (found.isEmpty()) {
            return found;
        }
        var current = found.get();
        while (true) {
            var nested = current.children().stream()
                    .map(child -> child.findFirst(SyntaxNode::isError))
                    .flatMap(Optional::stream)
                    .findFirst();
            if (nested.isEmpty()) {
                return Optional.of(current);
            }
            current = nested.get();
        }
    }

    private static Opener lastOpenStructure(SyntaxNode root) {
        var children = root.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            var opener = children.get(i).statementType().opener();
            if (opener != null) {
                return opener;
            }
        }
        logger.debug("Tree flagged with errors but no compound statement at top level");
        return Opener.UNKNOWN;
    }
}
