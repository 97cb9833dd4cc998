package ai.rshell.treesitter;

import ai.rshell.parser.ParseEngineException;
import ai.rshell.parser.ParsedTree;
import ai.rshell.parser.ParsingEngine;
import com.google.common.base.Utf8;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSInputEdit;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterBash;

/**
 * Bash grammar engine backed by Tree-sitter. Each instance owns a private {@link TSParser}; instances must not be
 * shared between sessions.
 *
 * <p>Re-parses describe the appended text to the previous tree with a {@link TSInputEdit}, so Tree-sitter reuses
 * every subtree that the append did not touch.
 */
public final class TreeSitterBashEngine implements ParsingEngine<TSTree> {
    private static final Logger log = LogManager.getLogger(TreeSitterBashEngine.class);
    // Native library loading is assumed automatic by the io.github.bonede.tree_sitter library.

    // null once closed
    private @Nullable TSParser parser;

    public TreeSitterBashEngine() {
        parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterBash())) {
            log.error("Failed to set language on TSParser for bash");
            throw new IllegalStateException("Tree-sitter rejected the bash grammar");
        }
    }

    @Override
    public ParsedTree<TSTree> reparse(@Nullable TSTree previousTree, String previousSource, String source)
            throws ParseEngineException {
        var parser = this.parser;
        if (parser == null) {
            throw new ParseEngineException("Engine is closed");
        }
        if (previousTree != null && !source.startsWith(previousSource)) {
            throw new ParseEngineException("Source does not extend the previously parsed text");
        }
        @Nullable TSTree tree;
        try {
            if (previousTree != null) {
                previousTree.edit(appendEdit(previousSource, source));
            }
            tree = parser.parseString(previousTree, source);
        } catch (RuntimeException e) {
            throw new ParseEngineException("Tree-sitter failed on %d chars of input".formatted(source.length()), e);
        }
        if (tree == null) {
            throw new ParseEngineException("Tree-sitter returned no tree");
        }
        var root = tree.getRootNode();
        if (root.isNull()) {
            throw new ParseEngineException("Tree-sitter produced a null root node");
        }
        log.trace("Parsed {} chars (incremental: {}), root {} hasError={}",
                source.length(), previousTree != null, root.getType(), root.hasError());
        return new ParsedTree<>(tree, root.hasError());
    }

    /** The edit that turns {@code previousSource} into {@code source} by appending. */
    static TSInputEdit appendEdit(String previousSource, String source) {
        int oldEndByte = Utf8.encodedLength(previousSource);
        int newEndByte = Utf8.encodedLength(source);
        var oldEnd = SourceText.endPoint(previousSource);
        return new TSInputEdit(oldEndByte, oldEndByte, newEndByte, oldEnd, oldEnd, SourceText.endPoint(source));
    }

    /**
     * Releases the parser. The binding frees native parsers and trees once they are unreachable, so dropping the
     * reference is all that is needed; later {@link #reparse} calls fail.
     */
    @Override
    public void close() {
        if (parser != null) {
            parser = null;
            log.debug("Closed {} engine", name());
        }
    }

    @Override
    public String name() {
        return "tree-sitter-bash";
    }
}
