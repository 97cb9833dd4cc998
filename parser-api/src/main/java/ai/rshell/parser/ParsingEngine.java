package ai.rshell.parser;

import org.jetbrains.annotations.Nullable;

/**
 * An incremental grammar engine. Instances are stateful and are never shared between sessions.
 *
 * @param <T> the engine's native tree type
 */
public interface ParsingEngine<T> extends AutoCloseable {

    /**
     * Parses {@code source}, which is {@code previousSource} with text appended to it.
     *
     * @param previousTree the tree returned for {@code previousSource}, or null for a full parse. Implementations
     *     may mutate it; callers must not reuse it afterwards.
     * @param previousSource the text {@code previousTree} was built from (empty when there is none)
     * @param source the complete text to parse
     */
    ParsedTree<T> reparse(@Nullable T previousTree, String previousSource, String source)
            throws ParseEngineException;

    /** Engine name for diagnostics. */
    String name();

    @Override
    default void close() {}
}
