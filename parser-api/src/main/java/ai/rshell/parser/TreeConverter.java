package ai.rshell.parser;

/** Maps an engine's native tree to the engine-independent {@link SyntaxNode} model. */
@FunctionalInterface
public interface TreeConverter<T> {

    SyntaxNode convert(T tree, String source);
}
