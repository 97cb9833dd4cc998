package ai.rshell.parser;

/**
 * Raw engine output.
 *
 * @param tree the engine's native tree, to be handed back on the next re-parse
 * @param hasErrors the whole-tree error flag; set both for genuine errors and for unfinished input
 */
public record ParsedTree<T>(T tree, boolean hasErrors) {}
