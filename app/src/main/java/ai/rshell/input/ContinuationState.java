package ai.rshell.input;

/** Why buffered shell input can or cannot be handed to the parser yet. Declared in priority order. */
public enum ContinuationState {
    /** Trailing unescaped backslash-newline. */
    LINE_CONTINUATION,
    /** An unterminated single- or double-quoted region. */
    QUOTE_CONTINUATION,
    /** A {@code <<} or {@code <<-} redirect whose terminator line has not appeared. */
    HEREDOC_CONTINUATION,
    /** One or more unmatched if/for/while/until/case openers. */
    STRUCTURE_CONTINUATION,
    COMPLETE
}
