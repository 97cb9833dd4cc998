package ai.rshell.input;

/**
 * A lexical unit of shell input.
 *
 * @param kind token class
 * @param value for words, the text with quotes and escapes removed; for operators, the operator itself
 * @param quoted whether any part of a word was quoted or escaped. Quoted words are never reserved words.
 * @param offset char offset of the first character in the scanned text
 */
record ShellToken(Kind kind, String value, boolean quoted, int offset) {

    enum Kind {
        WORD,
        OPERATOR,
        NEWLINE
    }

    static ShellToken word(String value, boolean quoted, int offset) {
        return new ShellToken(Kind.WORD, value, quoted, offset);
    }

    static ShellToken operator(String value, int offset) {
        return new ShellToken(Kind.OPERATOR, value, false, offset);
    }

    static ShellToken newline(int offset) {
        return new ShellToken(Kind.NEWLINE, "\n", false, offset);
    }

    /** An unquoted word spelled exactly {@code keyword}. */
    boolean isReserved(String keyword) {
        return kind == Kind.WORD && !quoted && value.equals(keyword);
    }
}
