package ai.rshell.input;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Single-pass tokenizer for shell input. Splits text into words, operators and newlines while tracking the lexical
 * state that decides whether the text could be handed to the parser: an open quote, an unterminated heredoc body
 * and a trailing unescaped backslash.
 *
 * <p>Comments are dropped. Heredoc bodies are consumed here and never reach the token stream, so keywords inside a
 * body do not affect structure matching. {@code $(...)} substitutions are kept inside the surrounding word.
 */
final class ShellLexer {

    // longest match first
    private static final List<String> OPERATORS = List.of(
            ";;&", "<<<", "<<-", ";;", ";&", "&&", "||", "|&", "<<", ">>", "<&", ">&", "<>", ">|", "&>", ";", "&", "|",
            "<", ">", "(", ")");

    /** A heredoc whose delimiter has been read. */
    record Heredoc(String delimiter, boolean stripIndent) {

        boolean terminatedBy(String line) {
            var candidate = stripIndent ? line.stripLeading() : line;
            return candidate.equals(delimiter);
        }
    }

    /**
     * Outcome of a scan.
     *
     * @param tokens tokens in input order
     * @param openQuote the quote left open at end of input
     * @param openHeredoc the first heredoc whose terminator line has not appeared
     * @param trailingEscape whether the input ends with a backslash that escapes the (possibly absent) final newline
     */
    record Result(List<ShellToken> tokens, QuoteMode openQuote, @Nullable Heredoc openHeredoc, boolean trailingEscape) {}

    private final String text;
    private final int length;
    private int pos;

    private final List<ShellToken> tokens = new ArrayList<>();
    private final Deque<Heredoc> pendingHeredocs = new ArrayDeque<>();
    private @Nullable Heredoc openHeredoc;
    private @Nullable String heredocOperator;
    private QuoteMode openQuote = QuoteMode.NONE;
    private boolean trailingEscape;

    ShellLexer(String text) {
        this.text = text;
        this.length = text.length();
    }

    static Result scan(String text) {
        return new ShellLexer(text).run();
    }

    private Result run() {
        while (pos < length && openHeredoc == null) {
            char c = text.charAt(pos);
            if (c == '\n') {
                tokens.add(ShellToken.newline(pos));
                pos++;
                heredocOperator = null;
                if (!pendingHeredocs.isEmpty()) {
                    readHeredocBodies();
                }
            } else if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '\\' && pos + 1 < length && text.charAt(pos + 1) == '\n') {
                markEscapedNewline();
                pos += 2;
            } else if (c == '#') {
                skipComment();
            } else if (text.startsWith("((", pos)) {
                readArithmetic();
            } else {
                var op = matchOperator();
                if (op != null) {
                    tokens.add(ShellToken.operator(op, pos));
                    pos += op.length();
                    heredocOperator = op.equals("<<") || op.equals("<<-") ? op : null;
                } else {
                    readWord();
                }
            }
        }
        if (openHeredoc == null && !pendingHeredocs.isEmpty()) {
            // the redirect line itself has not been terminated yet
            openHeredoc = pendingHeredocs.peekFirst();
        }
        return new Result(List.copyOf(tokens), openQuote, openHeredoc, trailingEscape);
    }

    private @Nullable String matchOperator() {
        for (var op : OPERATORS) {
            if (text.startsWith(op, pos)) {
                return op;
            }
        }
        return null;
    }

    private static boolean isWordBreak(char c) {
        return switch (c) {
            case ' ', '\t', '\r', '\n', ';', '&', '|', '<', '>', '(', ')' -> true;
            default -> false;
        };
    }

    private void readWord() {
        int start = pos;
        var value = new StringBuilder();
        boolean quoted = false;
        while (pos < length) {
            char c = text.charAt(pos);
            if (isWordBreak(c)) {
                break;
            }
            if (c == '\\') {
                quoted = true;
                if (pos + 1 >= length) {
                    trailingEscape = true;
                    pos++;
                    break;
                }
                char next = text.charAt(pos + 1);
                if (next == '\n') {
                    markEscapedNewline();
                } else {
                    value.append(next);
                }
                pos += 2;
            } else if (c == '\'') {
                quoted = true;
                int close = text.indexOf('\'', pos + 1);
                if (close < 0) {
                    value.append(text, pos + 1, length);
                    pos = length;
                    openQuote = QuoteMode.SINGLE;
                    break;
                }
                value.append(text, pos + 1, close);
                pos = close + 1;
            } else if (c == '"') {
                quoted = true;
                pos++;
                if (!readDoubleQuoted(value)) {
                    openQuote = QuoteMode.DOUBLE;
                    break;
                }
            } else if (c == '$' && pos + 1 < length && text.charAt(pos + 1) == '(') {
                readSubstitution(value);
            } else {
                value.append(c);
                pos++;
            }
        }
        addWord(value.toString(), quoted, start);
    }

    private void addWord(String value, boolean quoted, int start) {
        tokens.add(ShellToken.word(value, quoted, start));
        if (heredocOperator != null) {
            pendingHeredocs.addLast(new Heredoc(value, heredocOperator.equals("<<-")));
            heredocOperator = null;
        }
    }

    /**
     * Reads up to and including the closing double quote. {@code pos} starts just after the opening quote.
     *
     * @return false if input ended before the closing quote
     */
    private boolean readDoubleQuoted(StringBuilder value) {
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\\') {
                if (pos + 1 >= length) {
                    trailingEscape = true;
                    pos++;
                    return false;
                }
                char next = text.charAt(pos + 1);
                if (next == '\n') {
                    markEscapedNewline();
                } else {
                    value.append(next);
                }
                pos += 2;
            } else if (c == '"') {
                pos++;
                return true;
            } else if (c == '$' && pos + 1 < length && text.charAt(pos + 1) == '(') {
                readSubstitution(value);
            } else {
                value.append(c);
                pos++;
            }
        }
        return false;
    }

    /**
     * Consumes a balanced {@code $( ... )} or {@code $(( ... ))}. An unbalanced substitution runs to end of input.
     */
    private void readSubstitution(StringBuilder value) {
        value.append('$');
        pos++;
        int depth = 0;
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < length) {
                value.append(c).append(text.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '\'') {
                int close = text.indexOf('\'', pos + 1);
                int end = close < 0 ? length : close + 1;
                value.append(text, pos, end);
                pos = end;
                continue;
            }
            if (c == '"') {
                pos++;
                if (!readDoubleQuoted(value)) {
                    return;
                }
                continue;
            }
            value.append(c);
            pos++;
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return;
            }
        }
    }

    /**
     * Consumes a {@code (( ... ))} arithmetic command as one quoted word, so operators such as {@code <<} inside it
     * are neither redirects nor heredocs. An unbalanced group runs to end of input.
     */
    private void readArithmetic() {
        int start = pos;
        int depth = 0;
        while (pos < length) {
            char c = text.charAt(pos++);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                break;
            }
        }
        heredocOperator = null;
        tokens.add(ShellToken.word(text.substring(start, pos), true, start));
    }

    private void skipComment() {
        int eol = text.indexOf('\n', pos);
        pos = eol < 0 ? length : eol;
    }

    /** Called with {@code pos} on a backslash that is followed by a newline. */
    private void markEscapedNewline() {
        if (pos + 2 == length) {
            trailingEscape = true;
        }
    }

    /** Consumes heredoc bodies queued on the line that just ended. */
    private void readHeredocBodies() {
        while (!pendingHeredocs.isEmpty()) {
            var heredoc = pendingHeredocs.peekFirst();
            boolean terminated = false;
            while (pos < length) {
                int eol = text.indexOf('\n', pos);
                int lineEnd = eol < 0 ? length : eol;
                var line = text.substring(pos, lineEnd);
                pos = eol < 0 ? length : eol + 1;
                if (heredoc.terminatedBy(line)) {
                    terminated = true;
                    break;
                }
            }
            if (!terminated) {
                openHeredoc = heredoc;
                return;
            }
            pendingHeredocs.removeFirst();
        }
    }
}
