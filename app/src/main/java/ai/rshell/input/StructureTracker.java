package ai.rshell.input;

import ai.rshell.parser.Opener;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Push-down automaton over {@link ShellToken}s that keeps the stack of compound statements still waiting for their
 * closing keyword.
 *
 * <p>Reserved words only count in command position: at the start of input, after a command separator, or after a
 * reserved word that introduces a command list. Arguments, redirect targets, quoted words and case patterns are
 * never openers.
 */
final class StructureTracker {

    private static final Set<String> CASE_TERMINATORS = Set.of(";;", ";&", ";;&");
    private static final Set<String> REDIRECTS = Set.of("<", ">", ">>", "<&", ">&", "<>", ">|", "&>", "<<", "<<-", "<<<");
    // reserved words after which the next word is again a command name
    private static final Set<String> COMMAND_PREFIXES = Set.of("then", "do", "else", "elif", "!", "time", "{");

    private final Deque<Opener> stack = new ArrayDeque<>();
    private boolean commandPosition = true;
    private boolean redirectTarget;
    private boolean awaitingCaseIn;
    private boolean casePattern;
    private FunctionHeader functionHeader = FunctionHeader.NONE;

    // 'function' NAME ['(' ')'] BODY; the body starts in command position
    private enum FunctionHeader {
        NONE,
        AWAITING_NAME,
        AWAITING_BODY
    }

    void accept(ShellToken token) {
        switch (token.kind()) {
            case NEWLINE -> onNewline();
            case OPERATOR -> onOperator(token.value());
            case WORD -> onWord(token);
        }
    }

    /** Open structures, outermost first. */
    List<Opener> openStructures() {
        var outermostFirst = new ArrayList<>(stack);
        Collections.reverse(outermostFirst);
        return outermostFirst;
    }

    private void onNewline() {
        redirectTarget = false;
        if (!awaitingCaseIn && !casePattern) {
            commandPosition = true;
        }
    }

    private void onOperator(String op) {
        if (functionHeader == FunctionHeader.AWAITING_BODY && (op.equals("(") || op.equals(")"))) {
            return;
        }
        functionHeader = FunctionHeader.NONE;
        if (REDIRECTS.contains(op)) {
            redirectTarget = true;
            return;
        }
        redirectTarget = false;
        if (casePattern) {
            // '(' and '|' are part of the pattern list
            if (op.equals(")")) {
                casePattern = false;
                commandPosition = true;
            }
            return;
        }
        if (CASE_TERMINATORS.contains(op)) {
            commandPosition = false;
            casePattern = stack.peek() == Opener.CASE;
            return;
        }
        commandPosition = true;
    }

    private void onWord(ShellToken token) {
        if (redirectTarget) {
            redirectTarget = false;
            return;
        }
        if (awaitingCaseIn) {
            if (token.isReserved("in")) {
                awaitingCaseIn = false;
                casePattern = true;
            }
            return;
        }
        if (functionHeader == FunctionHeader.AWAITING_NAME) {
            functionHeader = FunctionHeader.AWAITING_BODY;
            return;
        }
        if (functionHeader == FunctionHeader.AWAITING_BODY) {
            functionHeader = FunctionHeader.NONE;
            commandPosition = true;
        }
        if (casePattern) {
            if (token.isReserved("esac")) {
                close("esac");
                casePattern = false;
                commandPosition = false;
            }
            return;
        }
        if (!commandPosition) {
            return;
        }
        if (token.quoted()) {
            commandPosition = false;
            return;
        }

        var word = token.value();
        var opener = Opener.fromKeyword(word);
        if (opener.isPresent()) {
            stack.push(opener.get());
            switch (opener.get()) {
                case FOR -> commandPosition = false;
                case CASE -> {
                    commandPosition = false;
                    awaitingCaseIn = true;
                }
                default -> {
                    // condition list follows; still a command position
                }
            }
            return;
        }
        switch (word) {
            case "function" -> {
                functionHeader = FunctionHeader.AWAITING_NAME;
                commandPosition = false;
            }
            case "fi", "done", "esac" -> {
                close(word);
                commandPosition = false;
            }
            default -> commandPosition = COMMAND_PREFIXES.contains(word);
        }
    }

    /** Pops the innermost structure if {@code closer} matches it; a stray closer is left for the parser to report. */
    private void close(String closer) {
        var top = stack.peek();
        if (top != null && top.closedBy(closer)) {
            stack.pop();
        }
    }
}
