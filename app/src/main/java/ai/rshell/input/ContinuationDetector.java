package ai.rshell.input;

/**
 * Decides whether buffered shell text is syntactically closeable as-is or needs more input.
 *
 * <p>Stateless and side-effect free, so it can be called speculatively (per keystroke). When several signals are
 * open at once the result reports, in order: line continuation, open quote, open heredoc, open structures.
 */
public final class ContinuationDetector {

    private ContinuationDetector() {}

    public static Continuation detect(String input) {
        var scan = ShellLexer.scan(input);
        var tracker = new StructureTracker();
        for (var token : scan.tokens()) {
            tracker.accept(token);
        }
        var openStructures = tracker.openStructures();
        var heredoc = scan.openHeredoc();

        ContinuationState state;
        if (scan.trailingEscape()) {
            state = ContinuationState.LINE_CONTINUATION;
        } else if (scan.openQuote() != QuoteMode.NONE) {
            state = ContinuationState.QUOTE_CONTINUATION;
        } else if (heredoc != null) {
            state = ContinuationState.HEREDOC_CONTINUATION;
        } else if (!openStructures.isEmpty()) {
            state = ContinuationState.STRUCTURE_CONTINUATION;
        } else {
            state = ContinuationState.COMPLETE;
        }
        return new Continuation(state, openStructures, scan.openQuote(), heredoc == null ? null : heredoc.delimiter());
    }

    public static boolean isReady(String input) {
        return detect(input).isComplete();
    }
}
