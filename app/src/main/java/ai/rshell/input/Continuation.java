package ai.rshell.input;

import ai.rshell.parser.Opener;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Result of {@link ContinuationDetector#detect(String)}.
 *
 * @param state the highest-priority reason more input is needed, or {@link ContinuationState#COMPLETE}
 * @param openStructures structures still waiting for a closer, outermost first
 * @param openQuote quote mode at end of input
 * @param heredocDelimiter terminator of the first unterminated heredoc, if any
 */
public record Continuation(
        ContinuationState state, List<Opener> openStructures, QuoteMode openQuote, @Nullable String heredocDelimiter) {

    public Continuation {
        openStructures = List.copyOf(openStructures);
    }

    public boolean isComplete() {
        return state == ContinuationState.COMPLETE;
    }

    /** The closing keyword of the innermost open structure. */
    public Optional<String> awaitedCloser() {
        if (openStructures.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(openStructures.get(openStructures.size() - 1).closer());
    }
}
