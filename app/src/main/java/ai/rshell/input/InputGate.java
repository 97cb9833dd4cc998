package ai.rshell.input;

import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Holds fragments until the {@link ContinuationDetector} reports the accumulated text as complete, then releases
 * the whole chunk at once. This is what an interactive front end does between a primary and a continuation
 * prompt. Not thread-safe.
 */
public final class InputGate {
    private static final Logger logger = LogManager.getLogger(InputGate.class);

    private final StringBuilder pending = new StringBuilder();
    private Continuation continuation = ContinuationDetector.detect("");

    /**
     * Adds a raw fragment.
     *
     * @return the accumulated text if it is now complete, in which case the gate is emptied
     */
    public Optional<String> offer(String fragment) {
        pending.append(fragment);
        continuation = ContinuationDetector.detect(pending.toString());
        if (!continuation.isComplete()) {
            logger.debug(
                    "Holding {} chars: {} {}",
                    pending.length(),
                    continuation.state(),
                    continuation.awaitedCloser().orElse(""));
            return Optional.empty();
        }
        var ready = pending.toString();
        pending.setLength(0);
        return Optional.of(ready);
    }

    /** Like {@link #offer(String)} for a line read without its terminator. */
    public Optional<String> offerLine(String line) {
        return offer(line.endsWith("\n") ? line : line + "\n");
    }

    /**
     * Puts a released chunk back in front of anything held since, for when its consumer refused it. The caller can
     * then inspect it with {@link #pending()} or drop it with {@link #clear()}.
     */
    public void restore(String released) {
        pending.insert(0, released);
        continuation = ContinuationDetector.detect(pending.toString());
        logger.debug("Restored {} chars, holding {}", released.length(), pending.length());
    }

    /** Why the gate is currently holding input; {@code COMPLETE} when empty. */
    public Continuation continuation() {
        return continuation;
    }

    public String pending() {
        return pending.toString();
    }

    public boolean isHolding() {
        return pending.length() > 0;
    }

    public void clear() {
        pending.setLength(0);
        continuation = ContinuationDetector.detect("");
    }
}
