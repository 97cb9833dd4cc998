package ai.rshell.session;

/** Thrown when an operation names a session that is not open. */
public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(String sessionId) {
        super("No open session '%s'".formatted(sessionId));
    }
}
