package ai.rshell.parser;

/** Raised by a {@link ParsingEngine} when it cannot produce a tree at all. */
public class ParseEngineException extends Exception {

    public ParseEngineException(String message) {
        super(message);
    }

    public ParseEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
