package ai.rshell.input;

/** Quoting context at a point in shell input. */
public enum QuoteMode {
    NONE,
    /** Inside '...': nothing is escaped. */
    SINGLE,
    /** Inside "...": a backslash escapes the next character. */
    DOUBLE
}
