package ai.rshell.events;

/** Channels of a session's event stream. */
public enum Topic {
    /** A re-parse finished: {@link SessionEvent.TreeUpdated}. */
    TREE,
    /** A top-level statement became executable: {@link SessionEvent.StatementReady}. */
    STATEMENTS,
    /** One per append call, whatever happened: {@link SessionEvent.AppendFinished}. */
    OUTCOMES,
    /** Reset and end-of-stream markers. */
    LIFECYCLE
}
