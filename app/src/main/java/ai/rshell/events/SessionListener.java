package ai.rshell.events;

/**
 * Receives session events. Called synchronously on the thread that drives the session, so implementations should
 * hand off anything slow.
 */
@FunctionalInterface
public interface SessionListener {

    void onEvent(SessionEvent event);
}
