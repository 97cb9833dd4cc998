package ai.rshell.session;

import ai.rshell.events.SessionEventBus;

/** Creates the session (and its private engine) behind a session id. */
@FunctionalInterface
public interface SessionFactory {

    ParseSession<?> create(String sessionId, SessionConfig config, SessionEventBus bus);
}
