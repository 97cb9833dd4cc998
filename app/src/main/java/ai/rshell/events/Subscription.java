package ai.rshell.events;

/** Handle returned by {@link SessionEventBus#subscribe}; closing it detaches the listener. Idempotent. */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
