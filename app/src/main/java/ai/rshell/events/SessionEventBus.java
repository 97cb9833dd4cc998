package ai.rshell.events;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Publish/subscribe fan-out with one channel per session and topic.
 *
 * <p>Delivery is synchronous: {@link #publish} returns after every listener subscribed at that moment has seen the
 * event, in subscription order. Events published before a listener subscribed are not replayed. A listener that
 * throws is logged and skipped; the remaining listeners still receive the event.
 */
public final class SessionEventBus {
    private static final Logger logger = LogManager.getLogger(SessionEventBus.class);

    private record Channel(String sessionId, Topic topic) {}

    private final ConcurrentHashMap<Channel, CopyOnWriteArrayList<SessionListener>> channels =
            new ConcurrentHashMap<>();

    public Subscription subscribe(String sessionId, SessionListener listener) {
        return subscribe(sessionId, EnumSet.allOf(Topic.class), listener);
    }

    public Subscription subscribe(String sessionId, Set<Topic> topics, SessionListener listener) {
        if (topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        var subscribed = List.copyOf(topics);
        for (var topic : subscribed) {
            channels.computeIfAbsent(new Channel(sessionId, topic), k -> new CopyOnWriteArrayList<>())
                    .add(listener);
        }
        logger.debug("Subscribed listener to session {} topics {}", sessionId, subscribed);
        return () -> {
            for (var topic : subscribed) {
                var listeners = channels.get(new Channel(sessionId, topic));
                if (listeners != null) {
                    listeners.remove(listener);
                }
            }
        };
    }

    public void publish(SessionEvent event) {
        var listeners = channels.get(new Channel(event.sessionId(), event.topic()));
        if (listeners == null || listeners.isEmpty()) {
            return;
        }
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.error(
                        "Listener {} failed on {} for session {}",
                        listener,
                        event.getClass().getSimpleName(),
                        event.sessionId(),
                        e);
            }
        }
    }

    public int subscriberCount(String sessionId, Topic topic) {
        var listeners = channels.get(new Channel(sessionId, topic));
        return listeners == null ? 0 : listeners.size();
    }

    /** Drops every subscription of a session. */
    public void closeSession(String sessionId) {
        channels.keySet().removeIf(channel -> channel.sessionId().equals(sessionId));
    }
}
