package ai.rshell.session;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Per-session settings.
 *
 * @param maxBufferBytes largest accumulated input, in UTF-8 bytes, a session accepts
 * @param emitStatements whether executable statements are published; tree updates and outcomes always are
 */
public record SessionConfig(int maxBufferBytes, boolean emitStatements) {
    private static final Logger logger = LogManager.getLogger(SessionConfig.class);

    public static final int DEFAULT_MAX_BUFFER_BYTES = 10 * 1024 * 1024;
    public static final String RESOURCE = "rshell.properties";

    static final String KEY_MAX_BUFFER_BYTES = "rshell.maxBufferBytes";
    static final String KEY_EMIT_STATEMENTS = "rshell.emitStatements";

    public SessionConfig {
        if (maxBufferBytes <= 0) {
            throw new IllegalArgumentException("maxBufferBytes must be > 0, was " + maxBufferBytes);
        }
    }

    public static SessionConfig defaults() {
        return new SessionConfig(DEFAULT_MAX_BUFFER_BYTES, true);
    }

    /**
     * Defaults, overridden by the classpath {@value #RESOURCE}, overridden by {@code rshell.*} system properties.
     */
    public static SessionConfig load() {
        var props = new Properties();
        try (InputStream in = SessionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", RESOURCE, e.getMessage());
        }
        for (var key : new String[] {KEY_MAX_BUFFER_BYTES, KEY_EMIT_STATEMENTS}) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    /** Reads the {@code rshell.*} keys; missing or malformed values fall back to the defaults. */
    public static SessionConfig fromProperties(Properties props) {
        var defaults = defaults();
        int maxBytes = parseInt(props.getProperty(KEY_MAX_BUFFER_BYTES), defaults.maxBufferBytes());
        boolean emit = parseBoolean(props.getProperty(KEY_EMIT_STATEMENTS), defaults.emitStatements());
        return new SessionConfig(maxBytes, emit);
    }

    public SessionConfig withMaxBufferBytes(int maxBufferBytes) {
        return new SessionConfig(maxBufferBytes, emitStatements);
    }

    public SessionConfig withEmitStatements(boolean emitStatements) {
        return new SessionConfig(maxBufferBytes, emitStatements);
    }

    private static int parseInt(@Nullable String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) {
                return value;
            }
            logger.warn("Ignoring non-positive {}={}", KEY_MAX_BUFFER_BYTES, raw);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed {}={}", KEY_MAX_BUFFER_BYTES, raw);
        }
        return fallback;
    }

    private static boolean parseBoolean(@Nullable String raw, boolean fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> {
                logger.warn("Ignoring malformed {}={}", KEY_EMIT_STATEMENTS, raw);
                yield fallback;
            }
        };
    }
}
