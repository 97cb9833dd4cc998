package ai.rshell.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class SessionConfigTest {

    @Test
    void defaults() {
        var config = SessionConfig.defaults();
        assertEquals(10 * 1024 * 1024, config.maxBufferBytes());
        assertTrue(config.emitStatements());
    }

    @Test
    void readsProperties() {
        var props = new Properties();
        props.setProperty("rshell.maxBufferBytes", " 2048 ");
        props.setProperty("rshell.emitStatements", "off");
        assertEquals(new SessionConfig(2048, false), SessionConfig.fromProperties(props));
    }

    @Test
    void malformedValuesFallBackToDefaults() {
        var props = new Properties();
        props.setProperty("rshell.maxBufferBytes", "lots");
        props.setProperty("rshell.emitStatements", "maybe");
        assertEquals(SessionConfig.defaults(), SessionConfig.fromProperties(props));

        props.setProperty("rshell.maxBufferBytes", "-5");
        assertEquals(SessionConfig.DEFAULT_MAX_BUFFER_BYTES, SessionConfig.fromProperties(props).maxBufferBytes());
    }

    @Test
    void systemPropertiesOverrideTheClasspathFile() {
        assertEquals(SessionConfig.defaults(), SessionConfig.load());

        System.setProperty("rshell.maxBufferBytes", "4096");
        try {
            var config = SessionConfig.load();
            assertEquals(4096, config.maxBufferBytes());
            assertTrue(config.emitStatements());
        } finally {
            System.clearProperty("rshell.maxBufferBytes");
        }
    }

    @Test
    void withersAndValidation() {
        var config = SessionConfig.defaults().withMaxBufferBytes(10).withEmitStatements(false);
        assertEquals(new SessionConfig(10, false), config);
        assertThrows(IllegalArgumentException.class, () -> new SessionConfig(0, true));
    }
}
