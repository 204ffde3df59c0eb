package work.lcod.layout.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.layout.api.LogLevel;

class MainTest {
    private String saved;

    @BeforeEach
    void saveProperty() {
        saved = System.getProperty(LogLevel.SIMPLE_LOGGER_PROPERTY);
        System.clearProperty(LogLevel.SIMPLE_LOGGER_PROPERTY);
    }

    @AfterEach
    void restoreProperty() {
        if (saved == null) {
            System.clearProperty(LogLevel.SIMPLE_LOGGER_PROPERTY);
        } else {
            System.setProperty(LogLevel.SIMPLE_LOGGER_PROPERTY, saved);
        }
    }

    @Test
    void appliesLogLevelGivenAsSeparateArgument() {
        var level = Main.applyLogLevel("-d", "doc.yaml", "--log-level", "Debug");

        assertEquals(Optional.of(LogLevel.DEBUG), level);
        assertEquals("debug", System.getProperty(LogLevel.SIMPLE_LOGGER_PROPERTY));
    }

    @Test
    void appliesLogLevelGivenWithEquals() {
        var level = Main.applyLogLevel("--log-level=trace", "-d", "doc.yaml");

        assertEquals(Optional.of(LogLevel.TRACE), level);
        assertEquals("trace", System.getProperty(LogLevel.SIMPLE_LOGGER_PROPERTY));
    }

    @Test
    void leavesUnknownLevelToTheCommand() {
        assertTrue(Main.applyLogLevel("--log-level", "loud").isEmpty());
        assertTrue(Main.applyLogLevel("-d", "doc.yaml", "--log-level").isEmpty());
        assertNull(System.getProperty(LogLevel.SIMPLE_LOGGER_PROPERTY));
    }

    @Test
    void executeAppliesLevelBeforeRunningTheCommand() {
        int exit = Main.execute("--log-level", "error", "-d", "src/test/resources/documents/invalid.yaml");

        assertEquals(1, exit);
        assertEquals("error", System.getProperty(LogLevel.SIMPLE_LOGGER_PROPERTY));
    }
}
