package radarsat.composite.utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RunLoggerTest {

    private static final Logger logger = LoggerFactory.getLogger(RunLoggerTest.class);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Events logged during a session land in composite.log")
    void testRunLogWritten() throws IOException {
        Path runDir = tempDir.resolve("run-1");
        try (RunLogger.Session session = RunLogger.start(runDir)) {
            assertTrue(session.isActive());
            assertEquals(runDir.resolve(RunLogger.LOG_FILE_NAME), session.getFile());
            logger.warn("frame radar_ba_20250712_161400.gif skipped");
        }
        Path file = runDir.resolve(RunLogger.LOG_FILE_NAME);
        assertTrue(Files.exists(file));
        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(content.contains("frame radar_ba_20250712_161400.gif skipped"), content);
    }

    @Test
    @DisplayName("Events after close are not written")
    void testDetachedOnClose() throws IOException {
        RunLogger.Session session = RunLogger.start(tempDir);
        session.close();
        assertFalse(session.isActive());
        logger.warn("after close");
        String content = Files.readString(session.getFile(), StandardCharsets.UTF_8);
        assertFalse(content.contains("after close"));
    }
}
