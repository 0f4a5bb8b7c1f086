package radarsat.composite.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-run log files.
 *
 * <p>While a session is open every log event is also written to {@code <directory>/composite.log},
 * next to the composites the run produces:</p>
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(outputDir)) {
 *     runner.run(frames);
 * } // appender detached and file closed
 * }</pre>
 *
 * <p>Sessions are independent: each one attaches its own appender to the root logger, so two batch runs
 * writing into different directories do not interfere.</p>
 *
 * @since 0.3.0
 */
public class RunLogger {
    private static final Logger logger = LoggerFactory.getLogger(RunLogger.class);

    public static final String LOG_FILE_NAME = "composite.log";
    static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private RunLogger() {
    }

    /**
     * Starts writing a run log into the given directory, creating it if needed.
     *
     * @param directory run output directory
     * @return the open session; inactive if Logback is not the SLF4J binding
     * @throws IOException if the directory cannot be created
     */
    public static Session start(Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(LOG_FILE_NAME);

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            logger.warn("Run log requires Logback, found {}; {} will not be written",
                    factory.getClass().getName(), file);
            return new Session(null, null, file);
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("RUN_LOG:" + file.toAbsolutePath());
        appender.setFile(file.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        logger.info("Run log enabled: {}", file);
        return new Session(root, appender, file);
    }

    /**
     * Open run log; closing it detaches and stops the file appender.
     */
    public static final class Session implements AutoCloseable {
        private final ch.qos.logback.classic.Logger root;
        private final FileAppender<ILoggingEvent> appender;
        private final Path file;

        private Session(ch.qos.logback.classic.Logger root, FileAppender<ILoggingEvent> appender, Path file) {
            this.root = root;
            this.appender = appender;
            this.file = file;
        }

        public boolean isActive() {
            return appender != null && appender.isStarted();
        }

        public Path getFile() {
            return file;
        }

        @Override
        public void close() {
            if (appender == null) {
                return;
            }
            logger.info("Run log closed: {}", file);
            root.detachAppender(appender);
            appender.stop();
        }
    }
}
