package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frame timestamps carried in file names.
 *
 * <p>Radar frames are stored as {@code radar_ba_YYYYMMDD_HHMMSS.<ext>}; composites are written as
 * {@code enhanced_weather_YYYYMMDD_HHMMSS.png}. The timestamp in the radar name is interpreted as UTC
 * when matched against satellite sensing times.</p>
 */
public final class FrameTimestamps {
    private static final Logger logger = LoggerFactory.getLogger(FrameTimestamps.class);

    private static final Pattern RADAR_NAME = Pattern.compile("^radar_ba_(\\d{8})_(\\d{6})(\\.[^.]+)?$");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);
    private static final DateTimeFormatter TITLE = DateTimeFormatter.ofPattern("d MMM yyyy HH:mm", Locale.ENGLISH);

    public static final String OUTPUT_PREFIX = "enhanced_weather_";

    private FrameTimestamps() {
    }

    /**
     * Parses the timestamp of a radar frame file name.
     *
     * @param fileName bare file name or path
     * @return the timestamp, or empty if the name does not follow the radar naming scheme
     */
    public static Optional<LocalDateTime> parseRadarFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Path name = Path.of(fileName).getFileName();
        Matcher m = RADAR_NAME.matcher(name == null ? fileName : name.toString());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(m.group(1) + "_" + m.group(2), STAMP));
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring radar file name with invalid date: {}", fileName);
            return Optional.empty();
        }
    }

    /**
     * @return {@code YYYYMMDD_HHMMSS}
     */
    public static String stamp(LocalDateTime time) {
        return STAMP.format(time);
    }

    /**
     * @return {@code enhanced_weather_YYYYMMDD_HHMMSS.png}
     */
    public static String outputFileName(LocalDateTime time) {
        return OUTPUT_PREFIX + stamp(time) + ".png";
    }

    /**
     * Composite title, e.g. {@code radar + meteosat: #12 Jul 2025 16:14 CET}.
     */
    public static String title(LocalDateTime time) {
        return "radar + meteosat: #" + TITLE.format(time) + " CET";
    }

    public static Instant toInstant(LocalDateTime time) {
        return time.toInstant(ZoneOffset.UTC);
    }
}
