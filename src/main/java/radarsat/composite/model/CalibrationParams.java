package radarsat.composite.model;

import radarsat.composite.errors.MissingCalibrationException;

import java.util.Locale;
import java.util.Map;

/**
 * Linear radiometric calibration of one band: {@code physical = offset + slope * raw}.
 * Values come from the satellite product metadata, never from code.
 *
 * @param offset additive term
 * @param slope multiplicative term
 */
public record CalibrationParams(double offset, double slope) {

    public CalibrationParams {
        if (!Double.isFinite(offset) || !Double.isFinite(slope)) {
            throw new IllegalArgumentException("Calibration coefficients must be finite");
        }
    }

    public float apply(float raw) {
        return (float) (offset + slope * raw);
    }

    /**
     * Metadata key holding the calibration pair of a band, e.g. {@code ch05_cal} for band 5.
     */
    public static String metadataKey(int band) {
        return String.format(Locale.ROOT, "ch%02d_cal", band);
    }

    /**
     * Parses the calibration pair of a band from product metadata. The entry holds
     * {@code "offset slope"} separated by whitespace.
     *
     * @param metadata product metadata
     * @param band 1-based band index
     * @return the parsed calibration
     * @throws MissingCalibrationException if the entry is absent or malformed
     */
    public static CalibrationParams fromMetadata(Map<String, String> metadata, int band)
            throws MissingCalibrationException {
        String key = metadataKey(band);
        String value = metadata == null ? null : metadata.get(key);
        if (value == null || value.isBlank()) {
            throw new MissingCalibrationException("No calibration entry '" + key + "' for band " + band);
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            throw new MissingCalibrationException("Calibration entry '" + key + "' must hold 'offset slope', got: " + value);
        }
        try {
            return new CalibrationParams(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]));
        } catch (IllegalArgumentException e) {
            throw new MissingCalibrationException("Unparseable calibration entry '" + key + "': " + value, e);
        }
    }
}
