package radarsat.composite.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded satellite product: the multi-band raw raster in its native projection plus the
 * per-band calibration taken from the product's own metadata.
 *
 * @since 0.3.0
 */
public final class SatelliteFrame {
    private final String name;
    private final RasterImage raster;
    private final Map<Integer, CalibrationParams> calibration;
    private final Instant sensingTime;

    public SatelliteFrame(RasterImage raster, Map<Integer, CalibrationParams> calibration, Instant sensingTime) {
        this(null, raster, calibration, sensingTime);
    }

    /**
     * @param name product name, e.g. the source file, may be null
     * @param raster native-projection raster, georeferenced, one FLOAT channel per band
     * @param calibration calibration keyed by 1-based band index
     * @param sensingTime acquisition time, may be null when unknown
     */
    public SatelliteFrame(String name, RasterImage raster, Map<Integer, CalibrationParams> calibration,
                          Instant sensingTime) {
        this.name = name;
        this.raster = Objects.requireNonNull(raster, "raster");
        if (!raster.isGeoreferenced()) {
            throw new IllegalArgumentException("Satellite raster must be georeferenced");
        }
        this.calibration = calibration == null ? Map.of() : Map.copyOf(calibration);
        this.sensingTime = sensingTime;
    }

    public String getName() { return name; }
    public RasterImage getRaster() { return raster; }
    public Map<Integer, CalibrationParams> getCalibration() { return calibration; }
    public Instant getSensingTime() { return sensingTime; }

    public String getProjectionId() {
        return raster.getProjectionId();
    }

    @Override
    public String toString() {
        return "SatelliteFrame[" + (name == null ? "unnamed" : name) + ", sensed " + sensingTime + "]";
    }
}
