package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.MissingCalibrationException;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.CalibrationParams;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;
import radarsat.composite.model.TargetGrid;
import radarsat.composite.projection.ProjectionBridge;

import java.awt.geom.AffineTransform;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts raw satellite bands, converts them to physical units and reprojects them onto a target grid.
 *
 * <p>Calibration is {@code offset + slope * raw} per pixel with the band's {@link CalibrationParams};
 * a band without calibration fails the frame rather than being skipped. Reprojection is bilinear on pixel
 * centres: each target pixel centre is transformed into the source projection, the four surrounding
 * source centres are weighted, NaN neighbours are left out and the remaining weights renormalised.
 * Target pixels whose source position is undefined in the source projection or lies outside the source
 * raster are NaN.</p>
 *
 * @since 0.2.0
 */
public class BandCalibrator {

    private static final Logger logger = LoggerFactory.getLogger(BandCalibrator.class);

    /** Lattice size per axis when sampling a raster to find its extent in another projection. */
    private static final int GRID_SAMPLES = 21;

    private final ProjectionBridge bridge;

    /**
     * A calibrated band on its target grid.
     *
     * @param band 1-based band index in the source product
     * @param calibration calibration that was applied
     * @param raster single-band FLOAT raster of physical values, NaN for no-data
     */
    public record CalibratedBand(int band, CalibrationParams calibration, RasterImage raster) {
    }

    public BandCalibrator(ProjectionBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
    }

    /**
     * Calibrates and reprojects each requested band.
     *
     * @param raw georeferenced multi-band raster of raw counts
     * @param calibration calibration per 1-based band
     * @param bands bands to process, in output order
     * @param grid target grid, or null to derive one with {@link #suggestGrid}
     * @param targetProjectionId projection used when {@code grid} is null
     * @throws MissingCalibrationException if a requested band has no calibration
     * @throws ProjectionUndefinedException if no target grid can be derived
     */
    public List<CalibratedBand> calibrateBands(RasterImage raw, Map<Integer, CalibrationParams> calibration,
                                               List<Integer> bands, TargetGrid grid, String targetProjectionId)
            throws MissingCalibrationException, ProjectionUndefinedException {
        // fail before any work if a band cannot be calibrated
        for (int band : bands) {
            requireCalibration(calibration, band);
        }
        TargetGrid target = grid != null ? grid : suggestGrid(raw, targetProjectionId);
        List<CalibratedBand> result = new ArrayList<>();
        for (int band : bands) {
            CalibrationParams params = calibration.get(band);
            RasterImage physical = calibrate(raw, band, params);
            result.add(new CalibratedBand(band, params, reproject(physical, target)));
        }
        return result;
    }

    private static void requireCalibration(Map<Integer, CalibrationParams> calibration, int band)
            throws MissingCalibrationException {
        if (calibration == null || calibration.get(band) == null) {
            throw new MissingCalibrationException("No calibration parameters supplied for band " + band);
        }
    }

    /**
     * Extracts one band and applies the linear calibration, keeping the native grid.
     *
     * @throws MissingCalibrationException if {@code params} is null
     */
    public RasterImage calibrate(RasterImage raw, int band, CalibrationParams params)
            throws MissingCalibrationException {
        if (params == null) {
            throw new MissingCalibrationException("No calibration parameters supplied for band " + band);
        }
        RasterImage single = raw.extractBand(band);
        float[] px = single.copyPixels();
        for (int i = 0; i < px.length; i++) {
            px[i] = params.apply(px[i]);
        }
        logger.info("Calibrated band {} with offset {} slope {}", band, params.offset(), params.slope());
        return RasterImage.adopt(single.getWidth(), single.getHeight(), PixelFormat.FLOAT, 1, px,
                single.getGeoTransform(), single.getProjectionId());
    }

    /**
     * Bilinear reprojection of a single-band raster onto a target grid.
     */
    public RasterImage reproject(RasterImage source, TargetGrid grid) {
        if (source.getChannels() != 1 || source.getFormat() != PixelFormat.FLOAT) {
            throw new IllegalArgumentException("Reprojection expects a single-band FLOAT raster, got " + source);
        }
        if (!source.isGeoreferenced()) {
            throw new IllegalArgumentException("Source raster has no geotransform");
        }
        ProjectionBridge.PointTransformer toSource =
                bridge.pointTransformer(grid.projectionId(), source.getProjectionId());
        AffineTransform sourceInverse = GeoTransformFunctions.inverseOf(source.getGeoTransform());
        GeoTransform gt = grid.geoTransform();

        int w = grid.width();
        int h = grid.height();
        float[] out = new float[w * h];
        int undefined = 0;
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                double[] xy = GeoTransformFunctions.pixelToProjected(col + 0.5, row + 0.5, gt);
                double[] sourceXy;
                try {
                    sourceXy = toSource.apply(xy[0], xy[1]);
                } catch (ProjectionUndefinedException e) {
                    out[row * w + col] = Float.NaN;
                    undefined++;
                    continue;
                }
                double[] p = GeoTransformFunctions.toPixel(sourceInverse, sourceXy[0], sourceXy[1]);
                out[row * w + col] = sampleBilinear(source, p[0], p[1]);
            }
        }
        if (undefined > 0) {
            logger.debug("{} of {} target pixels are outside the source projection's domain", undefined, w * h);
        }
        logger.info("Reprojected {}x{} {} band to {}x{} {}", source.getWidth(), source.getHeight(),
                source.getProjectionId(), w, h, grid.projectionId());
        return RasterImage.adopt(w, h, PixelFormat.FLOAT, 1, out, gt, grid.projectionId());
    }

    /**
     * Bilinear sample at a corner-based pixel position; NaN outside the raster or when all neighbours are NaN.
     */
    static float sampleBilinear(RasterImage source, double px, double py) {
        int w = source.getWidth();
        int h = source.getHeight();
        if (!(px >= 0 && py >= 0 && px <= w && py <= h)) {
            return Float.NaN;
        }
        double fx = px - 0.5;
        double fy = py - 0.5;
        int x0 = (int) Math.floor(fx);
        int y0 = (int) Math.floor(fy);
        double tx = fx - x0;
        double ty = fy - y0;

        double sum = 0;
        double weight = 0;
        for (int dy = 0; dy <= 1; dy++) {
            for (int dx = 0; dx <= 1; dx++) {
                int c = x0 + dx;
                int r = y0 + dy;
                double wgt = (dx == 0 ? 1 - tx : tx) * (dy == 0 ? 1 - ty : ty);
                if (wgt == 0 || !source.contains(c, r)) {
                    continue;
                }
                float v = source.getSample(c, r, 0);
                if (Float.isNaN(v)) {
                    continue;
                }
                sum += wgt * v;
                weight += wgt;
            }
        }
        return weight > 0 ? (float) (sum / weight) : Float.NaN;
    }

    /**
     * Derives a north-up target grid covering a raster: a lattice of source points is transformed
     * (points undefined in the target projection are skipped) and the pixel size is chosen so the grid
     * diagonal has as many pixels as the source diagonal.
     *
     * @throws ProjectionUndefinedException if no sampled point can be transformed
     */
    public TargetGrid suggestGrid(RasterImage source, String targetProjectionId) throws ProjectionUndefinedException {
        ProjectionBridge.PointTransformer toTarget =
                bridge.pointTransformer(source.getProjectionId(), targetProjectionId);
        GeoTransform gt = source.getGeoTransform();
        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < GRID_SAMPLES; i++) {
            for (int j = 0; j < GRID_SAMPLES; j++) {
                double col = source.getWidth() * (double) i / (GRID_SAMPLES - 1);
                double row = source.getHeight() * (double) j / (GRID_SAMPLES - 1);
                double[] xy = GeoTransformFunctions.pixelToProjected(col, row, gt);
                try {
                    points.add(toTarget.apply(xy[0], xy[1]));
                } catch (ProjectionUndefinedException e) {
                    logger.debug("Grid sample ({}, {}) undefined in {}: {}", col, row, targetProjectionId, e.getMessage());
                }
            }
        }
        if (points.isEmpty()) {
            throw new ProjectionUndefinedException("No part of the " + source.getProjectionId()
                    + " raster can be expressed in " + targetProjectionId);
        }
        BoundingBox extent = BoundingBox.enclosing(points.toArray(new double[0][]), targetProjectionId);
        double resolution = Math.hypot(extent.getWidth(), extent.getHeight())
                / Math.hypot(source.getWidth(), source.getHeight());
        if (!(resolution > 0)) {
            throw new ProjectionUndefinedException("Raster collapses to a point in " + targetProjectionId);
        }
        int w = Math.max(1, (int) Math.ceil(extent.getWidth() / resolution));
        int h = Math.max(1, (int) Math.ceil(extent.getHeight() / resolution));
        TargetGrid grid = new TargetGrid(w, h,
                GeoTransform.northUp(extent.getMinX(), extent.getMaxY(), resolution, resolution), targetProjectionId);
        logger.debug("Suggested {}x{} grid at {} for {}", w, h, resolution, extent);
        return grid;
    }
}
