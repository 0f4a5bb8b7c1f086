package radarsat.composite.utilities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radarsat.composite.errors.MissingCalibrationException;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.CalibrationParams;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;
import radarsat.composite.model.TargetGrid;
import radarsat.composite.projection.GeostationaryProjection;
import radarsat.composite.projection.ProjectionBridge;
import radarsat.composite.projection.ProjectionRegistry;
import radarsat.composite.utilities.BandCalibrator.CalibratedBand;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for band calibration and bilinear reprojection.
 */
class BandCalibratorTest {

    private static final String GEOS = "SEVIRI:GEOS";

    private BandCalibrator calibrator;

    @BeforeEach
    void setUp() {
        ProjectionRegistry registry = ProjectionRegistry.withDefaults();
        registry.register(GeostationaryProjection.seviri(GEOS, 0.0));
        calibrator = new BandCalibrator(new ProjectionBridge(registry));
    }

    /** Raw geostationary raster over north-east Spain, every band filled with {@code value}. */
    private static RasterImage rawSatellite(int bands, float value) {
        int w = 150;
        int h = 100;
        float[] px = new float[w * h * bands];
        java.util.Arrays.fill(px, value);
        return new RasterImage(w, h, PixelFormat.FLOAT, bands, px,
                GeoTransform.northUp(-300_000.0, 4_500_000.0, 6000.0, 6000.0), GEOS);
    }

    /** Single-band raster whose value is 10 * column. */
    private static RasterImage gradient(int w, int h, GeoTransform gt, String projection) {
        float[] px = new float[w * h];
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                px[row * w + col] = 10f * col;
            }
        }
        return new RasterImage(w, h, PixelFormat.FLOAT, 1, px, gt, projection);
    }

    // ==================== Calibration ====================

    @Test
    @DisplayName("All-zero raw band calibrates to the offset everywhere")
    void testZeroRawGivesOffset() throws MissingCalibrationException {
        RasterImage calibrated = calibrator.calibrate(rawSatellite(6, 0f), 5, new CalibrationParams(230.5, 0.25));
        assertEquals(1, calibrated.getChannels());
        for (float v : calibrated.copyPixels()) {
            assertEquals(230.5f, v, 1e-4f);
        }
    }

    @Test
    @DisplayName("Calibration is linear in the raw count")
    void testLinear() throws MissingCalibrationException {
        RasterImage calibrated = calibrator.calibrate(rawSatellite(2, 400f), 2, new CalibrationParams(-5.0, 0.5));
        assertEquals(195f, calibrated.getSample(10, 10, 0), 1e-4f);
        assertEquals(GEOS, calibrated.getProjectionId());
    }

    @Test
    @DisplayName("Missing calibration fails before any band is processed")
    void testMissingCalibration() {
        Map<Integer, CalibrationParams> calibration = Map.of(5, new CalibrationParams(0.0, 1.0));
        assertThrows(MissingCalibrationException.class,
                () -> calibrator.calibrateBands(rawSatellite(6, 1f), calibration, List.of(5, 6), null, "EPSG:3857"));
        assertThrows(MissingCalibrationException.class,
                () -> calibrator.calibrate(rawSatellite(6, 1f), 6, null));
    }

    // ==================== Bilinear Sampling ====================

    @Test
    @DisplayName("Bilinear sampling interpolates a linear gradient exactly")
    void testBilinearGradient() {
        RasterImage g = gradient(4, 3, GeoTransform.northUp(0, 0, 1, 1), "EPSG:3857");
        assertEquals(10f, BandCalibrator.sampleBilinear(g, 1.5, 1.5), 1e-6f);
        assertEquals(15f, BandCalibrator.sampleBilinear(g, 2.0, 1.0), 1e-6f);
        assertEquals(22.5f, BandCalibrator.sampleBilinear(g, 2.75, 2.2), 1e-5f);
    }

    @Test
    @DisplayName("Outside the raster the sample is NaN")
    void testBilinearOutside() {
        RasterImage g = gradient(4, 3, GeoTransform.northUp(0, 0, 1, 1), "EPSG:3857");
        assertTrue(Float.isNaN(BandCalibrator.sampleBilinear(g, -0.1, 1.0)));
        assertTrue(Float.isNaN(BandCalibrator.sampleBilinear(g, 1.0, 3.01)));
    }

    @Test
    @DisplayName("Neighbours beyond the edge are dropped and weights renormalised")
    void testBilinearEdge() {
        RasterImage g = gradient(4, 3, GeoTransform.northUp(0, 0, 1, 1), "EPSG:3857");
        assertEquals(0f, BandCalibrator.sampleBilinear(g, 0.25, 0.25), 1e-6f);
        assertEquals(30f, BandCalibrator.sampleBilinear(g, 4.0, 3.0), 1e-6f);
    }

    @Test
    @DisplayName("NaN neighbours are excluded from the average")
    void testBilinearNaN() {
        float[] px = {Float.NaN, 20f, Float.NaN, 40f};
        RasterImage g = new RasterImage(2, 2, PixelFormat.FLOAT, 1, px, GeoTransform.northUp(0, 0, 1, 1), "EPSG:3857");
        // equal weights on all four, only the right column is valid
        assertEquals(30f, BandCalibrator.sampleBilinear(g, 1.0, 1.0), 1e-6f);
        float[] allNaN = {Float.NaN, Float.NaN, Float.NaN, Float.NaN};
        RasterImage empty = new RasterImage(2, 2, PixelFormat.FLOAT, 1, allNaN,
                GeoTransform.northUp(0, 0, 1, 1), "EPSG:3857");
        assertTrue(Float.isNaN(BandCalibrator.sampleBilinear(empty, 1.0, 1.0)));
    }

    // ==================== Reprojection ====================

    @Test
    @DisplayName("Reprojection onto the source grid reproduces the source")
    void testReprojectIdentity() {
        GeoTransform gt = GeoTransform.northUp(100_000.0, 5_000_000.0, 1000.0, 1000.0);
        RasterImage g = gradient(20, 10, gt, "EPSG:3857");
        RasterImage out = calibrator.reproject(g, TargetGrid.of(g));
        float[] a = g.copyPixels();
        float[] b = out.copyPixels();
        for (int i = 0; i < a.length; i++) {
            assertEquals(a[i], b[i], 1e-3f);
        }
    }

    @Test
    @DisplayName("Target pixels beyond the source are NaN")
    void testReprojectOutsideIsNaN() {
        GeoTransform gt = GeoTransform.northUp(0.0, 1000.0, 100.0, 100.0);
        RasterImage g = gradient(10, 10, gt, "EPSG:3857");
        TargetGrid wider = new TargetGrid(20, 10, gt, "EPSG:3857");
        RasterImage out = calibrator.reproject(g, wider);
        assertFalse(Float.isNaN(out.getSample(5, 5, 0)));
        assertTrue(Float.isNaN(out.getSample(15, 5, 0)));
    }

    @Test
    @DisplayName("Geostationary band lands on a Web Mercator grid with calibrated values")
    void testCalibrateBandsToMercator() throws Exception {
        Map<Integer, CalibrationParams> calibration = Map.of(
                5, new CalibrationParams(230.0, 0.5),
                6, new CalibrationParams(240.0, 0.5));
        List<CalibratedBand> bands = calibrator.calibrateBands(rawSatellite(6, 0f), calibration,
                List.of(5, 6), null, "EPSG:3857");

        assertEquals(2, bands.size());
        assertEquals(5, bands.get(0).band());
        RasterImage wv62 = bands.get(0).raster();
        RasterImage wv73 = bands.get(1).raster();
        assertEquals("EPSG:3857", wv62.getProjectionId());
        assertEquals(wv62.getGeoTransform(), wv73.getGeoTransform());

        assertEquals(230f, wv62.getSample(wv62.getWidth() / 2, wv62.getHeight() / 2, 0), 1e-3f);
        assertEquals(240f, wv73.getSample(wv73.getWidth() / 2, wv73.getHeight() / 2, 0), 1e-3f);
        for (float v : wv62.copyPixels()) {
            assertTrue(Float.isNaN(v) || Math.abs(v - 230f) < 1e-3f, "unexpected value " + v);
        }
    }

    @Test
    @DisplayName("A raster entirely off the Earth disk has no target grid")
    void testSuggestGridUndefined() {
        float[] px = new float[4 * 4];
        RasterImage offDisk = new RasterImage(4, 4, PixelFormat.FLOAT, 1, px,
                GeoTransform.northUp(6_000_000.0, 6_500_000.0, 10_000.0, 10_000.0), GEOS);
        assertThrows(ProjectionUndefinedException.class, () -> calibrator.suggestGrid(offDisk, "EPSG:3857"));
    }

    @Test
    @DisplayName("Suggested grid is north-up with square pixels")
    void testSuggestGrid() throws ProjectionUndefinedException {
        TargetGrid grid = calibrator.suggestGrid(rawSatellite(1, 0f), "EPSG:3857");
        assertEquals("EPSG:3857", grid.projectionId());
        assertEquals(grid.geoTransform().getPixelWidth(), -grid.geoTransform().getPixelHeight(), 1e-9);
        assertTrue(Math.hypot(grid.width(), grid.height()) >= Math.hypot(150, 100) - 2);
    }
}
