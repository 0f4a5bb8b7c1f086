package radarsat.composite.controller;

import radarsat.composite.model.CalibrationParams;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;
import radarsat.composite.model.SatelliteFrame;

import java.time.Instant;
import java.util.Map;

/**
 * Synthetic radar frames and SEVIRI products shared by the controller tests.
 */
final class CompositeFixtures {

    static final float[] RADAR_COLOUR = {10, 200, 30};

    /** Calibration of the two water-vapour bands: 200 K plus 0.5 K per count. */
    static final Map<Integer, CalibrationParams> WV_CALIBRATION = Map.of(
            5, new CalibrationParams(200.0, 0.5),
            6, new CalibrationParams(190.0, 0.5));

    private CompositeFixtures() {
    }

    /**
     * 480x480 RGB frame: uniform radar colour over the data area, white footer.
     */
    static RasterImage radarFrame() {
        return radarFrame(480, 480);
    }

    static RasterImage radarFrame(int width, int height) {
        float[] px = new float[width * height * 3];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int o = (row * width + col) * 3;
                boolean footer = row >= 430;
                px[o] = footer ? 255 : RADAR_COLOUR[0];
                px[o + 1] = footer ? 255 : RADAR_COLOUR[1];
                px[o + 2] = footer ? 255 : RADAR_COLOUR[2];
            }
        }
        return new RasterImage(width, height, PixelFormat.RGB, 3, px, null, null);
    }

    /**
     * 300x200 six-channel product in SEVIRI:GEOS at 6 km covering the western Mediterranean.
     * Raw counts grow eastwards so the grey stretch has a range to work with.
     */
    static SatelliteFrame satelliteFrame(Map<Integer, CalibrationParams> calibration) {
        return satelliteFrame(GeoTransform.northUp(-600_000, 4_700_000, 6_000, 6_000), calibration);
    }

    static SatelliteFrame satelliteFrame(GeoTransform gt, Map<Integer, CalibrationParams> calibration) {
        int w = 300;
        int h = 200;
        int channels = 6;
        float[] px = new float[w * h * channels];
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                for (int c = 0; c < channels; c++) {
                    px[(row * w + col) * channels + c] = 40 + col * 0.5f + c;
                }
            }
        }
        RasterImage raster = new RasterImage(w, h, PixelFormat.FLOAT, channels, px, gt, "SEVIRI:GEOS");
        return new SatelliteFrame(raster, calibration, Instant.parse("2025-07-12T14:42:43Z"));
    }
}
