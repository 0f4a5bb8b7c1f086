package radarsat.composite.compositor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;

import static org.junit.jupiter.api.Assertions.*;

class GrayscaleStretchTest {

    private static RasterImage band(float... values) {
        return new RasterImage(values.length, 1, PixelFormat.FLOAT, 1, values, null, null);
    }

    @Test
    @DisplayName("Percentiles interpolate between order statistics and ignore NaN")
    void testPercentiles() {
        float[] values = new float[103];
        for (int i = 0; i < 101; i++) {
            values[i] = 101 - i;
        }
        values[101] = Float.NaN;
        values[102] = Float.NaN;
        GrayscaleStretch stretch = GrayscaleStretch.fromPercentiles(band(values), 5, 95);
        assertEquals(6.0, stretch.low(), 1e-9);
        assertEquals(96.0, stretch.high(), 1e-9);

        GrayscaleStretch quartiles = GrayscaleStretch.fromPercentiles(band(1f, 2f, 3f, 4f), 25, 75);
        assertEquals(1.75, quartiles.low(), 1e-9);
        assertEquals(3.25, quartiles.high(), 1e-9);
    }

    @Test
    @DisplayName("Raster without finite values gets the unit range")
    void testNoFiniteValues() {
        assertEquals(new GrayscaleStretch(0, 1), GrayscaleStretch.fromPercentiles(band(Float.NaN, Float.NaN), 5, 95));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "200, 0",
            "250, 127.5",
            "300, 255",
            "150, 0",
            "400, 255"
    })
    @DisplayName("Values map linearly and clamp to the grey range")
    void testApply(float value, float expected) {
        assertEquals(expected, new GrayscaleStretch(200, 300).apply(value), 1e-4);
    }

    @Test
    @DisplayName("NaN stays NaN and a flat range maps to black")
    void testDegenerate() {
        assertTrue(Float.isNaN(new GrayscaleStretch(200, 300).apply(Float.NaN)));
        assertEquals(0f, new GrayscaleStretch(250, 250).apply(260f));
    }

    @Test
    @DisplayName("Invalid percentile ranges are rejected")
    void testInvalidPercentiles() {
        RasterImage b = band(1f, 2f);
        assertThrows(IllegalArgumentException.class, () -> GrayscaleStretch.fromPercentiles(b, -1, 50));
        assertThrows(IllegalArgumentException.class, () -> GrayscaleStretch.fromPercentiles(b, 60, 50));
        assertThrows(IllegalArgumentException.class, () -> GrayscaleStretch.fromPercentiles(b, 5, 101));
    }
}
