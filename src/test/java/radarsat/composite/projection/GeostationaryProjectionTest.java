package radarsat.composite.projection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import radarsat.composite.errors.ProjectionUndefinedException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SEVIRI geostationary view projection.
 */
class GeostationaryProjectionTest {

    private final GeostationaryProjection seviri = GeostationaryProjection.seviri("SEVIRI:GEOS", 0.0);

    @Test
    @DisplayName("Sub-satellite point maps to the disk centre")
    void testSubSatellitePoint() throws ProjectionUndefinedException {
        assertArrayEquals(new double[]{0.0, 0.0}, seviri.fromGeographic(0.0, 0.0), 1e-6);
        assertArrayEquals(new double[]{0.0, 0.0}, seviri.toGeographic(0.0, 0.0), 1e-9);
    }

    @Test
    @DisplayName("Northern-hemisphere points east of the sub-satellite point have positive coordinates")
    void testQuadrant() throws ProjectionUndefinedException {
        double[] xy = seviri.fromGeographic(3.0, 42.0);
        assertTrue(xy[0] > 0);
        assertTrue(xy[1] > 0);
        // scan angles are bounded by the Earth disk, about 5.5 million metres
        assertTrue(xy[1] < 5_600_000);
    }

    @ParameterizedTest
    @CsvSource({
            "2.9972504844063232, 41.88895376301367",
            "0.0, 0.0",
            "-15.0, 30.0",
            "20.0, -45.0",
            "40.0, 60.0"
    })
    @DisplayName("Forward then inverse recovers the geographic coordinate")
    void testInverse(double lon, double lat) throws ProjectionUndefinedException {
        double[] xy = seviri.fromGeographic(lon, lat);
        double[] back = seviri.toGeographic(xy[0], xy[1]);
        assertEquals(lon, back[0], 1e-7);
        assertEquals(lat, back[1], 1e-7);
    }

    @Test
    @DisplayName("Sweep x and sweep y agree on the disk centre but differ off-axis")
    void testSweepAxis() throws ProjectionUndefinedException {
        GeostationaryProjection sweepX = new GeostationaryProjection("GOES", 0.0,
                GeostationaryProjection.SEVIRI_HEIGHT, GeostationaryProjection.SEVIRI_SEMI_MAJOR,
                GeostationaryProjection.SEVIRI_SEMI_MINOR, "x");
        assertTrue(sweepX.isSweepX());
        double[] a = sweepX.fromGeographic(30.0, 40.0);
        double[] b = seviri.fromGeographic(30.0, 40.0);
        assertNotEquals(a[0], b[0], 1.0);
        double[] back = sweepX.toGeographic(a[0], a[1]);
        assertEquals(30.0, back[0], 1e-7);
        assertEquals(40.0, back[1], 1e-7);
    }

    @Test
    @DisplayName("Far side of the Earth is not visible")
    void testNotVisible() {
        assertThrows(ProjectionUndefinedException.class, () -> seviri.fromGeographic(120.0, 0.0));
        assertThrows(ProjectionUndefinedException.class, () -> seviri.fromGeographic(180.0, 10.0));
    }

    @Test
    @DisplayName("Coordinates beyond the disk have no inverse")
    void testOffDisk() {
        assertThrows(ProjectionUndefinedException.class, () -> seviri.toGeographic(6_000_000.0, 0.0));
        assertThrows(ProjectionUndefinedException.class, () -> seviri.toGeographic(5_000_000.0, 5_000_000.0));
    }

    @Test
    @DisplayName("Invalid parameters are rejected")
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> new GeostationaryProjection("G", 0.0, -1.0, 6378169.0, 6356583.8, "y"));
        assertThrows(IllegalArgumentException.class,
                () -> new GeostationaryProjection("G", 0.0, 35785831.0, 6378169.0, 6356583.8, "z"));
    }
}
