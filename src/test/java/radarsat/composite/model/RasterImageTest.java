package radarsat.composite.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RasterImage buffer ownership, band access and extent computation.
 */
class RasterImageTest {

    private static final GeoTransform GT = GeoTransform.northUp(1000.0, 5000.0, 10.0, 10.0);

    private static RasterImage rgb2x2() {
        float[] px = {
                255, 0, 0,   0, 255, 0,
                0, 0, 255,   10, 20, 30
        };
        return new RasterImage(2, 2, PixelFormat.RGB, 3, px, GT, "EPSG:3857");
    }

    // ==================== Construction ====================

    @Test
    @DisplayName("Constructor copies the pixel buffer")
    void testConstructorCopiesBuffer() {
        float[] px = new float[4];
        RasterImage image = new RasterImage(2, 2, PixelFormat.FLOAT, 1, px, null, null);
        px[0] = 99f;
        assertEquals(0f, image.getSample(0, 0, 0));
    }

    @Test
    @DisplayName("copyPixels hands out an independent copy")
    void testCopyPixelsIsIndependent() {
        RasterImage image = rgb2x2();
        float[] copy = image.copyPixels();
        copy[0] = 1f;
        assertEquals(255f, image.getSample(0, 0, 0));
    }

    @Test
    @DisplayName("Buffer length must match dimensions and channels")
    void testBufferLengthValidated() {
        assertThrows(IllegalArgumentException.class,
                () -> new RasterImage(2, 2, PixelFormat.RGB, 3, new float[11], null, null));
    }

    @Test
    @DisplayName("Colour formats require their fixed channel count")
    void testColourChannelsValidated() {
        assertThrows(IllegalArgumentException.class,
                () -> new RasterImage(1, 1, PixelFormat.RGBA, 3, new float[3], null, null));
    }

    @Test
    @DisplayName("A geotransform without a projection is rejected")
    void testGeoTransformNeedsProjection() {
        assertThrows(IllegalArgumentException.class,
                () -> new RasterImage(1, 1, PixelFormat.FLOAT, 1, new float[1], GT, null));
    }

    // ==================== Bands and Formats ====================

    @Test
    @DisplayName("extractBand is 1-based and keeps the georeference")
    void testExtractBand() {
        RasterImage band2 = rgb2x2().extractBand(2);
        assertEquals(PixelFormat.FLOAT, band2.getFormat());
        assertEquals(1, band2.getChannels());
        assertEquals(255f, band2.getSample(1, 0, 0));
        assertEquals(20f, band2.getSample(1, 1, 0));
        assertEquals(GT, band2.getGeoTransform());
    }

    @Test
    @DisplayName("extractBand rejects band 0")
    void testExtractBandOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> rgb2x2().extractBand(0));
        assertThrows(IllegalArgumentException.class, () -> rgb2x2().extractBand(4));
    }

    @Test
    @DisplayName("toRgba adds an opaque alpha channel")
    void testToRgba() {
        RasterImage rgba = rgb2x2().toRgba();
        assertEquals(PixelFormat.RGBA, rgba.getFormat());
        assertEquals(10f, rgba.getSample(1, 1, 0));
        assertEquals(255f, rgba.getSample(1, 1, 3));
    }

    @Test
    @DisplayName("Pixel access outside the raster throws")
    void testOutOfBoundsAccess() {
        assertThrows(IndexOutOfBoundsException.class, () -> rgb2x2().getSample(2, 0, 0));
    }

    // ==================== Extent ====================

    @Test
    @DisplayName("Extent covers all pixel corners")
    void testExtent() {
        BoundingBox extent = rgb2x2().getExtent();
        assertEquals(1000.0, extent.getMinX(), 1e-9);
        assertEquals(1020.0, extent.getMaxX(), 1e-9);
        assertEquals(4980.0, extent.getMinY(), 1e-9);
        assertEquals(5000.0, extent.getMaxY(), 1e-9);
        assertEquals("EPSG:3857", extent.getProjectionId());
    }

    @Test
    @DisplayName("Extent of a plain image is an error")
    void testExtentWithoutGeoTransform() {
        RasterImage plain = RasterImage.transparent(3, 3, null, null);
        assertThrows(IllegalStateException.class, plain::getExtent);
    }

    @Test
    @DisplayName("samePixels ignores the georeference")
    void testSamePixels() {
        RasterImage a = rgb2x2();
        RasterImage b = a.withGeoreference(null, null);
        assertTrue(a.samePixels(b));
        assertFalse(a.samePixels(a.toRgba()));
    }
}
