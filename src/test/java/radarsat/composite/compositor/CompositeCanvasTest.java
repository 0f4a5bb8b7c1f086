package radarsat.composite.compositor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.RasterImage;

import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class CompositeCanvasTest {

    private CompositeCanvas canvas;

    @BeforeEach
    void setUp() {
        canvas = new CompositeCanvas(new BoundingBox(0, 0, 100, 50, "EPSG:3857"), 10.0);
    }

    @Test
    @DisplayName("Grid covers the extent north-up and starts transparent")
    void testGrid() {
        assertEquals(10, canvas.getWidth());
        assertEquals(5, canvas.getHeight());
        assertEquals(GeoTransform.northUp(0, 50, 10, 10), canvas.getGeoTransform());
        assertArrayEquals(new double[]{5, 45}, canvas.pixelCenter(0, 0));
        RasterImage raster = canvas.toRaster();
        for (float v : raster.copyPixels()) {
            assertEquals(0f, v);
        }
        assertEquals("EPSG:3857", raster.getProjectionId());
    }

    @Test
    @DisplayName("Projected to pixel transform matches the geotransform")
    void testProjectedToPixel() {
        Point2D p = canvas.projectedToPixel().transform(new Point2D.Double(5, 45), null);
        assertEquals(0.5, p.getX(), 1e-12);
        assertEquals(0.5, p.getY(), 1e-12);
        BoundingBox extent = canvas.getExtent();
        assertEquals(0, extent.getMinX(), 1e-12);
        assertEquals(50, extent.getMaxY(), 1e-12);
    }

    @Test
    @DisplayName("Opaque source replaces, transparent source leaves the pixel alone")
    void testOpaqueAndTransparent() {
        canvas.blend(1, 1, 10, 20, 30, 255);
        canvas.blend(1, 1, 200, 200, 200, 0);
        RasterImage raster = canvas.toRaster();
        assertEquals(10f, raster.getSample(1, 1, 0));
        assertEquals(30f, raster.getSample(1, 1, 2));
        assertEquals(255f, raster.getSample(1, 1, 3));
    }

    @Test
    @DisplayName("Half-transparent source over opaque mixes evenly")
    void testOver() {
        canvas.blend(2, 3, 0, 0, 255, 255);
        canvas.blend(2, 3, 255, 0, 0, 127.5f);
        RasterImage raster = canvas.toRaster();
        assertEquals(127.5f, raster.getSample(2, 3, 0), 1e-3);
        assertEquals(127.5f, raster.getSample(2, 3, 2), 1e-3);
        assertEquals(255f, raster.getSample(2, 3, 3), 1e-3);
    }

    @Test
    @DisplayName("Half-transparent over half-transparent accumulates alpha")
    void testOverTranslucent() {
        canvas.blend(0, 0, 0, 0, 0, 127.5f);
        canvas.blend(0, 0, 255, 255, 255, 127.5f);
        RasterImage raster = canvas.toRaster();
        assertEquals(0.75 * 255, raster.getSample(0, 0, 3), 1e-3);
        // 0.5 white over 0.25 effective black
        assertEquals(255 * 0.5 / 0.75, raster.getSample(0, 0, 0), 1e-3);
    }

    @Test
    @DisplayName("Overlay opacity scales its alpha")
    void testBlendOverlay() {
        BufferedImage overlay = canvas.newOverlay();
        overlay.setRGB(4, 2, 0xFFFFFF00);
        canvas.blendOverlay(overlay, 0.8);
        RasterImage raster = canvas.toRaster();
        assertEquals(204f, raster.getSample(4, 2, 3), 1e-3);
        assertEquals(255f, raster.getSample(4, 2, 0));
        assertEquals(0f, raster.getSample(3, 2, 3));
    }

    @Test
    @DisplayName("Overlay of another size is rejected")
    void testOverlaySizeMismatch() {
        BufferedImage overlay = new BufferedImage(3, 3, BufferedImage.TYPE_INT_ARGB);
        assertThrows(IllegalArgumentException.class, () -> canvas.blendOverlay(overlay, 1.0));
    }

    @Test
    @DisplayName("Invalid resolution or untagged extent is rejected")
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new CompositeCanvas(new BoundingBox(0, 0, 10, 10, "EPSG:3857"), 0));
        assertThrows(IllegalArgumentException.class,
                () -> new CompositeCanvas(new BoundingBox(0, 0, 10, 10, null), 1));
    }
}
