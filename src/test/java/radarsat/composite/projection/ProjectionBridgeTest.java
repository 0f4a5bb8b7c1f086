package radarsat.composite.projection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.BoundingBox;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

/**
 * Tests for ProjectionBridge point and box transforms.
 */
@ExtendWith(MockitoExtension.class)
class ProjectionBridgeTest {

    private ProjectionRegistry registry;
    private ProjectionBridge bridge;

    @Mock
    private Projection failing;

    @BeforeEach
    void setUp() {
        registry = ProjectionRegistry.withDefaults();
        registry.register(GeostationaryProjection.seviri("SEVIRI:GEOS", 0.0));
        bridge = new ProjectionBridge(registry);
    }

    // ==================== Points ====================

    @Test
    @DisplayName("Web Mercator to geostationary and back recovers the point")
    void testMercatorGeosRoundTrip() throws ProjectionUndefinedException {
        double[] geos = bridge.transformPoint(333652.398, 5144359.743, "EPSG:3857", "SEVIRI:GEOS");
        double[] back = bridge.transformPoint(geos[0], geos[1], "SEVIRI:GEOS", "EPSG:3857");
        assertEquals(333652.398, back[0], 1e-3);
        assertEquals(5144359.743, back[1], 1e-3);
    }

    @Test
    @DisplayName("Same projection is the identity")
    void testIdentity() throws ProjectionUndefinedException {
        assertArrayEquals(new double[]{12.5, -3.0}, bridge.transformPoint(12.5, -3.0, "EPSG:3857", "epsg:3857"));
    }

    @Test
    @DisplayName("Unknown projection is a configuration error")
    void testUnknownProjection() {
        assertThrows(IllegalStateException.class, () -> bridge.transformPoint(0, 0, "EPSG:9999", "EPSG:3857"));
    }

    // ==================== Boxes ====================

    @Test
    @DisplayName("Box transform is the bounds of the transformed corners")
    void testBoxFromCorners() throws ProjectionUndefinedException {
        BoundingBox lonLat = new BoundingBox(0.0, 40.0, 4.0, 43.0, "EPSG:4326");
        BoundingBox geos = bridge.transformBox(lonLat, "SEVIRI:GEOS");
        assertEquals("SEVIRI:GEOS", geos.getProjectionId());

        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (double[] corner : lonLat.getCorners()) {
            double[] xy = bridge.transformPoint(corner[0], corner[1], "EPSG:4326", "SEVIRI:GEOS");
            minX = Math.min(minX, xy[0]);
            maxX = Math.max(maxX, xy[0]);
            minY = Math.min(minY, xy[1]);
            maxY = Math.max(maxY, xy[1]);
        }
        assertEquals(minX, geos.getMinX(), 1e-6);
        assertEquals(maxX, geos.getMaxX(), 1e-6);
        assertEquals(minY, geos.getMinY(), 1e-6);
        assertEquals(maxY, geos.getMaxY(), 1e-6);
        // parallels curve on the disk, so the lowest Y comes from the south-east corner
        double[] lowerLeft = bridge.transformPoint(0.0, 40.0, "EPSG:4326", "SEVIRI:GEOS");
        assertTrue(geos.getMinY() < lowerLeft[1]);
    }

    @Test
    @DisplayName("Mercator box through geographic and back is unchanged")
    void testBoxRoundTripGeographic() throws ProjectionUndefinedException {
        BoundingBox box = new BoundingBox(-19.45, 4887352.59, 667324.25, 5472387.81, "EPSG:3857");
        BoundingBox back = bridge.transformBox(bridge.transformBox(box, "EPSG:4326"), "EPSG:3857");
        assertEquals(box.getMinX(), back.getMinX(), 1e-6);
        assertEquals(box.getMinY(), back.getMinY(), 1e-6);
        assertEquals(box.getMaxX(), back.getMaxX(), 1e-6);
        assertEquals(box.getMaxY(), back.getMaxY(), 1e-6);
    }

    @Test
    @DisplayName("Mercator box through geostationary and back grows only slightly")
    void testBoxRoundTripGeostationary() throws ProjectionUndefinedException {
        BoundingBox box = new BoundingBox(320_000, 5_130_000, 340_000, 5_150_000, "EPSG:3857");
        BoundingBox back = bridge.transformBox(bridge.transformBox(box, "SEVIRI:GEOS"), "EPSG:3857");
        // the geos grid is rotated against Mercator here, so corners of the round trip lie outside
        assertTrue(back.contains(box.getMinX(), box.getMinY()));
        assertTrue(back.contains(box.getMaxX(), box.getMaxY()));
        assertEquals(box.getWidth(), back.getWidth(), 2_000);
        assertEquals(box.getHeight(), back.getHeight(), 1_000);
        assertEquals(box.getCenterX(), back.getCenterX(), 100);
        assertEquals(box.getCenterY(), back.getCenterY(), 100);
    }

    @Test
    @DisplayName("Box in the target projection is only re-tagged")
    void testBoxSameProjection() throws ProjectionUndefinedException {
        BoundingBox box = new BoundingBox(1, 2, 3, 4, "epsg:3857");
        BoundingBox result = bridge.transformBox(box, "EPSG:3857");
        assertEquals("EPSG:3857", result.getProjectionId());
        assertEquals(1.0, result.getMinX());
        assertEquals(4.0, result.getMaxY());
    }

    @Test
    @DisplayName("An undefined corner propagates ProjectionUndefined")
    void testUndefinedCornerPropagates() throws ProjectionUndefinedException {
        when(failing.getId()).thenReturn("MOCK");
        when(failing.fromGeographic(anyDouble(), anyDouble()))
                .thenThrow(new ProjectionUndefinedException("not visible"));
        registry.register(failing);

        BoundingBox box = new BoundingBox(0.0, 0.0, 1.0, 1.0, "EPSG:4326");
        assertThrows(ProjectionUndefinedException.class, () -> bridge.transformBox(box, "MOCK"));
        verify(failing, times(1)).fromGeographic(anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("Point transformer resolves each projection once")
    void testPointTransformerDelegates() throws ProjectionUndefinedException {
        when(failing.getId()).thenReturn("MOCK");
        when(failing.toGeographic(10.0, 20.0)).thenReturn(new double[]{1.0, 2.0});
        registry.register(failing);

        ProjectionBridge.PointTransformer toLonLat = bridge.pointTransformer("MOCK", "EPSG:4326");
        assertArrayEquals(new double[]{1.0, 2.0}, toLonLat.apply(10.0, 20.0));
        verify(failing).toGeographic(10.0, 20.0);
    }
}
