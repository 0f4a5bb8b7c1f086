package radarsat.composite.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    @Test
    @DisplayName("Corners in any order are normalised")
    void testNormalisation() {
        BoundingBox box = new BoundingBox(500.0, 800.0, 100.0, 200.0, "EPSG:3857");
        assertEquals(100.0, box.getMinX());
        assertEquals(500.0, box.getMaxX());
        assertEquals(200.0, box.getMinY());
        assertEquals(800.0, box.getMaxY());
        assertEquals(400.0, box.getWidth());
        assertEquals(600.0, box.getHeight());
    }

    @Test
    @DisplayName("Non-finite corners are rejected")
    void testNonFiniteRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(Double.NaN, 0, 1, 1, null));
    }

    @Test
    @DisplayName("expand grows every side by the margin")
    void testExpand() {
        BoundingBox box = new BoundingBox(0, 0, 10, 10, "P").expand(5);
        assertEquals(-5.0, box.getMinX());
        assertEquals(15.0, box.getMaxY());
        assertEquals("P", box.getProjectionId());
    }

    @Test
    @DisplayName("enclosing covers every point")
    void testEnclosing() {
        BoundingBox box = BoundingBox.enclosing(new double[][]{{3, -1}, {-2, 4}, {1, 1}}, "P");
        assertEquals(-2.0, box.getMinX());
        assertEquals(3.0, box.getMaxX());
        assertEquals(-1.0, box.getMinY());
        assertEquals(4.0, box.getMaxY());
    }

    @Test
    @DisplayName("Touching boxes do not intersect")
    void testIntersects() {
        BoundingBox a = new BoundingBox(0, 0, 10, 10, "P");
        assertTrue(a.intersects(new BoundingBox(5, 5, 15, 15, "P")));
        assertFalse(a.intersects(new BoundingBox(10, 0, 20, 10, "P")));
    }

    @Test
    @DisplayName("Interior containment respects the inset")
    void testContainsInterior() {
        BoundingBox a = new BoundingBox(0, 0, 10, 10, "P");
        assertTrue(a.containsInterior(5, 5, 1));
        assertFalse(a.containsInterior(0.5, 5, 1));
        assertTrue(a.contains(0, 10));
    }

    @Test
    @DisplayName("union of boxes in different projections is rejected")
    void testUnionProjectionMismatch() {
        BoundingBox a = new BoundingBox(0, 0, 1, 1, "A");
        BoundingBox b = new BoundingBox(0, 0, 2, 2, "B");
        assertThrows(IllegalArgumentException.class, () -> a.union(b));
        assertEquals(2.0, a.union(new BoundingBox(0, 0, 2, 2, "A")).getMaxX());
    }
}
