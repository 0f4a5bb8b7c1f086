package radarsat.composite.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.ControlPoint;
import radarsat.composite.model.ControlPointSet;
import radarsat.composite.projection.ProjectionBridge;
import radarsat.composite.projection.ProjectionRegistry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlPointSetManagerTest {

    @TempDir
    Path tempDir;

    private static ControlPointSet sample(String name) {
        return new ControlPointSet(name, "EPSG:3857", 1, "test set", List.of(
                new ControlPoint(0, 0, 100, 200),
                new ControlPoint(10, 0, 110, 200),
                new ControlPoint(0, 10, 100, 190)));
    }

    // ==================== Bundled sets ====================

    @Test
    @DisplayName("Bundled sets load from the classpath")
    void testClasspathSets() {
        ControlPointSetManager manager = ControlPointSetManager.fromClasspath();
        ControlPointSet reconstructed = manager.get("aemet-reconstructed-39");
        assertEquals(39, reconstructed.size());
        assertEquals(3, reconstructed.getDegree());
        assertEquals("EPSG:3857", reconstructed.getProjectionId());
        assertTrue(reconstructed.getNotes().startsWith("Reconstructed placeholder"));

        ControlPointSet measured = manager.get("aemet-qgis-5");
        assertEquals(5, measured.size());
        assertEquals(1, measured.getDegree());
        assertEquals(new ControlPoint(131.774, 336.906, 65931.872, 4949862.395), measured.getPoints().get(0));

        ControlPointSet legacy = manager.get("aemet-approx-8");
        assertEquals(8, legacy.size());
        assertEquals(new ControlPoint(240, 240, 2.9972504844063232, 41.88895376301367), legacy.getPoints().get(0));
        assertEquals(3, manager.getAllSets().size());
    }

    @Test
    @DisplayName("Unknown set names are reported")
    void testUnknown() {
        ControlPointSetManager manager = ControlPointSetManager.fromClasspath();
        assertTrue(manager.find("nope").isEmpty());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> manager.get("nope"));
        assertTrue(e.getMessage().contains("aemet-reconstructed-39"));
    }

    @Test
    @DisplayName("Geographic set is converted to Web Mercator on resolve")
    void testResolve() throws ProjectionUndefinedException {
        ControlPointSetManager manager = ControlPointSetManager.fromClasspath();
        ProjectionBridge bridge = new ProjectionBridge(ProjectionRegistry.withDefaults());

        ControlPointSet converted = manager.resolve("aemet-approx-8", "EPSG:3857", bridge);
        assertEquals("EPSG:3857", converted.getProjectionId());
        ControlPoint site = converted.getPoints().get(0);
        assertEquals(240, site.pixelX());
        assertEquals(333652.398, site.projX(), 0.01);
        assertEquals(5144359.743, site.projY(), 0.01);

        ControlPointSet same = manager.resolve("aemet-reconstructed-39", "epsg:3857", bridge);
        assertSame(manager.get("aemet-reconstructed-39"), same);
    }

    @Test
    @DisplayName("Bundled sets are read-only")
    void testReadOnly() {
        ControlPointSetManager manager = ControlPointSetManager.fromClasspath();
        assertThrows(IllegalStateException.class, () -> manager.save(sample("mine")));
        assertThrows(IllegalStateException.class, () -> manager.delete("aemet-reconstructed-39"));
    }

    // ==================== File store ====================

    @Test
    @DisplayName("Saved sets survive a reload and can be deleted")
    void testSaveReloadDelete() throws IOException {
        Path file = tempDir.resolve("sets/control_points.json");
        ControlPointSetManager manager = ControlPointSetManager.open(file);
        assertTrue(manager.getAllSets().isEmpty());

        manager.save(sample("site-a"));
        manager.save(sample("site-b"));
        assertTrue(Files.exists(file));

        ControlPointSetManager reloaded = ControlPointSetManager.open(file);
        ControlPointSet a = reloaded.get("site-a");
        assertEquals(3, a.size());
        assertEquals(new ControlPoint(10, 0, 110, 200), a.getPoints().get(1));
        assertEquals("test set", a.getNotes());

        assertTrue(reloaded.delete("site-a"));
        assertFalse(reloaded.delete("site-a"));
        assertTrue(ControlPointSetManager.open(file).find("site-a").isEmpty());
        assertTrue(ControlPointSetManager.open(file).find("site-b").isPresent());
    }

    @Test
    @DisplayName("Malformed files are configuration errors")
    void testMalformed() throws IOException {
        Path truncated = tempDir.resolve("truncated.json");
        Files.writeString(truncated, "{\"x\": {\"crs\": \"EPSG:3857\", \"degree\": 1, \"points\": [[1, 2, 3]]}}");
        assertThrows(IllegalStateException.class, () -> ControlPointSetManager.open(truncated));

        Path badDegree = tempDir.resolve("degree.json");
        Files.writeString(badDegree, "{\"x\": {\"crs\": \"EPSG:3857\", \"degree\": 7, \"points\": []}}");
        assertThrows(IllegalStateException.class, () -> ControlPointSetManager.open(badDegree));

        Path notJson = tempDir.resolve("garbage.json");
        Files.writeString(notJson, "{ not json");
        assertThrows(IllegalStateException.class, () -> ControlPointSetManager.open(notJson));
    }
}
