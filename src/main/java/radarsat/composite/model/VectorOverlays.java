package radarsat.composite.model;

import java.util.List;
import java.util.Objects;

/**
 * Pre-parsed vector geometry drawn on top of the rasters: boundary polygons and labelled points,
 * all expressed in one projection (usually EPSG:4326) and reprojected at draw time.
 *
 * @since 0.3.0
 */
public final class VectorOverlays {
    private final String projectionId;
    private final List<PolygonFeature> polygons;
    private final List<PointFeature> points;

    public VectorOverlays(String projectionId, List<PolygonFeature> polygons, List<PointFeature> points) {
        this.projectionId = Objects.requireNonNull(projectionId, "projectionId");
        this.polygons = polygons == null ? List.of() : List.copyOf(polygons);
        this.points = points == null ? List.of() : List.copyOf(points);
    }

    public static VectorOverlays none() {
        return new VectorOverlays("EPSG:4326", List.of(), List.of());
    }

    public String getProjectionId() { return projectionId; }
    public List<PolygonFeature> getPolygons() { return polygons; }
    public List<PointFeature> getPoints() { return points; }

    public boolean isEmpty() {
        return polygons.isEmpty() && points.isEmpty();
    }
}
