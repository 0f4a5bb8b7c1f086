package radarsat.composite.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, versioned set of control points together with the polynomial degree it is meant to be fitted with.
 * The points are constant configuration data describing the fixed radar antenna geometry.
 *
 * @since 0.2.0
 */
public final class ControlPointSet {
    private final String name;
    private final String projectionId;
    private final int degree;
    private final String notes;
    private final List<ControlPoint> points;

    public ControlPointSet(String name, String projectionId, int degree, String notes, List<ControlPoint> points) {
        this.name = Objects.requireNonNull(name, "name");
        this.projectionId = Objects.requireNonNull(projectionId, "projectionId");
        if (degree < 1 || degree > 3) {
            throw new IllegalArgumentException("Polynomial degree must be 1..3, got " + degree);
        }
        this.degree = degree;
        this.notes = notes;
        this.points = List.copyOf(points);
    }

    public String getName() { return name; }
    public String getProjectionId() { return projectionId; }
    public int getDegree() { return degree; }
    public String getNotes() { return notes; }
    public List<ControlPoint> getPoints() { return points; }

    public int size() {
        return points.size();
    }

    @Override
    public String toString() {
        return String.format("%s (%d points, %s, degree %d)", name, points.size(), projectionId, degree);
    }
}
