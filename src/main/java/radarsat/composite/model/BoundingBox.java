package radarsat.composite.model;

import java.util.Locale;

/**
 * Represents a rectangular extent in a named projection, defined by two corner points.
 *
 * <p>This immutable data class carries footprints between the pipeline stages: the warped radar
 * footprint in the target projection, the same footprint expressed in the satellite's native
 * projection, and the compositor canvas. The corner points can be given in any order; the
 * accessors always return normalized values (min &le; max), which matters because coordinate
 * transforms may invert axis order (image rows grow southwards, projected Y grows northwards).</p>
 *
 * <h3>Usage Examples</h3>
 * <pre>{@code
 * // Corners in any order
 * BoundingBox box = new BoundingBox(500.0, 800.0, 100.0, 200.0, "EPSG:3857");
 * box.getMinX();   // 100.0
 * box.getMaxY();   // 800.0
 *
 * // Grow by a margin before subsetting a satellite raster
 * BoundingBox withMargin = box.expand(50_000);
 * }</pre>
 *
 * <h3>Constraints</h3>
 * <ul>
 *   <li><strong>No unit validation:</strong> metres, degrees or pixels, whatever the projection uses</li>
 *   <li><strong>Immutable:</strong> every operation returns a new box</li>
 *   <li><strong>Order independent:</strong> corner points can be specified in any order</li>
 * </ul>
 *
 * @since 0.1.0
 */
public class BoundingBox {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;
    private final String projectionId;

    /**
     * Creates a new bounding box from two corner points.
     *
     * @param x1 X-coordinate of first corner
     * @param y1 Y-coordinate of first corner
     * @param x2 X-coordinate of second corner
     * @param y2 Y-coordinate of second corner
     * @param projectionId projection the coordinates are expressed in (may be null for pixel space)
     */
    public BoundingBox(double x1, double y1, double x2, double y2, String projectionId) {
        if (!Double.isFinite(x1) || !Double.isFinite(y1) || !Double.isFinite(x2) || !Double.isFinite(y2)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Bounding box corners must be finite: (%s, %s) (%s, %s)", x1, y1, x2, y2));
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
        this.projectionId = projectionId;
    }

    /**
     * Returns the smallest box containing all given points, in the given projection.
     *
     * @param points array of [x, y] pairs, at least one
     */
    public static BoundingBox enclosing(double[][] points, String projectionId) {
        if (points == null || points.length == 0) {
            throw new IllegalArgumentException("At least one point is required");
        }
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (double[] p : points) {
            minX = Math.min(minX, p[0]);
            maxX = Math.max(maxX, p[0]);
            minY = Math.min(minY, p[1]);
            maxY = Math.max(maxY, p[1]);
        }
        return new BoundingBox(minX, minY, maxX, maxY, projectionId);
    }

    public double getMinX() { return Math.min(x1, x2); }

    public double getMaxX() { return Math.max(x1, x2); }

    public double getMinY() { return Math.min(y1, y2); }

    public double getMaxY() { return Math.max(y1, y2); }

    public double getWidth() { return Math.abs(x2 - x1); }

    public double getHeight() { return Math.abs(y2 - y1); }

    public double getCenterX() { return (x1 + x2) / 2.0; }

    public double getCenterY() { return (y1 + y2) / 2.0; }

    public String getProjectionId() { return projectionId; }

    /**
     * Returns the four corners as [x, y] pairs: lower-left, lower-right, upper-right, upper-left.
     */
    public double[][] getCorners() {
        return new double[][]{
                {getMinX(), getMinY()},
                {getMaxX(), getMinY()},
                {getMaxX(), getMaxY()},
                {getMinX(), getMaxY()}
        };
    }

    /**
     * Grows the box by {@code margin} on every side.
     */
    public BoundingBox expand(double margin) {
        return new BoundingBox(getMinX() - margin, getMinY() - margin,
                getMaxX() + margin, getMaxY() + margin, projectionId);
    }

    /**
     * @return true if the point lies inside or on the border
     */
    public boolean contains(double x, double y) {
        return x >= getMinX() && x <= getMaxX() && y >= getMinY() && y <= getMaxY();
    }

    /**
     * @return true if the point lies strictly inside, at least {@code inset} away from every edge
     */
    public boolean containsInterior(double x, double y, double inset) {
        return x > getMinX() + inset && x < getMaxX() - inset
                && y > getMinY() + inset && y < getMaxY() - inset;
    }

    /**
     * @return true if both boxes share a region of positive area
     */
    public boolean intersects(BoundingBox other) {
        return other.getMinX() < getMaxX() && other.getMaxX() > getMinX()
                && other.getMinY() < getMaxY() && other.getMaxY() > getMinY();
    }

    /**
     * Returns the smallest box covering both boxes. Projections must match.
     */
    public BoundingBox union(BoundingBox other) {
        requireSameProjection(other);
        return new BoundingBox(Math.min(getMinX(), other.getMinX()), Math.min(getMinY(), other.getMinY()),
                Math.max(getMaxX(), other.getMaxX()), Math.max(getMaxY(), other.getMaxY()), projectionId);
    }

    private void requireSameProjection(BoundingBox other) {
        if (projectionId != null && other.projectionId != null && !projectionId.equals(other.projectionId)) {
            throw new IllegalArgumentException("Projection mismatch: " + projectionId + " vs " + other.projectionId);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "BoundingBox[%s: %.3f, %.3f, %.3f, %.3f]",
                projectionId, getMinX(), getMinY(), getMaxX(), getMaxY());
    }
}
