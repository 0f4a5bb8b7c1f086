package radarsat.composite.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.BoundingBox;

import java.util.Objects;

/**
 * Converts coordinates and bounding boxes between any two registered projections, passing through
 * geographic longitude/latitude.
 *
 * <p>A box is transformed corner by corner and the result is the bounding box of the four transformed
 * corners; axis alignment is never assumed to survive the transform. Use this to express the warped
 * radar footprint in the satellite's native projection before subsetting.</p>
 *
 * @since 0.2.0
 */
public class ProjectionBridge {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionBridge.class);

    private final ProjectionRegistry registry;

    public ProjectionBridge(ProjectionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ProjectionRegistry getRegistry() {
        return registry;
    }

    /**
     * Point transform between two fixed projections, resolved once for per-pixel loops.
     */
    @FunctionalInterface
    public interface PointTransformer {
        double[] apply(double x, double y) throws ProjectionUndefinedException;
    }

    /**
     * Resolves both projections once and returns a reusable point transform.
     *
     * @throws IllegalStateException if either projection is unknown
     */
    public PointTransformer pointTransformer(String sourceId, String targetId) {
        Projection source = registry.get(sourceId);
        Projection target = registry.get(targetId);
        if (source == target) {
            return (x, y) -> new double[]{x, y};
        }
        return (x, y) -> transform(x, y, source, target);
    }

    /**
     * Transforms a single point.
     *
     * @return [x, y] in the target projection
     * @throws ProjectionUndefinedException if either leg of the transform is undefined at this point
     */
    public double[] transformPoint(double x, double y, String sourceId, String targetId)
            throws ProjectionUndefinedException {
        return pointTransformer(sourceId, targetId).apply(x, y);
    }

    /**
     * Transforms a box into another projection.
     *
     * @param box box tagged with its projection
     * @param targetId target projection
     * @return normalized box of the transformed corners, tagged with {@code targetId}
     * @throws ProjectionUndefinedException if any corner cannot be transformed
     */
    public BoundingBox transformBox(BoundingBox box, String targetId) throws ProjectionUndefinedException {
        Projection source = registry.get(box.getProjectionId());
        Projection target = registry.get(targetId);
        if (source == target) {
            return new BoundingBox(box.getMinX(), box.getMinY(), box.getMaxX(), box.getMaxY(), target.getId());
        }
        double[][] corners = box.getCorners();
        double[][] transformed = new double[corners.length][];
        for (int i = 0; i < corners.length; i++) {
            transformed[i] = transform(corners[i][0], corners[i][1], source, target);
        }
        BoundingBox result = BoundingBox.enclosing(transformed, target.getId());
        logger.debug("Transformed {} -> {}", box, result);
        return result;
    }

    private static double[] transform(double x, double y, Projection source, Projection target)
            throws ProjectionUndefinedException {
        double[] lonLat = source.toGeographic(x, y);
        return target.fromGeographic(lonLat[0], lonLat[1]);
    }
}
