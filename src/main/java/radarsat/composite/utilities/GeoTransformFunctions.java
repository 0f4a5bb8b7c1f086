package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.GeoTransform;

import java.awt.Rectangle;
import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;

/**
 * Conversions between pixel and projected coordinates through a {@link GeoTransform}.
 *
 * <p>Coordinate systems:</p>
 * <ul>
 *   <li><b>Pixel:</b> (col, row) on pixel corners, (0, 0) top-left, centres at +0.5</li>
 *   <li><b>Projected:</b> metres (or degrees) in the raster's projection</li>
 * </ul>
 *
 * @since 0.2.0
 */
public class GeoTransformFunctions {
    private static final Logger logger = LoggerFactory.getLogger(GeoTransformFunctions.class);

    /** Slack applied before rounding a pixel window outwards, so exact edges do not grow it by a pixel. */
    static final double WINDOW_EPSILON = 1e-6;

    private GeoTransformFunctions() {
    }

    // ==================== POINT TRANSFORMATIONS ====================

    /**
     * Transforms a pixel position to projected coordinates.
     *
     * @param col column, corner-based
     * @param row row, corner-based
     * @param geoTransform raster geotransform
     * @return [x, y]
     */
    public static double[] pixelToProjected(double col, double row, GeoTransform geoTransform) {
        Point2D.Double dst = new Point2D.Double();
        geoTransform.toAffineTransform().transform(new Point2D.Double(col, row), dst);
        return new double[]{dst.x, dst.y};
    }

    /**
     * Transforms projected coordinates to a (fractional) pixel position.
     *
     * @return [col, row]
     * @throws IllegalStateException if the transform cannot be inverted
     */
    public static double[] projectedToPixel(double x, double y, GeoTransform geoTransform) {
        return toPixel(inverseOf(geoTransform), x, y);
    }

    /**
     * Inverse (projected to pixel) of a geotransform, for loops that convert many points.
     *
     * @throws IllegalStateException if the transform cannot be inverted
     */
    public static AffineTransform inverseOf(GeoTransform geoTransform) {
        try {
            return geoTransform.toAffineTransform().createInverse();
        } catch (NoninvertibleTransformException e) {
            throw new IllegalStateException("Cannot invert geotransform " + geoTransform, e);
        }
    }

    static double[] toPixel(AffineTransform inverse, double x, double y) {
        Point2D.Double dst = new Point2D.Double();
        inverse.transform(new Point2D.Double(x, y), dst);
        return new double[]{dst.x, dst.y};
    }

    // ==================== WINDOWS ====================

    /**
     * Smallest pixel-aligned window covering a projected box, clipped to the raster.
     * All four box corners are mapped, so rotated geotransforms are handled.
     *
     * @return the window; empty (zero width or height) when the box misses the raster
     */
    public static Rectangle pixelWindow(BoundingBox box, GeoTransform geoTransform, int width, int height) {
        AffineTransform inverse = inverseOf(geoTransform);
        double minCol = Double.POSITIVE_INFINITY, minRow = Double.POSITIVE_INFINITY;
        double maxCol = Double.NEGATIVE_INFINITY, maxRow = Double.NEGATIVE_INFINITY;
        for (double[] corner : box.getCorners()) {
            double[] p = toPixel(inverse, corner[0], corner[1]);
            minCol = Math.min(minCol, p[0]);
            maxCol = Math.max(maxCol, p[0]);
            minRow = Math.min(minRow, p[1]);
            maxRow = Math.max(maxRow, p[1]);
        }
        int c0 = (int) Math.max(0, Math.floor(minCol + WINDOW_EPSILON));
        int r0 = (int) Math.max(0, Math.floor(minRow + WINDOW_EPSILON));
        int c1 = (int) Math.min(width, Math.ceil(maxCol - WINDOW_EPSILON));
        int r1 = (int) Math.min(height, Math.ceil(maxRow - WINDOW_EPSILON));
        Rectangle window = new Rectangle(c0, r0, Math.max(0, c1 - c0), Math.max(0, r1 - r0));
        logger.debug("Box {} -> pixel window {}", box, window);
        return window;
    }

    // ==================== DIAGNOSTICS ====================

    /**
     * Logs the geotransform coefficients and derived scale at DEBUG.
     */
    public static void logTransformDetails(String name, GeoTransform geoTransform) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        AffineTransform at = geoTransform.toAffineTransform();
        logger.debug("{} geotransform: {}", name, geoTransform);
        logger.debug("  Pixel size: {} x {}", Math.hypot(at.getScaleX(), at.getShearY()),
                Math.hypot(at.getShearX(), at.getScaleY()));
        logger.debug("  Determinant: {}", at.getDeterminant());
    }
}
