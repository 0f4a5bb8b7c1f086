package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.IllConditionedFitException;
import radarsat.composite.errors.InsufficientControlPointsException;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.ControlPoint;
import radarsat.composite.model.ControlPointSet;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Georeferences cleaned radar frames with a polynomial fitted to a fixed control-point set.
 *
 * <p>The fit happens once, in the constructor: a forward polynomial (pixel to projected) and an inverse
 * polynomial (projected to pixel) of the set's degree. Because the antenna geometry never changes, one
 * warper is built per control-point set and shared read-only by every frame and thread.</p>
 *
 * <h3>Resampling</h3>
 * <p>The destination grid covers the forward image of the source boundary, sampled once per source
 * pixel along every edge. Pixels are square and sized so the destination diagonal has as many pixels as
 * the source diagonal. For each destination pixel centre, the inverse polynomial gives a first guess of
 * the source position which Newton iteration on the forward polynomial then refines. The source pixel
 * containing that position is copied unchanged (nearest neighbour, as radar colours are categorical);
 * positions outside the source are transparent.</p>
 *
 * <pre>{@code
 * GCPWarper warper = new GCPWarper(controlPoints);
 * GCPWarper.WarpResult result = warper.warp(cleaner.clean(rawFrame));
 * BoundingBox footprint = result.extent();
 * }</pre>
 *
 * @since 0.1.0
 */
public class GCPWarper {

    private static final Logger logger = LoggerFactory.getLogger(GCPWarper.class);

    private static final int NEWTON_ITERATIONS = 5;
    private static final double NEWTON_TOLERANCE = 1e-6;

    private final ControlPointSet controlPoints;
    private final PolynomialTransform forward;
    private final PolynomialTransform inverse;

    /**
     * Georeferenced output raster and its extent in the target projection.
     */
    public record WarpResult(RasterImage raster, BoundingBox extent) {
    }

    /**
     * Fits the forward and inverse polynomials.
     *
     * @param controlPoints points in the target projection
     * @throws InsufficientControlPointsException if the set has too few points for its degree
     * @throws IllConditionedFitException if the points cannot determine the polynomial
     */
    public GCPWarper(ControlPointSet controlPoints)
            throws InsufficientControlPointsException, IllConditionedFitException {
        this.controlPoints = Objects.requireNonNull(controlPoints, "controlPoints");
        int degree = controlPoints.getDegree();
        List<double[]> pixels = new ArrayList<>();
        List<double[]> projected = new ArrayList<>();
        for (ControlPoint p : controlPoints.getPoints()) {
            pixels.add(new double[]{p.pixelX(), p.pixelY()});
            projected.add(new double[]{p.projX(), p.projY()});
        }
        logger.info("Fitting degree {} polynomial to control-point set {}", degree, controlPoints);
        this.forward = PolynomialTransform.fit(pixels, projected, degree);
        this.inverse = PolynomialTransform.fit(projected, pixels, degree);
        logger.info("Forward fit: max residual {} m, rms {} m", String.format("%.3f", forward.getMaxResidual()),
                String.format("%.3f", forward.getRmsResidual()));
    }

    public ControlPointSet getControlPoints() { return controlPoints; }
    public PolynomialTransform getForward() { return forward; }
    public PolynomialTransform getInverse() { return inverse; }

    public String getProjectionId() {
        return controlPoints.getProjectionId();
    }

    /**
     * Projected coordinate of a source pixel position (corner-based).
     */
    public double[] pixelToProjected(double pixelX, double pixelY) {
        return forward.transform(pixelX, pixelY);
    }

    /**
     * Source pixel position of a projected coordinate, refined with Newton iteration.
     */
    public double[] projectedToPixel(double x, double y) {
        double[] seed = inverse.transform(x, y);
        return forward.invert(x, y, seed[0], seed[1], NEWTON_ITERATIONS, NEWTON_TOLERANCE);
    }

    /**
     * Footprint of a {@code width x height} source image in the target projection.
     */
    public BoundingBox footprint(int width, int height) {
        int samples = 2 * (width + height);
        double[][] boundary = new double[samples][];
        int i = 0;
        for (int c = 0; c < width; c++) {
            boundary[i++] = forward.transform(c, 0);
            boundary[i++] = forward.transform(width - c, height);
        }
        for (int r = 0; r < height; r++) {
            boundary[i++] = forward.transform(width, r);
            boundary[i++] = forward.transform(0, height - r);
        }
        return BoundingBox.enclosing(boundary, getProjectionId());
    }

    /**
     * Resamples a cleaned frame into the target projection.
     *
     * @param cleaned RGBA (or RGB) data area, pixel space matching the control points
     * @return georeferenced RGBA raster and its extent
     */
    public WarpResult warp(RasterImage cleaned) {
        RasterImage source = cleaned.toRgba();
        int sw = source.getWidth();
        int sh = source.getHeight();
        BoundingBox extent = footprint(sw, sh);

        double sourceDiagonal = Math.hypot(sw, sh);
        double resolution = Math.hypot(extent.getWidth(), extent.getHeight()) / sourceDiagonal;
        int dw = Math.max(1, (int) Math.ceil(extent.getWidth() / resolution));
        int dh = Math.max(1, (int) Math.ceil(extent.getHeight() / resolution));
        GeoTransform gt = GeoTransform.northUp(extent.getMinX(), extent.getMaxY(), resolution, resolution);
        logger.info("Warping {}x{} frame to {}x{} at {} m/px, extent {}", sw, sh, dw, dh,
                String.format("%.1f", resolution), extent);

        float[] out = new float[dw * dh * 4];
        float[] pixel = new float[4];
        int filled = 0;
        for (int row = 0; row < dh; row++) {
            double y = extent.getMaxY() - (row + 0.5) * resolution;
            for (int col = 0; col < dw; col++) {
                double x = extent.getMinX() + (col + 0.5) * resolution;
                double[] src = projectedToPixel(x, y);
                int sc = (int) Math.floor(src[0]);
                int sr = (int) Math.floor(src[1]);
                if (!Double.isFinite(src[0]) || !Double.isFinite(src[1]) || !source.contains(sc, sr)) {
                    continue;
                }
                source.getPixel(sc, sr, pixel, 0);
                System.arraycopy(pixel, 0, out, (row * dw + col) * 4, 4);
                filled++;
            }
        }
        logger.debug("Warp filled {} of {} destination pixels", filled, dw * dh);

        RasterImage raster = RasterImage.adopt(dw, dh, PixelFormat.RGBA, 4, out, gt, getProjectionId());
        return new WarpResult(raster, raster.getExtent());
    }
}
