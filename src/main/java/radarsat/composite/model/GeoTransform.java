package radarsat.composite.model;

import java.awt.geom.AffineTransform;
import java.util.Arrays;

/**
 * Six-coefficient affine geotransform mapping pixel (col, row) to projected (x, y).
 *
 * <p>Coefficients follow the GDAL ordering:</p>
 * <pre>
 * x = c[0] + col * c[1] + row * c[2]
 * y = c[3] + col * c[4] + row * c[5]
 * </pre>
 * <p>(col, row) address pixel corners: (0, 0) is the top-left corner of the top-left pixel and
 * pixel centres sit at +0.5. A geotransform is never degenerate; the constructor rejects a
 * zero determinant.</p>
 *
 * @since 0.1.0
 */
public final class GeoTransform {

    private final double[] coefficients;

    public GeoTransform(double originX, double pixelWidth, double rowRotation,
                        double originY, double columnRotation, double pixelHeight) {
        double det = pixelWidth * pixelHeight - rowRotation * columnRotation;
        if (!Double.isFinite(det) || det == 0.0) {
            throw new IllegalArgumentException("Degenerate geotransform, determinant = " + det);
        }
        this.coefficients = new double[]{originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight};
    }

    /**
     * Creates a north-up geotransform (no rotation, rows running southwards).
     *
     * @param minX projected X of the left edge
     * @param maxY projected Y of the top edge
     * @param pixelWidth pixel size along X, positive
     * @param pixelHeight pixel size along Y, positive (stored negated)
     */
    public static GeoTransform northUp(double minX, double maxY, double pixelWidth, double pixelHeight) {
        return new GeoTransform(minX, pixelWidth, 0.0, maxY, 0.0, -pixelHeight);
    }

    public static GeoTransform fromCoefficients(double[] c) {
        if (c == null || c.length != 6) {
            throw new IllegalArgumentException("Geotransform needs exactly 6 coefficients");
        }
        return new GeoTransform(c[0], c[1], c[2], c[3], c[4], c[5]);
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getOriginX() { return coefficients[0]; }
    public double getPixelWidth() { return coefficients[1]; }
    public double getRowRotation() { return coefficients[2]; }
    public double getOriginY() { return coefficients[3]; }
    public double getColumnRotation() { return coefficients[4]; }
    public double getPixelHeight() { return coefficients[5]; }

    public double getDeterminant() {
        return coefficients[1] * coefficients[5] - coefficients[2] * coefficients[4];
    }

    /**
     * @return the equivalent {@link AffineTransform} (pixel to projected)
     */
    public AffineTransform toAffineTransform() {
        return new AffineTransform(coefficients[1], coefficients[4], coefficients[2],
                coefficients[5], coefficients[0], coefficients[3]);
    }

    /**
     * Returns the geotransform of a window whose top-left pixel is (colOffset, rowOffset) in this grid.
     */
    public GeoTransform shifted(int colOffset, int rowOffset) {
        double x0 = coefficients[0] + colOffset * coefficients[1] + rowOffset * coefficients[2];
        double y0 = coefficients[3] + colOffset * coefficients[4] + rowOffset * coefficients[5];
        return new GeoTransform(x0, coefficients[1], coefficients[2], y0, coefficients[4], coefficients[5]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoTransform other)) return false;
        return Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return String.format("[%.3f, %.3f, %.3f, %.3f, %.3f, %.3f]",
                coefficients[0], coefficients[1], coefficients[2],
                coefficients[3], coefficients[4], coefficients[5]);
    }
}
