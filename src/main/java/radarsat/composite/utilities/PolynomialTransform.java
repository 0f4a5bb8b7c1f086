package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.IllConditionedFitException;
import radarsat.composite.errors.InsufficientControlPointsException;

import java.util.List;
import java.util.Locale;

/**
 * Bivariate polynomial mapping (u, v) to (x, y), fitted by least squares.
 *
 * <p>For degree 3 each axis uses ten terms, in this order:</p>
 * <pre>
 * 1, u, v, u^2, uv, v^2, u^3, u^2 v, u v^2, v^3
 * </pre>
 * <p>Inputs are centred on their mean and scaled to roughly [-1, 1] before evaluation, and outputs are
 * centred, which keeps the normal equations well conditioned when fitting pixel coordinates against
 * projected coordinates in the millions of metres. The normal equations are solved by Gaussian
 * elimination with partial pivoting; a pivot that is negligible relative to the matrix scale means the
 * points cannot determine the surface (collinear or duplicated points) and the fit fails.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * PolynomialTransform forward = PolynomialTransform.fit(pixels, projected, 3);
 * double[] xy = forward.transform(240.0, 240.0);
 * double worst = forward.getMaxResidual();
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 *
 * @since 0.1.0
 */
public final class PolynomialTransform {

    private static final Logger logger = LoggerFactory.getLogger(PolynomialTransform.class);

    /** Pivot magnitude, relative to the largest matrix entry, below which the system is singular. */
    static final double RELATIVE_PIVOT_TOLERANCE = 1e-12;

    private final int degree;
    private final double[] xCoefficients;
    private final double[] yCoefficients;
    private final double inCenterX;
    private final double inCenterY;
    private final double inScale;
    private final double outCenterX;
    private final double outCenterY;
    private final double maxResidual;
    private final double rmsResidual;

    private PolynomialTransform(int degree, double[] xCoefficients, double[] yCoefficients,
                                double inCenterX, double inCenterY, double inScale,
                                double outCenterX, double outCenterY,
                                double maxResidual, double rmsResidual) {
        this.degree = degree;
        this.xCoefficients = xCoefficients;
        this.yCoefficients = yCoefficients;
        this.inCenterX = inCenterX;
        this.inCenterY = inCenterY;
        this.inScale = inScale;
        this.outCenterX = outCenterX;
        this.outCenterY = outCenterY;
        this.maxResidual = maxResidual;
        this.rmsResidual = rmsResidual;
    }

    /**
     * Number of coefficients per axis for a polynomial of the given degree.
     */
    public static int termCount(int degree) {
        return (degree + 1) * (degree + 2) / 2;
    }

    /**
     * Smallest number of points that can determine a polynomial of the given degree.
     */
    public static int minimumPoints(int degree) {
        return termCount(degree);
    }

    /**
     * Fits {@code target = P(source)} by least squares.
     *
     * @param source input coordinates as [u, v] pairs
     * @param target output coordinates as [x, y] pairs, same order and size as {@code source}
     * @param degree polynomial degree, 1 to 3
     * @return the fitted transform
     * @throws InsufficientControlPointsException if fewer than {@link #minimumPoints(int)} pairs are given
     * @throws IllConditionedFitException if the normal equations are singular to working precision
     */
    public static PolynomialTransform fit(List<double[]> source, List<double[]> target, int degree)
            throws InsufficientControlPointsException, IllConditionedFitException {
        if (degree < 1 || degree > 3) {
            throw new IllegalArgumentException("Polynomial degree must be 1..3, got " + degree);
        }
        if (source.size() != target.size()) {
            throw new IllegalArgumentException("Source and target sizes differ: "
                    + source.size() + " vs " + target.size());
        }
        int n = source.size();
        int terms = termCount(degree);
        if (n < terms) {
            throw new InsufficientControlPointsException(String.format(Locale.ROOT,
                    "A degree %d polynomial needs at least %d control points, got %d", degree, terms, n));
        }

        double inCx = 0, inCy = 0, outCx = 0, outCy = 0;
        for (int i = 0; i < n; i++) {
            inCx += source.get(i)[0];
            inCy += source.get(i)[1];
            outCx += target.get(i)[0];
            outCy += target.get(i)[1];
        }
        inCx /= n;
        inCy /= n;
        outCx /= n;
        outCy /= n;

        double scale = 0;
        for (double[] p : source) {
            scale = Math.max(scale, Math.max(Math.abs(p[0] - inCx), Math.abs(p[1] - inCy)));
        }
        if (!(scale > 0) || !Double.isFinite(scale)) {
            throw new IllConditionedFitException("All control points share the same source coordinate");
        }

        // normal equations with two right-hand sides
        double[][] ata = new double[terms][terms];
        double[][] atb = new double[terms][2];
        double[] row = new double[terms];
        for (int i = 0; i < n; i++) {
            double[] s = source.get(i);
            double[] t = target.get(i);
            terms(degree, (s[0] - inCx) / scale, (s[1] - inCy) / scale, row);
            double bx = t[0] - outCx;
            double by = t[1] - outCy;
            for (int j = 0; j < terms; j++) {
                for (int k = 0; k < terms; k++) {
                    ata[j][k] += row[j] * row[k];
                }
                atb[j][0] += row[j] * bx;
                atb[j][1] += row[j] * by;
            }
        }

        double[][] solution = solve(ata, atb);
        double[] xc = new double[terms];
        double[] yc = new double[terms];
        for (int j = 0; j < terms; j++) {
            xc[j] = solution[j][0];
            yc[j] = solution[j][1];
        }

        PolynomialTransform unchecked = new PolynomialTransform(degree, xc, yc, inCx, inCy, scale,
                outCx, outCy, 0, 0);
        double max = 0;
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            double[] s = source.get(i);
            double[] t = target.get(i);
            double[] p = unchecked.transform(s[0], s[1]);
            double r = Math.hypot(p[0] - t[0], p[1] - t[1]);
            max = Math.max(max, r);
            sumSq += r * r;
        }
        double rms = Math.sqrt(sumSq / n);
        logger.debug("Fitted degree {} polynomial on {} points: max residual {}, rms {}",
                degree, n, max, rms);
        return new PolynomialTransform(degree, xc, yc, inCx, inCy, scale, outCx, outCy, max, rms);
    }

    /**
     * Gaussian elimination with partial pivoting, solving {@code a * x = b} for every column of {@code b}.
     * Both arrays are consumed.
     */
    static double[][] solve(double[][] a, double[][] b) throws IllConditionedFitException {
        int n = a.length;
        int m = b[0].length;
        double magnitude = 0;
        for (double[] r : a) {
            for (double v : r) {
                magnitude = Math.max(magnitude, Math.abs(v));
            }
        }
        double tolerance = magnitude * RELATIVE_PIVOT_TOLERANCE;

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int r = col + 1; r < n; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            if (!(Math.abs(a[pivot][col]) > tolerance)) {
                throw new IllConditionedFitException(String.format(Locale.ROOT,
                        "Normal equations are singular (pivot %.3e at column %d); control points may be collinear or duplicated",
                        a[pivot][col], col));
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;
            tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int r = col + 1; r < n; r++) {
                double f = a[r][col] / a[col][col];
                if (f == 0) {
                    continue;
                }
                for (int k = col; k < n; k++) {
                    a[r][k] -= f * a[col][k];
                }
                for (int k = 0; k < m; k++) {
                    b[r][k] -= f * b[col][k];
                }
            }
        }

        double[][] x = new double[n][m];
        for (int r = n - 1; r >= 0; r--) {
            for (int k = 0; k < m; k++) {
                double sum = b[r][k];
                for (int c = r + 1; c < n; c++) {
                    sum -= a[r][c] * x[c][k];
                }
                x[r][k] = sum / a[r][r];
            }
        }
        return x;
    }

    private static void terms(int degree, double u, double v, double[] out) {
        int i = 0;
        for (int total = 0; total <= degree; total++) {
            for (int j = 0; j <= total; j++) {
                out[i++] = Math.pow(u, total - j) * Math.pow(v, j);
            }
        }
    }

    /**
     * Evaluates the polynomial.
     *
     * @return [x, y]
     */
    public double[] transform(double u, double v) {
        int terms = xCoefficients.length;
        double[] t = new double[terms];
        terms(degree, (u - inCenterX) / inScale, (v - inCenterY) / inScale, t);
        double x = outCenterX;
        double y = outCenterY;
        for (int j = 0; j < terms; j++) {
            x += xCoefficients[j] * t[j];
            y += yCoefficients[j] * t[j];
        }
        return new double[]{x, y};
    }

    /**
     * Partial derivatives at (u, v) in input units.
     *
     * @return [dx/du, dx/dv, dy/du, dy/dv]
     */
    public double[] jacobian(double u, double v) {
        double nu = (u - inCenterX) / inScale;
        double nv = (v - inCenterY) / inScale;
        double dxdu = 0, dxdv = 0, dydu = 0, dydv = 0;
        int i = 0;
        for (int total = 0; total <= degree; total++) {
            for (int j = 0; j <= total; j++) {
                int pu = total - j;
                double du = pu == 0 ? 0 : pu * Math.pow(nu, pu - 1) * Math.pow(nv, j);
                double dv = j == 0 ? 0 : j * Math.pow(nu, pu) * Math.pow(nv, j - 1);
                dxdu += xCoefficients[i] * du;
                dxdv += xCoefficients[i] * dv;
                dydu += yCoefficients[i] * du;
                dydv += yCoefficients[i] * dv;
                i++;
            }
        }
        return new double[]{dxdu / inScale, dxdv / inScale, dydu / inScale, dydv / inScale};
    }

    /**
     * Solves {@code transform(u, v) = (x, y)} by Newton iteration from a starting guess.
     *
     * @param x target X
     * @param y target Y
     * @param seedU initial U, typically from a fitted inverse polynomial
     * @param seedV initial V
     * @param maxIterations iteration limit
     * @param tolerance convergence threshold on the step length, in input units
     * @return refined [u, v]; the seed itself if the iteration breaks down
     */
    public double[] invert(double x, double y, double seedU, double seedV, int maxIterations, double tolerance) {
        double u = seedU;
        double v = seedV;
        for (int it = 0; it < maxIterations; it++) {
            double[] p = transform(u, v);
            double[] j = jacobian(u, v);
            double det = j[0] * j[3] - j[1] * j[2];
            if (det == 0 || !Double.isFinite(det)) {
                return new double[]{seedU, seedV};
            }
            double ex = x - p[0];
            double ey = y - p[1];
            double du = (j[3] * ex - j[1] * ey) / det;
            double dv = (-j[2] * ex + j[0] * ey) / det;
            u += du;
            v += dv;
            if (!Double.isFinite(u) || !Double.isFinite(v)) {
                return new double[]{seedU, seedV};
            }
            if (Math.hypot(du, dv) < tolerance) {
                break;
            }
        }
        return new double[]{u, v};
    }

    public int getDegree() {
        return degree;
    }

    /**
     * @return largest distance between a fitted point and its target, in output units
     */
    public double getMaxResidual() {
        return maxResidual;
    }

    public double getRmsResidual() {
        return rmsResidual;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "PolynomialTransform[degree=%d, maxResidual=%.4f, rms=%.4f]",
                degree, maxResidual, rmsResidual);
    }
}
