package radarsat.composite.projection;

import radarsat.composite.errors.ProjectionUndefinedException;

import java.util.Locale;

/**
 * Geostationary satellite view projection ("geos"), the native grid of the SEVIRI imager.
 *
 * <p>Projected coordinates are scan angles scaled by the satellite height above the ellipsoid, in metres,
 * matching the usual {@code +proj=geos} definition. The sweep axis selects which scan angle is measured
 * first: {@code y} for the Meteosat instruments, {@code x} for GOES.</p>
 *
 * <h3>Reference parameters (Meteosat 0 degree service)</h3>
 * <pre>{@code
 * GeostationaryProjection seviri = GeostationaryProjection.seviri("SEVIRI:GEOS", 0.0);
 * double[] xy = seviri.fromGeographic(2.997, 41.889);
 * }</pre>
 *
 * <p>Points on the far side of the Earth, or beyond the limb, are not visible from the satellite and
 * raise {@link ProjectionUndefinedException}; so do projected coordinates that miss the Earth disk.</p>
 *
 * @since 0.2.0
 */
public final class GeostationaryProjection implements Projection {

    public static final double SEVIRI_HEIGHT = 35785831.0;
    public static final double SEVIRI_SEMI_MAJOR = 6378169.0;
    public static final double SEVIRI_SEMI_MINOR = 6356583.8;

    private final String id;
    private final double centralLongitude;
    private final double height;
    private final double semiMajor;
    private final boolean sweepX;

    private final double radiusP;
    private final double radiusP2;
    private final double radiusPInv2;
    private final double radiusG;
    private final double radiusG1;
    private final double c;

    /**
     * @param id projection identifier
     * @param centralLongitude sub-satellite longitude in degrees
     * @param height satellite height above the ellipsoid in metres
     * @param semiMajor ellipsoid semi-major axis in metres
     * @param semiMinor ellipsoid semi-minor axis in metres
     * @param sweep sweep axis, "x" or "y"
     */
    public GeostationaryProjection(String id, double centralLongitude, double height,
                                   double semiMajor, double semiMinor, String sweep) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Projection id is required");
        }
        if (!(height > 0) || !(semiMajor > 0) || !(semiMinor > 0) || semiMinor > semiMajor) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Invalid geostationary parameters h=%s a=%s b=%s", height, semiMajor, semiMinor));
        }
        String s = sweep == null ? "y" : sweep.trim().toLowerCase(Locale.ROOT);
        if (!s.equals("x") && !s.equals("y")) {
            throw new IllegalArgumentException("Sweep axis must be 'x' or 'y', got: " + sweep);
        }
        this.id = id;
        this.centralLongitude = centralLongitude;
        this.height = height;
        this.semiMajor = semiMajor;
        this.sweepX = s.equals("x");

        this.radiusP = semiMinor / semiMajor;
        this.radiusP2 = radiusP * radiusP;
        this.radiusPInv2 = 1.0 / radiusP2;
        this.radiusG1 = height / semiMajor;
        this.radiusG = 1.0 + radiusG1;
        this.c = radiusG * radiusG - 1.0;
    }

    /**
     * SEVIRI geometry with the given identifier and sub-satellite longitude, sweep y.
     */
    public static GeostationaryProjection seviri(String id, double centralLongitude) {
        return new GeostationaryProjection(id, centralLongitude, SEVIRI_HEIGHT,
                SEVIRI_SEMI_MAJOR, SEVIRI_SEMI_MINOR, "y");
    }

    @Override
    public String getId() {
        return id;
    }

    public double getCentralLongitude() { return centralLongitude; }
    public double getHeight() { return height; }
    public boolean isSweepX() { return sweepX; }

    @Override
    public double[] fromGeographic(double lon, double lat) throws ProjectionUndefinedException {
        if (!Double.isFinite(lon) || !Double.isFinite(lat) || Math.abs(lat) > 90.0) {
            throw new ProjectionUndefinedException("Invalid geographic coordinate (" + lon + ", " + lat + ")");
        }
        double lam = Math.toRadians(lon - centralLongitude);
        double phi = Math.atan(radiusP2 * Math.tan(Math.toRadians(lat)));

        double r = radiusP / Math.hypot(radiusP * Math.cos(phi), Math.sin(phi));
        double vx = r * Math.cos(lam) * Math.cos(phi);
        double vy = r * Math.sin(lam) * Math.cos(phi);
        double vz = r * Math.sin(phi);

        double tmp = radiusG - vx;
        // behind the limb
        if (tmp * vx - vy * vy - vz * vz * radiusPInv2 < 0.0) {
            throw new ProjectionUndefinedException(String.format(Locale.ROOT,
                    "(%.4f, %.4f) is not visible from %s", lon, lat, id));
        }

        double x;
        double y;
        if (sweepX) {
            x = radiusG1 * Math.atan(vy / Math.hypot(vz, tmp));
            y = radiusG1 * Math.atan(vz / tmp);
        } else {
            x = radiusG1 * Math.atan(vy / tmp);
            y = radiusG1 * Math.atan(vz / Math.hypot(vy, tmp));
        }
        return new double[]{x * semiMajor, y * semiMajor};
    }

    @Override
    public double[] toGeographic(double x, double y) throws ProjectionUndefinedException {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new ProjectionUndefinedException("Non-finite coordinate (" + x + ", " + y + ")");
        }
        double sx = x / semiMajor;
        double sy = y / semiMajor;

        double vx = -1.0;
        double vy;
        double vz;
        if (sweepX) {
            vz = Math.tan(sy / radiusG1);
            vy = Math.tan(sx / radiusG1) * Math.hypot(1.0, vz);
        } else {
            vy = Math.tan(sx / radiusG1);
            vz = Math.tan(sy / radiusG1) * Math.hypot(1.0, vy);
        }

        // ray from the satellite against the ellipsoid
        double a = vz / radiusP;
        a = vy * vy + a * a + vx * vx;
        double b = 2.0 * radiusG * vx;
        double det = b * b - 4.0 * a * c;
        if (det < 0.0) {
            throw new ProjectionUndefinedException(String.format(Locale.ROOT,
                    "(%.1f, %.1f) lies off the Earth disk of %s", x, y, id));
        }
        double k = (-b - Math.sqrt(det)) / (2.0 * a);
        vx = radiusG + k * vx;
        vy *= k;
        vz *= k;

        double lam = Math.atan2(vy, vx);
        double phi = Math.atan(vz * Math.cos(lam) / vx);
        phi = Math.atan(radiusPInv2 * Math.tan(phi));
        return new double[]{Math.toDegrees(lam) + centralLongitude, Math.toDegrees(phi)};
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s[geos lon_0=%.2f h=%.0f sweep=%s]",
                id, centralLongitude, height, sweepX ? "x" : "y");
    }
}
