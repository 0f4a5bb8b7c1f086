package radarsat.composite.projection;

import radarsat.composite.errors.ProjectionUndefinedException;

/**
 * Spherical ("pseudo") Mercator on the WGS84 semi-major axis, EPSG:3857. This is the target
 * projection every layer of the composite ends up in.
 *
 * <p>Undefined towards the poles; the EPSG validity limit of +/-85.0511 degrees is enforced.</p>
 */
public final class WebMercatorProjection implements Projection {

    public static final String ID = "EPSG:3857";
    public static final double RADIUS = 6378137.0;
    public static final double MAX_LATITUDE = 85.05112877980659;

    private static final double MAX_Y = RADIUS * Math.PI;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public double[] fromGeographic(double lon, double lat) throws ProjectionUndefinedException {
        if (!Double.isFinite(lon) || !Double.isFinite(lat) || Math.abs(lat) > MAX_LATITUDE) {
            throw new ProjectionUndefinedException("Web Mercator undefined at (" + lon + ", " + lat + ")");
        }
        double x = RADIUS * Math.toRadians(lon);
        double y = RADIUS * Math.log(Math.tan(Math.PI / 4.0 + Math.toRadians(lat) / 2.0));
        return new double[]{x, y};
    }

    @Override
    public double[] toGeographic(double x, double y) throws ProjectionUndefinedException {
        if (!Double.isFinite(x) || !Double.isFinite(y) || Math.abs(y) > MAX_Y * 1.000001) {
            throw new ProjectionUndefinedException("Web Mercator inverse undefined at (" + x + ", " + y + ")");
        }
        double lon = Math.toDegrees(x / RADIUS);
        double lat = Math.toDegrees(2.0 * Math.atan(Math.exp(y / RADIUS)) - Math.PI / 2.0);
        return new double[]{lon, lat};
    }
}
