package radarsat.composite.projection;

import radarsat.composite.errors.ProjectionUndefinedException;

/**
 * WGS84 longitude/latitude in degrees (EPSG:4326). Identity with respect to the hub coordinates.
 */
public final class GeographicProjection implements Projection {

    public static final String ID = "EPSG:4326";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public double[] fromGeographic(double lon, double lat) throws ProjectionUndefinedException {
        check(lon, lat);
        return new double[]{lon, lat};
    }

    @Override
    public double[] toGeographic(double x, double y) throws ProjectionUndefinedException {
        check(x, y);
        return new double[]{x, y};
    }

    private static void check(double lon, double lat) throws ProjectionUndefinedException {
        if (!Double.isFinite(lon) || !Double.isFinite(lat) || Math.abs(lat) > 90.0) {
            throw new ProjectionUndefinedException("Invalid geographic coordinate (" + lon + ", " + lat + ")");
        }
    }
}
