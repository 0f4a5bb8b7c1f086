package radarsat.composite.projection;

import radarsat.composite.errors.ProjectionUndefinedException;

/**
 * A map projection expressed relative to geographic WGS84 longitude/latitude, which acts as the hub
 * through which any two registered projections are bridged.
 *
 * @since 0.2.0
 */
public interface Projection {

    /**
     * @return identifier used as projection tag on rasters and boxes (e.g. "EPSG:3857")
     */
    String getId();

    /**
     * Projects a geographic coordinate.
     *
     * @param lon longitude in degrees
     * @param lat latitude in degrees
     * @return projected [x, y]
     * @throws ProjectionUndefinedException if the projection is undefined at this point
     */
    double[] fromGeographic(double lon, double lat) throws ProjectionUndefinedException;

    /**
     * Inverse-projects a coordinate back to geographic longitude/latitude.
     *
     * @param x projected X
     * @param y projected Y
     * @return [lon, lat] in degrees
     * @throws ProjectionUndefinedException if no geographic point corresponds to (x, y)
     */
    double[] toGeographic(double x, double y) throws ProjectionUndefinedException;
}
