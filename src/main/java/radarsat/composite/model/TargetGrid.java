package radarsat.composite.model;

import java.util.Objects;

/**
 * A raster grid definition without pixel data: size, geotransform and projection.
 *
 * @param width width in pixels
 * @param height height in pixels
 * @param geoTransform pixel to projected mapping
 * @param projectionId projection of the grid
 */
public record TargetGrid(int width, int height, GeoTransform geoTransform, String projectionId) {

    public TargetGrid {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        Objects.requireNonNull(geoTransform, "geoTransform");
        Objects.requireNonNull(projectionId, "projectionId");
    }

    /**
     * The grid a georeferenced raster lives on.
     */
    public static TargetGrid of(RasterImage raster) {
        if (!raster.isGeoreferenced()) {
            throw new IllegalArgumentException("Raster has no geotransform");
        }
        return new TargetGrid(raster.getWidth(), raster.getHeight(), raster.getGeoTransform(), raster.getProjectionId());
    }
}
