package radarsat.composite.model;

/**
 * A labelled point such as a city.
 *
 * @param name display name used for labels
 * @param x X (longitude for EPSG:4326 overlays)
 * @param y Y (latitude for EPSG:4326 overlays)
 */
public record PointFeature(String name, double x, double y) {
}
