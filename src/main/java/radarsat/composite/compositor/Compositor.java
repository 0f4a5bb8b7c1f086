package radarsat.composite.compositor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.EmptyLayerSetException;
import radarsat.composite.errors.IncompatibleLayerExtentException;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.PolygonFeature;
import radarsat.composite.model.RasterImage;
import radarsat.composite.model.VectorOverlays;
import radarsat.composite.projection.ProjectionBridge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Layers the calibrated satellite band, boundary polygons, the georeferenced radar raster and city
 * markers into one RGBA image, with an optional title on top.
 *
 * <h3>Layer order</h3>
 * <p>Layers are drawn bottom to top by {@link LayerKind}: satellite, polygons, radar, points, title. Layers of
 * the same kind keep the order they were given in. Each layer is alpha-composited over the accumulator
 * with the "over" operator; pixels outside a layer's extent are skipped for that layer.</p>
 *
 * <h3>Canvas</h3>
 * <p>The canvas extent is supplied by the caller, independent of any layer. {@link #resolveCanvasExtent}
 * derives the usual one: the boundary polygons in the target projection grown by the canvas buffer, or
 * the radar extent when there are no polygons.</p>
 *
 * <pre>{@code
 * Compositor compositor = new Compositor(bridge, CompositorStyle.defaults());
 * BoundingBox canvas = compositor.resolveCanvasExtent(vectors, radar.getExtent());
 * List<CompositeLayer> layers = compositor.buildLayers(radar, waterVapour, vectors);
 * RasterImage image = compositor.composite(layers, canvas, radar.getGeoTransform().getPixelWidth());
 * }</pre>
 *
 * @since 0.3.0
 */
public class Compositor {
    private static final Logger logger = LoggerFactory.getLogger(Compositor.class);

    private final ProjectionBridge bridge;
    private final CompositorStyle style;

    public Compositor(ProjectionBridge bridge, CompositorStyle style) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.style = Objects.requireNonNull(style, "style");
    }

    public CompositorStyle getStyle() {
        return style;
    }

    /**
     * Composites the layers onto a fresh transparent canvas.
     *
     * @param layers layers in any order; drawn by z-order
     * @param extent canvas extent, tagged with the canvas projection
     * @param resolution canvas pixel size in projection units
     * @return RGBA composite carrying the canvas geotransform
     * @throws EmptyLayerSetException if there is nothing to draw
     * @throws IncompatibleLayerExtentException if a raster layer cannot be placed on the canvas
     * @throws ProjectionUndefinedException if vector geometry cannot be reprojected
     */
    public RasterImage composite(List<CompositeLayer> layers, BoundingBox extent, double resolution)
            throws EmptyLayerSetException, IncompatibleLayerExtentException, ProjectionUndefinedException {
        if (layers == null || layers.isEmpty()) {
            throw new EmptyLayerSetException("No layers to composite");
        }
        List<CompositeLayer> ordered = new ArrayList<>(layers);
        ordered.sort(Comparator.comparingInt(CompositeLayer::getZOrder));

        CompositeCanvas canvas = new CompositeCanvas(extent, resolution);
        logger.info("Compositing {} layers onto {}", ordered.size(), canvas);
        for (CompositeLayer layer : ordered) {
            logger.debug("Drawing layer '{}' ({})", layer.getName(), layer.getKind());
            layer.renderOnto(canvas);
        }
        return canvas.toRaster();
    }

    /**
     * Extent of the boundary polygons in the target projection plus the canvas buffer, or the radar
     * extent when there are no polygons.
     *
     * @throws ProjectionUndefinedException if a polygon vertex cannot be reprojected
     */
    public BoundingBox resolveCanvasExtent(VectorOverlays vectors, BoundingBox radarExtent)
            throws ProjectionUndefinedException {
        String target = radarExtent.getProjectionId();
        if (vectors == null || vectors.getPolygons().isEmpty()) {
            logger.info("No boundary polygons; canvas falls back to the radar extent {}", radarExtent);
            return radarExtent;
        }
        ProjectionBridge.PointTransformer toTarget = bridge.pointTransformer(vectors.getProjectionId(), target);
        List<double[]> vertices = new ArrayList<>();
        for (PolygonFeature polygon : vectors.getPolygons()) {
            for (double[][] ring : polygon.getRings()) {
                for (double[] v : ring) {
                    vertices.add(toTarget.apply(v[0], v[1]));
                }
            }
        }
        BoundingBox extent = BoundingBox.enclosing(vertices.toArray(new double[0][]), target)
                .expand(style.getCanvasBuffer());
        logger.info("Canvas extent from {} boundary polygons: {}", vectors.getPolygons().size(), extent);
        return extent;
    }

    public List<CompositeLayer> buildLayers(RasterImage radar, RasterImage satelliteBand, VectorOverlays vectors) {
        return buildLayers(radar, satelliteBand, vectors, null);
    }

    /**
     * Standard layer set: optional satellite band, boundaries, radar, cities and title.
     *
     * @param radar georeferenced radar raster
     * @param satelliteBand calibrated single-band raster on a target grid, or null for a radar-only composite
     * @param vectors overlays, may be null
     * @param title title text, or null for none
     */
    public List<CompositeLayer> buildLayers(RasterImage radar, RasterImage satelliteBand, VectorOverlays vectors,
                                            String title) {
        List<CompositeLayer> layers = new ArrayList<>();
        if (satelliteBand != null) {
            layers.add(RasterLayer.stretched("water vapour", LayerKind.SATELLITE, satelliteBand,
                    style.getSatelliteOpacity(), style.getLowPercentile(), style.getHighPercentile()));
        }
        if (vectors != null && !vectors.getPolygons().isEmpty()) {
            layers.add(new PolygonLayer("boundaries", vectors.getPolygons(), vectors.getProjectionId(), bridge, style));
        }
        if (radar != null) {
            layers.add(new RasterLayer("radar", LayerKind.RADAR, radar, style.getRadarOpacity()));
        }
        if (vectors != null && !vectors.getPoints().isEmpty()) {
            layers.add(new PointLayer("cities", vectors.getPoints(), vectors.getProjectionId(), bridge, style));
        }
        if (title != null && !title.isBlank()) {
            layers.add(new TitleLayer(title, style));
        }
        return layers;
    }
}
