package radarsat.composite.compositor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.PolygonFeature;
import radarsat.composite.projection.ProjectionBridge;

import java.awt.BasicStroke;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Boundary outlines (no fill), reprojected into the canvas projection and stroked at draw time.
 *
 * @since 0.3.0
 */
public class PolygonLayer implements CompositeLayer {
    private static final Logger logger = LoggerFactory.getLogger(PolygonLayer.class);

    private final String name;
    private final List<PolygonFeature> polygons;
    private final String projectionId;
    private final ProjectionBridge bridge;
    private final CompositorStyle style;

    /**
     * @param polygons boundaries, vertices in {@code projectionId}
     */
    public PolygonLayer(String name, List<PolygonFeature> polygons, String projectionId,
                        ProjectionBridge bridge, CompositorStyle style) {
        this.name = Objects.requireNonNull(name, "name");
        this.polygons = List.copyOf(polygons);
        this.projectionId = Objects.requireNonNull(projectionId, "projectionId");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.style = Objects.requireNonNull(style, "style");
    }

    @Override
    public String getName() { return name; }

    @Override
    public LayerKind getKind() { return LayerKind.POLYGONS; }

    @Override
    public void renderOnto(CompositeCanvas canvas) throws ProjectionUndefinedException {
        ProjectionBridge.PointTransformer toCanvas = bridge.pointTransformer(projectionId, canvas.getProjectionId());
        AffineTransform toPixel = canvas.projectedToPixel();

        BufferedImage overlay = canvas.newOverlay();
        Graphics2D g = CompositeCanvas.createGraphics(overlay);
        try {
            g.setColor(style.getBoundaryColor());
            g.setStroke(new BasicStroke(style.getBoundaryWidth(), BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
            int rings = 0;
            for (PolygonFeature polygon : polygons) {
                for (double[][] ring : polygon.getRings()) {
                    Path2D.Double path = new Path2D.Double();
                    for (int i = 0; i < ring.length; i++) {
                        double[] xy = toCanvas.apply(ring[i][0], ring[i][1]);
                        if (i == 0) {
                            path.moveTo(xy[0], xy[1]);
                        } else {
                            path.lineTo(xy[0], xy[1]);
                        }
                    }
                    path.closePath();
                    g.draw(path.createTransformedShape(toPixel));
                    rings++;
                }
            }
            logger.debug("Layer '{}': stroked {} rings of {} polygons", name, rings, polygons.size());
        } finally {
            g.dispose();
        }
        canvas.blendOverlay(overlay, style.getBoundaryOpacity());
    }
}
