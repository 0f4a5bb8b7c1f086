package radarsat.composite.compositor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.PointFeature;
import radarsat.composite.projection.ProjectionBridge;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * City markers and labels. Every point inside the canvas extent gets a marker; only names in the
 * style's label list get a text label, placed north-east of the marker by the label offset.
 *
 * @since 0.3.0
 */
public class PointLayer implements CompositeLayer {
    private static final Logger logger = LoggerFactory.getLogger(PointLayer.class);

    private static final Color LABEL_BOX = new Color(0, 0, 0, 51);

    private final String name;
    private final List<PointFeature> points;
    private final String projectionId;
    private final ProjectionBridge bridge;
    private final CompositorStyle style;

    public PointLayer(String name, List<PointFeature> points, String projectionId,
                      ProjectionBridge bridge, CompositorStyle style) {
        this.name = Objects.requireNonNull(name, "name");
        this.points = List.copyOf(points);
        this.projectionId = Objects.requireNonNull(projectionId, "projectionId");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.style = Objects.requireNonNull(style, "style");
    }

    @Override
    public String getName() { return name; }

    @Override
    public LayerKind getKind() { return LayerKind.POINTS; }

    @Override
    public void renderOnto(CompositeCanvas canvas) throws ProjectionUndefinedException {
        ProjectionBridge.PointTransformer toCanvas = bridge.pointTransformer(projectionId, canvas.getProjectionId());
        AffineTransform toPixel = canvas.projectedToPixel();
        BoundingBox extent = canvas.getExtent();

        BufferedImage overlay = canvas.newOverlay();
        Graphics2D g = CompositeCanvas.createGraphics(overlay);
        int markers = 0;
        int labels = 0;
        try {
            float size = style.getMarkerSize();
            for (PointFeature point : points) {
                double[] xy = toCanvas.apply(point.x(), point.y());
                if (!extent.contains(xy[0], xy[1])) {
                    logger.debug("Point '{}' outside the canvas, skipped", point.name());
                    continue;
                }
                Point2D p = toPixel.transform(new Point2D.Double(xy[0], xy[1]), null);
                Ellipse2D marker = new Ellipse2D.Double(p.getX() - size / 2.0, p.getY() - size / 2.0, size, size);
                g.setColor(style.getMarkerColor());
                g.fill(marker);
                g.setColor(style.getMarkerEdgeColor());
                g.setStroke(new BasicStroke(style.getMarkerEdgeWidth()));
                g.draw(marker);
                markers++;

                if (style.isLabelled(point.name())) {
                    Point2D anchor = toPixel.transform(new Point2D.Double(
                            xy[0] + style.getLabelOffset(), xy[1] + style.getLabelOffset()), null);
                    drawLabel(g, point.name(), anchor);
                    labels++;
                }
            }
        } finally {
            g.dispose();
        }
        logger.debug("Layer '{}': {} markers, {} labels", name, markers, labels);
        canvas.blendOverlay(overlay, 1.0);
    }

    private void drawLabel(Graphics2D g, String text, Point2D anchor) {
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, style.getLabelFontSize()));
        FontMetrics fm = g.getFontMetrics();
        int x = (int) Math.round(anchor.getX());
        int y = (int) Math.round(anchor.getY());
        int pad = Math.max(1, style.getLabelFontSize() * 3 / 10);
        g.setColor(LABEL_BOX);
        g.fillRoundRect(x - pad, y - fm.getAscent() - pad, fm.stringWidth(text) + 2 * pad,
                fm.getAscent() + fm.getDescent() + 2 * pad, pad * 2, pad * 2);
        g.setColor(style.getLabelColor());
        g.drawString(text, x, y - fm.getDescent());
    }
}
