package radarsat.composite.compositor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Frame title centred in a translucent band across the top of the canvas. Drawn in pixel space,
 * above every other layer.
 *
 * @since 0.4.0
 */
public class TitleLayer implements CompositeLayer {
    private static final Logger logger = LoggerFactory.getLogger(TitleLayer.class);

    static final Color BAND = new Color(0, 0, 0, 128);

    private final String text;
    private final CompositorStyle style;

    public TitleLayer(String text, CompositorStyle style) {
        this.text = Objects.requireNonNull(text, "text");
        this.style = Objects.requireNonNull(style, "style");
    }

    public String getText() {
        return text;
    }

    @Override
    public String getName() { return "title"; }

    @Override
    public LayerKind getKind() { return LayerKind.TITLE; }

    @Override
    public void renderOnto(CompositeCanvas canvas) {
        BufferedImage overlay = canvas.newOverlay();
        Graphics2D g = CompositeCanvas.createGraphics(overlay);
        try {
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, style.getTitleFontSize()));
            FontMetrics fm = g.getFontMetrics();
            int pad = Math.max(2, style.getTitleFontSize() / 2);
            int bandHeight = Math.min(canvas.getHeight(), fm.getHeight() + 2 * pad);
            g.setColor(BAND);
            g.fillRect(0, 0, canvas.getWidth(), bandHeight);
            g.setColor(style.getTitleColor());
            int x = Math.max(pad, (canvas.getWidth() - fm.stringWidth(text)) / 2);
            g.drawString(text, x, pad + fm.getAscent());
            logger.debug("Title '{}' drawn in a {} px band", text, bandHeight);
        } finally {
            g.dispose();
        }
        canvas.blendOverlay(overlay, 1.0);
    }
}
