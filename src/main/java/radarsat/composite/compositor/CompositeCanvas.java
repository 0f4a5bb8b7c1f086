package radarsat.composite.compositor;

import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * Output accumulator of a composition: a north-up RGBA grid over the requested extent, starting fully
 * transparent. Values are straight (non-premultiplied) 0-255. The buffer is owned by one composition and
 * never shared; {@link #toRaster()} hands out a snapshot.
 *
 * @since 0.3.0
 */
public final class CompositeCanvas {

    private final int width;
    private final int height;
    private final GeoTransform geoTransform;
    private final String projectionId;
    private final float[] buffer;

    /**
     * @param extent area to cover, tagged with the canvas projection
     * @param resolution pixel size in projection units
     */
    public CompositeCanvas(BoundingBox extent, double resolution) {
        if (!(resolution > 0) || !Double.isFinite(resolution)) {
            throw new IllegalArgumentException("Canvas resolution must be positive: " + resolution);
        }
        if (extent.getProjectionId() == null) {
            throw new IllegalArgumentException("Canvas extent needs a projection");
        }
        this.width = Math.max(1, (int) Math.round(extent.getWidth() / resolution));
        this.height = Math.max(1, (int) Math.round(extent.getHeight() / resolution));
        this.geoTransform = GeoTransform.northUp(extent.getMinX(), extent.getMaxY(), resolution, resolution);
        this.projectionId = extent.getProjectionId();
        this.buffer = new float[width * height * 4];
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public GeoTransform getGeoTransform() { return geoTransform; }
    public String getProjectionId() { return projectionId; }

    public BoundingBox getExtent() {
        double res = geoTransform.getPixelWidth();
        return new BoundingBox(geoTransform.getOriginX(), geoTransform.getOriginY() - height * res,
                geoTransform.getOriginX() + width * res, geoTransform.getOriginY(), projectionId);
    }

    /**
     * Projected coordinate of a canvas pixel centre.
     */
    public double[] pixelCenter(int col, int row) {
        double res = geoTransform.getPixelWidth();
        return new double[]{geoTransform.getOriginX() + (col + 0.5) * res, geoTransform.getOriginY() - (row + 0.5) * res};
    }

    /**
     * Projected to canvas pixel transform, for drawing vector geometry with Java2D.
     */
    public AffineTransform projectedToPixel() {
        double res = geoTransform.getPixelWidth();
        AffineTransform t = new AffineTransform();
        t.scale(1.0 / res, -1.0 / res);
        t.translate(-geoTransform.getOriginX(), -geoTransform.getOriginY());
        return t;
    }

    /**
     * "Over" operator: composites a straight-alpha source pixel (0-255 channels) over the accumulator.
     */
    public void blend(int col, int row, float r, float g, float b, float a) {
        if (!(a > 0)) {
            return;
        }
        int o = (row * width + col) * 4;
        float dstA = buffer[o + 3];
        if (a >= 255f || dstA <= 0f) {
            buffer[o] = r;
            buffer[o + 1] = g;
            buffer[o + 2] = b;
            buffer[o + 3] = Math.min(a, 255f);
            return;
        }
        double sa = a / 255.0;
        double da = dstA / 255.0;
        double outA = sa + da * (1 - sa);
        double dw = da * (1 - sa);
        buffer[o] = (float) ((r * sa + buffer[o] * dw) / outA);
        buffer[o + 1] = (float) ((g * sa + buffer[o + 1] * dw) / outA);
        buffer[o + 2] = (float) ((b * sa + buffer[o + 2] * dw) / outA);
        buffer[o + 3] = (float) (outA * 255.0);
    }

    /**
     * Blank ARGB overlay the size of the canvas, with antialiasing enabled on {@link #createGraphics}.
     */
    public BufferedImage newOverlay() {
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    public static Graphics2D createGraphics(BufferedImage overlay) {
        Graphics2D g = overlay.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
        return g;
    }

    /**
     * Composites a rasterized overlay, scaling its alpha by {@code opacity}.
     */
    public void blendOverlay(BufferedImage overlay, double opacity) {
        if (overlay.getWidth() != width || overlay.getHeight() != height) {
            throw new IllegalArgumentException("Overlay size " + overlay.getWidth() + "x" + overlay.getHeight()
                    + " differs from canvas " + width + "x" + height);
        }
        int[] argb = overlay.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < argb.length; i++) {
            int v = argb[i];
            int a = (v >>> 24) & 0xFF;
            if (a == 0) {
                continue;
            }
            blend(i % width, i / width, (v >> 16) & 0xFF, (v >> 8) & 0xFF, v & 0xFF, (float) (a * opacity));
        }
    }

    /**
     * @return an RGBA snapshot carrying the canvas geotransform
     */
    public RasterImage toRaster() {
        return new RasterImage(width, height, PixelFormat.RGBA, 4, buffer, geoTransform, projectionId);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "CompositeCanvas[%dx%d %s %s]", width, height, projectionId, geoTransform);
    }
}
