package radarsat.composite.compositor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.IncompatibleLayerExtentException;
import radarsat.composite.model.GeoTransform;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;
import java.util.Objects;

/**
 * A georeferenced raster drawn with nearest-pixel sampling at each canvas pixel centre.
 *
 * <p>Colour rasters keep their colours and alpha, scaled by the layer opacity. Single-band rasters are
 * mapped through a {@link GrayscaleStretch} and drawn with the layer opacity; NaN pixels are transparent.
 * Canvas pixels outside the raster are left untouched.</p>
 *
 * @since 0.3.0
 */
public class RasterLayer implements CompositeLayer {
    private static final Logger logger = LoggerFactory.getLogger(RasterLayer.class);

    private final String name;
    private final LayerKind kind;
    private final RasterImage raster;
    private final double opacity;
    private final GrayscaleStretch stretch;

    /**
     * Colour raster layer.
     */
    public RasterLayer(String name, LayerKind kind, RasterImage raster, double opacity) {
        this(name, kind, raster, opacity, null);
    }

    /**
     * @param stretch grey mapping, required for single-band rasters, ignored for colour rasters
     */
    public RasterLayer(String name, LayerKind kind, RasterImage raster, double opacity, GrayscaleStretch stretch) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.raster = Objects.requireNonNull(raster, "raster");
        if (!(opacity >= 0 && opacity <= 1)) {
            throw new IllegalArgumentException("Opacity must be within [0, 1]: " + opacity);
        }
        if (!raster.getFormat().isColor() && (raster.getChannels() != 1 || stretch == null)) {
            throw new IllegalArgumentException("Single-band layer '" + name + "' needs a grey stretch");
        }
        this.opacity = opacity;
        this.stretch = stretch;
    }

    /**
     * Single-band layer stretched between two percentiles of its own values.
     */
    public static RasterLayer stretched(String name, LayerKind kind, RasterImage band, double opacity,
                                        double lowPercentile, double highPercentile) {
        return new RasterLayer(name, kind, band, opacity,
                GrayscaleStretch.fromPercentiles(band, lowPercentile, highPercentile));
    }

    @Override
    public String getName() { return name; }

    @Override
    public LayerKind getKind() { return kind; }

    public RasterImage getRaster() { return raster; }
    public double getOpacity() { return opacity; }
    public GrayscaleStretch getStretch() { return stretch; }

    @Override
    public void renderOnto(CompositeCanvas canvas) throws IncompatibleLayerExtentException {
        if (!raster.isGeoreferenced()) {
            throw new IncompatibleLayerExtentException("Layer '" + name + "' has no geotransform");
        }
        if (!raster.getProjectionId().equalsIgnoreCase(canvas.getProjectionId())) {
            throw new IncompatibleLayerExtentException("Layer '" + name + "' is in " + raster.getProjectionId()
                    + " but the canvas is in " + canvas.getProjectionId());
        }
        if (!raster.getExtent().intersects(canvas.getExtent())) {
            logger.warn("Layer '{}' lies outside the canvas {}; nothing drawn", name, canvas.getExtent());
            return;
        }

        boolean sameGrid = raster.getGeoTransform().equals(canvas.getGeoTransform())
                && raster.getWidth() == canvas.getWidth() && raster.getHeight() == canvas.getHeight();
        AffineTransform toLayer = sameGrid ? null : inverse(raster.getGeoTransform());
        float[] px = new float[raster.getChannels()];
        Point2D.Double src = new Point2D.Double();
        Point2D.Double dst = new Point2D.Double();
        int drawn = 0;

        for (int row = 0; row < canvas.getHeight(); row++) {
            for (int col = 0; col < canvas.getWidth(); col++) {
                int lc = col;
                int lr = row;
                if (!sameGrid) {
                    double[] xy = canvas.pixelCenter(col, row);
                    src.setLocation(xy[0], xy[1]);
                    toLayer.transform(src, dst);
                    lc = (int) Math.floor(dst.x);
                    lr = (int) Math.floor(dst.y);
                    if (!raster.contains(lc, lr)) {
                        continue;
                    }
                }
                raster.getPixel(lc, lr, px, 0);
                if (draw(canvas, col, row, px)) {
                    drawn++;
                }
            }
        }
        logger.debug("Layer '{}' contributed {} pixels", name, drawn);
    }

    private boolean draw(CompositeCanvas canvas, int col, int row, float[] px) {
        if (raster.getFormat() == PixelFormat.FLOAT) {
            float grey = stretch.apply(px[0]);
            if (Float.isNaN(grey)) {
                return false;
            }
            canvas.blend(col, row, grey, grey, grey, (float) (255.0 * opacity));
            return true;
        }
        float alpha = raster.getFormat() == PixelFormat.RGBA ? px[3] : 255f;
        if (opacity < 1.0) {
            alpha = (float) (alpha * opacity);
        }
        if (!(alpha > 0)) {
            return false;
        }
        canvas.blend(col, row, px[0], px[1], px[2], alpha);
        return true;
    }

    private static AffineTransform inverse(GeoTransform gt) throws IncompatibleLayerExtentException {
        try {
            return gt.toAffineTransform().createInverse();
        } catch (NoninvertibleTransformException e) {
            throw new IncompatibleLayerExtentException("Layer geotransform cannot be inverted: " + gt, e);
        }
    }
}
