package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.RegionOutsideRasterException;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.RasterImage;

import java.awt.Rectangle;
import java.util.Locale;

/**
 * Crops a native-projection satellite raster to the radar footprint plus a margin.
 *
 * <p>The window is the smallest pixel-aligned one covering the box, clipped to the raster; the cropped
 * raster keeps every band and carries a geotransform shifted to the window origin. A box that does not
 * overlap the raster at all is a failure, never an empty raster.</p>
 *
 * @since 0.2.0
 */
public class SatelliteSubsetter {

    private static final Logger logger = LoggerFactory.getLogger(SatelliteSubsetter.class);

    public static final double DEFAULT_MARGIN_METERS = 50_000.0;

    private final double margin;

    public SatelliteSubsetter() {
        this(DEFAULT_MARGIN_METERS);
    }

    /**
     * @param margin distance added on every side of the requested box, in native projection units
     */
    public SatelliteSubsetter(double margin) {
        if (!(margin >= 0) || !Double.isFinite(margin)) {
            throw new IllegalArgumentException("Margin must be a finite non-negative value: " + margin);
        }
        this.margin = margin;
    }

    public double getMargin() {
        return margin;
    }

    /**
     * Expands the footprint by the margin and crops.
     *
     * @param raster georeferenced satellite raster
     * @param footprint radar footprint in the raster's projection
     * @throws RegionOutsideRasterException if the expanded footprint misses the raster
     */
    public RasterImage subset(RasterImage raster, BoundingBox footprint) throws RegionOutsideRasterException {
        return crop(raster, footprint.expand(margin));
    }

    /**
     * Crops to the pixel window covering {@code box} exactly, without margin.
     *
     * @throws RegionOutsideRasterException if the box misses the raster
     */
    public RasterImage crop(RasterImage raster, BoundingBox box) throws RegionOutsideRasterException {
        if (!raster.isGeoreferenced()) {
            throw new IllegalArgumentException("Satellite raster has no geotransform");
        }
        if (box.getProjectionId() != null
                && !box.getProjectionId().equalsIgnoreCase(raster.getProjectionId())) {
            throw new IllegalArgumentException("Box is in " + box.getProjectionId()
                    + " but the raster is in " + raster.getProjectionId());
        }
        Rectangle window = GeoTransformFunctions.pixelWindow(box, raster.getGeoTransform(),
                raster.getWidth(), raster.getHeight());
        if (window.isEmpty()) {
            throw new RegionOutsideRasterException(String.format(Locale.ROOT,
                    "%s does not intersect the %dx%d raster covering %s",
                    box, raster.getWidth(), raster.getHeight(), raster.getExtent()));
        }

        int ch = raster.getChannels();
        int srcWidth = raster.getWidth();
        float[] src = raster.copyPixels();
        float[] out = new float[window.width * window.height * ch];
        for (int r = 0; r < window.height; r++) {
            int from = ((window.y + r) * srcWidth + window.x) * ch;
            System.arraycopy(src, from, out, r * window.width * ch, window.width * ch);
        }
        logger.info("Subset {}x{} raster to window {} ({}x{}, {} band(s))", srcWidth, raster.getHeight(),
                String.format(Locale.ROOT, "[%d,%d]", window.x, window.y), window.width, window.height, ch);
        return RasterImage.adopt(window.width, window.height, raster.getFormat(), ch, out,
                raster.getGeoTransform().shifted(window.x, window.y), raster.getProjectionId());
    }
}
