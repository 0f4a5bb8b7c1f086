package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.config.CleanerSettings;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.Objects;

/**
 * Strips the non-data overlays from a raw radar frame and makes its background transparent.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>blank the header text and logo rectangles to fully transparent</li>
 *   <li>crop the footer band, leaving the data area</li>
 *   <li>replace yellow boundary-line pixels by the average of their non-marker neighbours</li>
 *   <li>make the background colours (black, mid grey) fully transparent</li>
 * </ol>
 *
 * <p>Each step returns a new raster; the input is never modified. Output is always RGBA. Pixels that are
 * neither marker nor background colour pass through the per-pixel steps untouched. {@link #clean} is not
 * idempotent: every call crops another footer band, and an interpolated pixel may itself come out
 * marker-coloured (see {@link #interpolateMarkers}).</p>
 *
 * @since 0.1.0
 */
public class ImageCleaner {

    private static final Logger logger = LoggerFactory.getLogger(ImageCleaner.class);

    private static final int[][] NEIGHBOURS = {
            {-1, -1}, {0, -1}, {1, -1},
            {-1, 0}, {1, 0},
            {-1, 1}, {0, 1}, {1, 1}
    };

    private final CleanerSettings settings;

    public ImageCleaner(CleanerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CleanerSettings getSettings() {
        return settings;
    }

    /**
     * Runs all cleaning steps.
     *
     * @param raw decoded radar frame, RGB or RGBA
     * @return cleaned RGBA data area, {@code footerHeight} rows shorter than the input
     */
    public RasterImage clean(RasterImage raw) {
        Objects.requireNonNull(raw, "raw");
        logger.info("Cleaning radar frame {}x{} ({})", raw.getWidth(), raw.getHeight(), raw.getFormat());

        RasterImage rgba = toRgba(raw);
        RasterImage blanked = blankRegions(rgba);
        RasterImage cropped = cropFooter(blanked);
        RasterImage interpolated = interpolateMarkers(cropped);
        RasterImage result = maskBackground(interpolated);

        logger.info("Cleaned data area {}x{}", result.getWidth(), result.getHeight());
        return result;
    }

    /**
     * Sets every configured blank region to (0, 0, 0, 0). Regions are clipped to the raster.
     */
    public RasterImage blankRegions(RasterImage image) {
        RasterImage rgba = toRgba(image);
        int w = rgba.getWidth();
        int h = rgba.getHeight();
        float[] px = rgba.copyPixels();
        Rectangle bounds = new Rectangle(0, 0, w, h);
        for (Rectangle region : settings.getBlankRegions()) {
            Rectangle clip = region.intersection(bounds);
            if (clip.isEmpty()) {
                logger.debug("Blank region {} lies outside {}x{}", region, w, h);
                continue;
            }
            for (int row = clip.y; row < clip.y + clip.height; row++) {
                int start = (row * w + clip.x) * 4;
                Arrays.fill(px, start, start + clip.width * 4, 0f);
            }
        }
        return RasterImage.adopt(w, h, PixelFormat.RGBA, 4, px, rgba.getGeoTransform(), rgba.getProjectionId());
    }

    /**
     * Removes the bottom footer band.
     *
     * @throws IllegalArgumentException if the frame is not taller than the footer
     */
    public RasterImage cropFooter(RasterImage image) {
        int footer = settings.getFooterHeight();
        if (footer == 0) {
            return image;
        }
        int w = image.getWidth();
        int dataHeight = image.getHeight() - footer;
        if (dataHeight <= 0) {
            throw new IllegalArgumentException("Frame height " + image.getHeight()
                    + " leaves no data area above a " + footer + " px footer");
        }
        int ch = image.getChannels();
        float[] src = image.copyPixels();
        float[] out = new float[w * dataHeight * ch];
        System.arraycopy(src, 0, out, 0, out.length);
        return RasterImage.adopt(w, dataHeight, image.getFormat(), ch, out,
                image.getGeoTransform(), image.getProjectionId());
    }

    /**
     * Replaces each marker-coloured pixel by the rounded channel-wise (RGBA) mean of its in-bounds
     * 8-neighbours that are not marker-coloured. Classification uses the input snapshot, so the result does
     * not depend on visiting order. A marker pixel without any qualifying neighbour becomes transparent.
     * The mean is not re-classified, so a second pass may change a pixel whose mean is marker-coloured.
     */
    public RasterImage interpolateMarkers(RasterImage image) {
        RasterImage rgba = toRgba(image);
        int w = rgba.getWidth();
        int h = rgba.getHeight();
        float[] src = rgba.copyPixels();
        float[] out = src.clone();

        boolean[] marker = new boolean[w * h];
        int markerCount = 0;
        for (int i = 0; i < marker.length; i++) {
            marker[i] = settings.isMarker((int) src[i * 4], (int) src[i * 4 + 1], (int) src[i * 4 + 2]);
            if (marker[i]) {
                markerCount++;
            }
        }
        if (markerCount == 0) {
            return rgba;
        }

        int isolated = 0;
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                int idx = row * w + col;
                if (!marker[idx]) {
                    continue;
                }
                float[] sum = new float[4];
                int n = 0;
                for (int[] d : NEIGHBOURS) {
                    int c = col + d[0];
                    int r = row + d[1];
                    if (c < 0 || r < 0 || c >= w || r >= h) {
                        continue;
                    }
                    int nIdx = r * w + c;
                    if (marker[nIdx]) {
                        continue;
                    }
                    for (int k = 0; k < 4; k++) {
                        sum[k] += src[nIdx * 4 + k];
                    }
                    n++;
                }
                for (int k = 0; k < 4; k++) {
                    out[idx * 4 + k] = n == 0 ? 0f : Math.round(sum[k] / n);
                }
                if (n == 0) {
                    isolated++;
                }
            }
        }
        logger.debug("Interpolated {} marker pixels ({} without usable neighbours)", markerCount, isolated);
        return RasterImage.adopt(w, h, PixelFormat.RGBA, 4, out, rgba.getGeoTransform(), rgba.getProjectionId());
    }

    /**
     * Makes pixels whose RGB equals a background colour fully transparent.
     */
    public RasterImage maskBackground(RasterImage image) {
        RasterImage rgba = toRgba(image);
        float[] px = rgba.copyPixels();
        int masked = 0;
        for (int i = 0, n = rgba.getWidth() * rgba.getHeight(); i < n; i++) {
            int o = i * 4;
            if (settings.isBackground((int) px[o], (int) px[o + 1], (int) px[o + 2])) {
                px[o] = 0f;
                px[o + 1] = 0f;
                px[o + 2] = 0f;
                px[o + 3] = 0f;
                masked++;
            }
        }
        logger.debug("Masked {} background pixels", masked);
        return RasterImage.adopt(rgba.getWidth(), rgba.getHeight(), PixelFormat.RGBA, 4, px,
                rgba.getGeoTransform(), rgba.getProjectionId());
    }

    private static RasterImage toRgba(RasterImage image) {
        if (!image.getFormat().isColor()) {
            throw new IllegalArgumentException("Radar frames must be RGB or RGBA, got " + image.getFormat());
        }
        return image.toRgba();
    }
}
