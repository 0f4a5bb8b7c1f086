package radarsat.composite.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * In-memory 2D pixel grid with an optional georeference.
 *
 * <p>Pixels are stored row-major and channel-interleaved in a single float buffer of length
 * {@code width * height * channels}. Colour formats keep 8-bit values (0-255); {@link PixelFormat#FLOAT}
 * rasters keep raw counts or calibrated physical values, with {@code NaN} marking no-data.</p>
 *
 * <p>Instances are immutable owned values: the constructor copies the supplied buffer and
 * {@link #copyPixels()} hands out a copy, so a raster handed to the next stage can never be
 * modified behind its back. Stages produce a new RasterImage instead of mutating their input.</p>
 *
 * <p>Bands are addressed 1-based in {@link #extractBand(int)} to match satellite product
 * conventions (band 5 = WV 6.2 um); channels are addressed 0-based in {@link #getSample}.</p>
 *
 * @since 0.1.0
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final PixelFormat format;
    private final int channels;
    private final float[] pixels;
    private final GeoTransform geoTransform;
    private final String projectionId;

    /**
     * Creates a raster, copying the pixel buffer.
     *
     * @param width width in pixels, positive
     * @param height height in pixels, positive
     * @param format pixel layout
     * @param channels channel count; must match the format's fixed count for colour formats
     * @param pixels row-major interleaved buffer of length width*height*channels
     * @param geoTransform pixel to projected mapping, or null for a plain image
     * @param projectionId identifier of the projection the geotransform refers to, or null
     */
    public RasterImage(int width, int height, PixelFormat format, int channels, float[] pixels,
                       GeoTransform geoTransform, String projectionId) {
        this(width, height, format, channels, Objects.requireNonNull(pixels, "pixels").clone(),
                geoTransform, projectionId, true);
    }

    private RasterImage(int width, int height, PixelFormat format, int channels, float[] pixels,
                        GeoTransform geoTransform, String projectionId, boolean validate) {
        if (validate) {
            Objects.requireNonNull(format, "format");
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
            }
            if (format.isColor() && channels != format.getFixedChannels()) {
                throw new IllegalArgumentException(format + " requires " + format.getFixedChannels()
                        + " channels, got " + channels);
            }
            if (channels <= 0) {
                throw new IllegalArgumentException("Channel count must be positive: " + channels);
            }
            long expected = (long) width * height * channels;
            if (pixels.length != expected) {
                throw new IllegalArgumentException("Buffer length " + pixels.length + " != " + expected
                        + " (" + width + "x" + height + "x" + channels + ")");
            }
            if (geoTransform != null && projectionId == null) {
                throw new IllegalArgumentException("A georeferenced raster needs a projection identifier");
            }
        }
        this.width = width;
        this.height = height;
        this.format = format;
        this.channels = channels;
        this.pixels = pixels;
        this.geoTransform = geoTransform;
        this.projectionId = projectionId;
    }

    /**
     * Creates a fully transparent RGBA raster.
     */
    public static RasterImage transparent(int width, int height, GeoTransform geoTransform, String projectionId) {
        return new RasterImage(width, height, PixelFormat.RGBA, 4, new float[width * height * 4],
                geoTransform, projectionId, true);
    }

    /**
     * Wraps a freshly allocated buffer without copying it. The caller must not touch the buffer afterwards;
     * used by stages that build their output buffer themselves.
     */
    public static RasterImage adopt(int width, int height, PixelFormat format, int channels, float[] pixels,
                                    GeoTransform geoTransform, String projectionId) {
        return new RasterImage(width, height, format, channels, Objects.requireNonNull(pixels, "pixels"),
                geoTransform, projectionId, true);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public PixelFormat getFormat() { return format; }
    public int getChannels() { return channels; }
    public GeoTransform getGeoTransform() { return geoTransform; }
    public String getProjectionId() { return projectionId; }

    public boolean isGeoreferenced() {
        return geoTransform != null;
    }

    /**
     * @return a copy of the interleaved pixel buffer
     */
    public float[] copyPixels() {
        return pixels.clone();
    }

    public float getSample(int col, int row, int channel) {
        return pixels[index(col, row) + channel];
    }

    /**
     * Copies all channels of one pixel into {@code dest} starting at {@code offset}.
     */
    public void getPixel(int col, int row, float[] dest, int offset) {
        System.arraycopy(pixels, index(col, row), dest, offset, channels);
    }

    public boolean contains(int col, int row) {
        return col >= 0 && row >= 0 && col < width && row < height;
    }

    private int index(int col, int row) {
        if (!contains(col, row)) {
            throw new IndexOutOfBoundsException("Pixel (" + col + ", " + row + ") outside "
                    + width + "x" + height);
        }
        return (row * width + col) * channels;
    }

    /**
     * Returns a single-band FLOAT raster holding the given 1-based band, keeping the georeference.
     */
    public RasterImage extractBand(int band) {
        if (band < 1 || band > channels) {
            throw new IllegalArgumentException("Band " + band + " outside 1.." + channels);
        }
        float[] out = new float[width * height];
        int c = band - 1;
        for (int i = 0; i < out.length; i++) {
            out[i] = pixels[i * channels + c];
        }
        return new RasterImage(width, height, PixelFormat.FLOAT, 1, out, geoTransform, projectionId, false);
    }

    /**
     * Returns this raster converted to RGBA (opaque alpha for RGB input).
     */
    public RasterImage toRgba() {
        if (format == PixelFormat.RGBA) {
            return this;
        }
        if (format != PixelFormat.RGB) {
            throw new IllegalStateException("Cannot convert " + format + " raster to RGBA");
        }
        float[] out = new float[width * height * 4];
        for (int i = 0, n = width * height; i < n; i++) {
            out[i * 4] = pixels[i * 3];
            out[i * 4 + 1] = pixels[i * 3 + 1];
            out[i * 4 + 2] = pixels[i * 3 + 2];
            out[i * 4 + 3] = 255f;
        }
        return new RasterImage(width, height, PixelFormat.RGBA, 4, out, geoTransform, projectionId, false);
    }

    /**
     * Returns a raster sharing this pixel data with a different georeference.
     */
    public RasterImage withGeoreference(GeoTransform transform, String projection) {
        if (transform != null && projection == null) {
            throw new IllegalArgumentException("A georeferenced raster needs a projection identifier");
        }
        return new RasterImage(width, height, format, channels, pixels, transform, projection, false);
    }

    /**
     * Computes the projected extent covered by this raster from its four corners.
     *
     * @throws IllegalStateException if the raster carries no geotransform
     */
    public BoundingBox getExtent() {
        if (geoTransform == null) {
            throw new IllegalStateException("Raster has no geotransform");
        }
        double[] c = geoTransform.getCoefficients();
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        int[][] corners = {{0, 0}, {width, 0}, {0, height}, {width, height}};
        for (int[] corner : corners) {
            double x = c[0] + corner[0] * c[1] + corner[1] * c[2];
            double y = c[3] + corner[0] * c[4] + corner[1] * c[5];
            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x);
            minY = Math.min(minY, y);
            maxY = Math.max(maxY, y);
        }
        return new BoundingBox(minX, minY, maxX, maxY, projectionId);
    }

    /**
     * Pixel-wise equality of dimensions, format and buffer; georeference is not compared.
     */
    public boolean samePixels(RasterImage other) {
        return other != null && width == other.width && height == other.height
                && format == other.format && channels == other.channels
                && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public String toString() {
        return String.format("RasterImage[%dx%d %s x%d, %s, gt=%s]", width, height, format, channels,
                projectionId == null ? "unprojected" : projectionId, geoTransform);
    }
}
