package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.model.PixelFormat;
import radarsat.composite.model.RasterImage;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Conversion between {@link RasterImage} and {@link BufferedImage}, and image file I/O.
 * Georeferencing is not stored in the files.
 *
 * @since 0.3.0
 */
public class RasterImageIO {
    private static final Logger logger = LoggerFactory.getLogger(RasterImageIO.class);

    private RasterImageIO() {
    }

    /**
     * Reads any image format ImageIO can decode (GIF, PNG, JPEG).
     *
     * @return RGBA if the image has an alpha channel or a palette with transparency, RGB otherwise
     * @throws IOException if the file cannot be read or decoded
     */
    public static RasterImage read(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("No image decoder for " + file);
        }
        logger.debug("Read {} ({}x{})", file, image.getWidth(), image.getHeight());
        return fromBufferedImage(image);
    }

    public static RasterImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        boolean alpha = image.getColorModel().hasAlpha();
        int ch = alpha ? 4 : 3;
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        float[] px = new float[w * h * ch];
        for (int i = 0; i < argb.length; i++) {
            int v = argb[i];
            int o = i * ch;
            px[o] = (v >> 16) & 0xFF;
            px[o + 1] = (v >> 8) & 0xFF;
            px[o + 2] = v & 0xFF;
            if (alpha) {
                px[o + 3] = (v >>> 24) & 0xFF;
            }
        }
        return RasterImage.adopt(w, h, alpha ? PixelFormat.RGBA : PixelFormat.RGB, ch, px, null, null);
    }

    /**
     * Converts a colour raster; values are rounded and clamped to 0-255.
     */
    public static BufferedImage toBufferedImage(RasterImage raster) {
        if (!raster.getFormat().isColor()) {
            throw new IllegalArgumentException("Use toGrayImage for " + raster.getFormat() + " rasters");
        }
        int w = raster.getWidth();
        int h = raster.getHeight();
        boolean alpha = raster.getFormat() == PixelFormat.RGBA;
        BufferedImage image = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        float[] px = raster.copyPixels();
        int ch = raster.getChannels();
        int[] argb = new int[w * h];
        for (int i = 0; i < argb.length; i++) {
            int o = i * ch;
            int a = alpha ? toByte(px[o + 3]) : 255;
            argb[i] = (a << 24) | (toByte(px[o]) << 16) | (toByte(px[o + 1]) << 8) | toByte(px[o + 2]);
        }
        image.setRGB(0, 0, w, h, argb, 0, w);
        return image;
    }

    /**
     * Renders a single-band raster as grey, mapping {@code low} to black and {@code high} to white.
     * NaN pixels are transparent.
     */
    public static BufferedImage toGrayImage(RasterImage band, double low, double high) {
        if (band.getChannels() != 1) {
            throw new IllegalArgumentException("Expected a single-band raster, got " + band.getChannels() + " channels");
        }
        int w = band.getWidth();
        int h = band.getHeight();
        double range = high > low ? high - low : 1.0;
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        float[] px = band.copyPixels();
        int[] argb = new int[w * h];
        for (int i = 0; i < argb.length; i++) {
            if (Float.isNaN(px[i])) {
                continue;
            }
            int g = toByte((float) ((px[i] - low) / range * 255.0));
            argb[i] = 0xFF000000 | (g << 16) | (g << 8) | g;
        }
        image.setRGB(0, 0, w, h, argb, 0, w);
        return image;
    }

    /**
     * Writes a colour raster as PNG, creating parent directories.
     *
     * @throws IOException if writing fails
     */
    public static void writePng(RasterImage raster, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(toBufferedImage(raster), "png", file.toFile())) {
            throw new IOException("No PNG writer available for " + file);
        }
        logger.info("Wrote {} ({}x{})", file, raster.getWidth(), raster.getHeight());
    }

    static int toByte(float v) {
        if (Float.isNaN(v)) {
            return 0;
        }
        return Math.max(0, Math.min(255, Math.round(v)));
    }
}
