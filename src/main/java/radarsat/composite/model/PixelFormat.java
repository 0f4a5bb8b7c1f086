package radarsat.composite.model;

/**
 * Pixel layouts supported by {@link RasterImage}.
 *
 * <p>Colour formats hold 8-bit channel values (0-255) stored as floats so that every stage can
 * work on a single buffer type. {@link #FLOAT} holds one or more continuous-valued bands
 * (raw digital counts or calibrated physical values).</p>
 */
public enum PixelFormat {
    RGB(3),
    RGBA(4),
    FLOAT(0);

    private final int fixedChannels;

    PixelFormat(int fixedChannels) {
        this.fixedChannels = fixedChannels;
    }

    /**
     * @return the channel count implied by the format, or 0 when it varies per image
     */
    public int getFixedChannels() {
        return fixedChannels;
    }

    public boolean isColor() {
        return this != FLOAT;
    }
}
