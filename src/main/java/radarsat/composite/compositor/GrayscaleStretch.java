package radarsat.composite.compositor;

import radarsat.composite.model.RasterImage;

import java.util.Arrays;

/**
 * Linear grey mapping of physical values: {@code low} is black, {@code high} white, values outside are clamped.
 *
 * @param low value mapped to 0
 * @param high value mapped to 255
 */
public record GrayscaleStretch(double low, double high) {

    /**
     * Stretch between two percentiles of the finite values of a single-band raster
     * (linear interpolation between order statistics). A raster without finite values gets [0, 1].
     */
    public static GrayscaleStretch fromPercentiles(RasterImage band, double lowPercentile, double highPercentile) {
        if (band.getChannels() != 1) {
            throw new IllegalArgumentException("Percentile stretch needs a single-band raster");
        }
        if (lowPercentile < 0 || highPercentile > 100 || lowPercentile > highPercentile) {
            throw new IllegalArgumentException("Invalid percentiles " + lowPercentile + ".." + highPercentile);
        }
        float[] px = band.copyPixels();
        int n = 0;
        for (float v : px) {
            if (Float.isFinite(v)) {
                px[n++] = v;
            }
        }
        if (n == 0) {
            return new GrayscaleStretch(0, 1);
        }
        float[] valid = Arrays.copyOf(px, n);
        Arrays.sort(valid);
        return new GrayscaleStretch(percentile(valid, lowPercentile), percentile(valid, highPercentile));
    }

    static double percentile(float[] sorted, double p) {
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = Math.min(sorted.length - 1, lo + 1);
        double frac = rank - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    /**
     * @return grey level 0-255, or NaN for NaN input
     */
    public float apply(float value) {
        if (Float.isNaN(value)) {
            return Float.NaN;
        }
        double range = high - low;
        double t = range > 0 ? (value - low) / range : 0.0;
        t = Math.max(0.0, Math.min(1.0, t));
        return (float) (t * 255.0);
    }
}
