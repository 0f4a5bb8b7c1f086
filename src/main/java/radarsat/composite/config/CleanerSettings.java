package radarsat.composite.config;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fixed-geometry overlay layout and colour rules of the raw radar frames.
 *
 * <p>The provider's frames always carry the same footer band, header text block and logo, so their
 * rectangles are configuration rather than something detected per frame. Marker (boundary line) pixels
 * are classified by channel thresholds; background pixels by exact colour match.</p>
 *
 * @since 0.1.0
 */
public final class CleanerSettings {

    private final int footerHeight;
    private final List<Rectangle> blankRegions;
    private final List<int[]> backgroundColors;
    private final int markerRedMin;
    private final int markerGreenMin;
    private final int markerBlueMax;
    private final int markerRedGreenMaxDiff;

    private CleanerSettings(Builder builder) {
        if (builder.footerHeight < 0) {
            throw new IllegalArgumentException("Footer height must not be negative: " + builder.footerHeight);
        }
        this.footerHeight = builder.footerHeight;
        List<Rectangle> regions = new ArrayList<>();
        for (Rectangle r : builder.blankRegions) {
            if (r.width <= 0 || r.height <= 0) {
                throw new IllegalArgumentException("Blank region must have a positive size: " + r);
            }
            regions.add(new Rectangle(r));
        }
        this.blankRegions = List.copyOf(regions);
        List<int[]> colors = new ArrayList<>();
        for (int[] c : builder.backgroundColors) {
            if (c.length != 3) {
                throw new IllegalArgumentException("Background colours are RGB triples");
            }
            colors.add(c.clone());
        }
        this.backgroundColors = List.copyOf(colors);
        this.markerRedMin = builder.markerRedMin;
        this.markerGreenMin = builder.markerGreenMin;
        this.markerBlueMax = builder.markerBlueMax;
        this.markerRedGreenMaxDiff = builder.markerRedGreenMaxDiff;
    }

    /**
     * Layout of the provider's 480x480 composite frames.
     */
    public static CleanerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getFooterHeight() { return footerHeight; }

    /**
     * @return copies of the rectangles blanked before cropping
     */
    public List<Rectangle> getBlankRegions() {
        List<Rectangle> copy = new ArrayList<>();
        blankRegions.forEach(r -> copy.add(new Rectangle(r)));
        return copy;
    }

    public boolean isBackground(int r, int g, int b) {
        for (int[] c : backgroundColors) {
            if (c[0] == r && c[1] == g && c[2] == b) {
                return true;
            }
        }
        return false;
    }

    /**
     * Yellow boundary-line colour test.
     */
    public boolean isMarker(int r, int g, int b) {
        return r > markerRedMin && g > markerGreenMin && b < markerBlueMax
                && Math.abs(r - g) < markerRedGreenMaxDiff;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "CleanerSettings[footer=%d, regions=%d, backgrounds=%d, marker r>%d g>%d b<%d |r-g|<%d]",
                footerHeight, blankRegions.size(), backgroundColors.size(),
                markerRedMin, markerGreenMin, markerBlueMax, markerRedGreenMaxDiff);
    }

    public static final class Builder {
        private int footerHeight = 50;
        private final List<Rectangle> blankRegions = new ArrayList<>(List.of(
                new Rectangle(0, 0, 200, 22),
                new Rectangle(400, 0, 80, 40)));
        private final List<int[]> backgroundColors = new ArrayList<>(List.of(
                new int[]{0, 0, 0},
                new int[]{127, 127, 127}));
        private int markerRedMin = 200;
        private int markerGreenMin = 200;
        private int markerBlueMax = 100;
        private int markerRedGreenMaxDiff = 60;

        private Builder() {
        }

        public Builder footerHeight(int footerHeight) {
            this.footerHeight = footerHeight;
            return this;
        }

        /**
         * Replaces the blank regions (header text, logo).
         */
        public Builder blankRegions(List<Rectangle> regions) {
            this.blankRegions.clear();
            this.blankRegions.addAll(regions);
            return this;
        }

        public Builder backgroundColors(List<int[]> colors) {
            this.backgroundColors.clear();
            this.backgroundColors.addAll(colors);
            return this;
        }

        public Builder markerThresholds(int redMin, int greenMin, int blueMax, int redGreenMaxDiff) {
            this.markerRedMin = redMin;
            this.markerGreenMin = greenMin;
            this.markerBlueMax = blueMax;
            this.markerRedGreenMaxDiff = redGreenMaxDiff;
            return this;
        }

        public CleanerSettings build() {
            return new CleanerSettings(this);
        }
    }
}
