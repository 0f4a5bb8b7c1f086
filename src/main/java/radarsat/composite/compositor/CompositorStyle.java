package radarsat.composite.compositor;

import java.awt.Color;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Drawing rules of the composite: layer opacities, satellite grey stretch, vector and title styles.
 *
 * @since 0.3.0
 */
public final class CompositorStyle {

    public static final List<String> DEFAULT_LABEL_CITIES = List.of(
            "Girona", "Barcelona", "Terrassa", "Manresa", "Tarragona", "Olot", "Lleida", "Palma", "Perpinyà");

    private final double canvasBuffer;
    private final double satelliteOpacity;
    private final double lowPercentile;
    private final double highPercentile;
    private final double radarOpacity;
    private final Color boundaryColor;
    private final float boundaryWidth;
    private final double boundaryOpacity;
    private final Color markerColor;
    private final Color markerEdgeColor;
    private final float markerSize;
    private final float markerEdgeWidth;
    private final Color labelColor;
    private final int labelFontSize;
    private final double labelOffset;
    private final Set<String> labelCities;
    private final Color titleColor;
    private final int titleFontSize;

    private CompositorStyle(Builder b) {
        checkOpacity(b.satelliteOpacity, "satellite");
        checkOpacity(b.radarOpacity, "radar");
        checkOpacity(b.boundaryOpacity, "boundary");
        if (b.lowPercentile < 0 || b.highPercentile > 100 || b.lowPercentile >= b.highPercentile) {
            throw new IllegalArgumentException("Invalid stretch percentiles " + b.lowPercentile + ".." + b.highPercentile);
        }
        if (b.canvasBuffer < 0) {
            throw new IllegalArgumentException("Canvas buffer must not be negative: " + b.canvasBuffer);
        }
        this.canvasBuffer = b.canvasBuffer;
        this.satelliteOpacity = b.satelliteOpacity;
        this.lowPercentile = b.lowPercentile;
        this.highPercentile = b.highPercentile;
        this.radarOpacity = b.radarOpacity;
        this.boundaryColor = b.boundaryColor;
        this.boundaryWidth = b.boundaryWidth;
        this.boundaryOpacity = b.boundaryOpacity;
        this.markerColor = b.markerColor;
        this.markerEdgeColor = b.markerEdgeColor;
        this.markerSize = b.markerSize;
        this.markerEdgeWidth = b.markerEdgeWidth;
        this.labelColor = b.labelColor;
        this.labelFontSize = b.labelFontSize;
        this.labelOffset = b.labelOffset;
        this.labelCities = Set.copyOf(b.labelCities);
        if (b.titleFontSize < 1) {
            throw new IllegalArgumentException("Title font size must be positive: " + b.titleFontSize);
        }
        this.titleColor = b.titleColor;
        this.titleFontSize = b.titleFontSize;
    }

    private static void checkOpacity(double value, String what) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(what + " opacity must be within [0, 1]: " + value);
        }
    }

    public static CompositorStyle defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getCanvasBuffer() { return canvasBuffer; }
    public double getSatelliteOpacity() { return satelliteOpacity; }
    public double getLowPercentile() { return lowPercentile; }
    public double getHighPercentile() { return highPercentile; }
    public double getRadarOpacity() { return radarOpacity; }
    public Color getBoundaryColor() { return boundaryColor; }
    public float getBoundaryWidth() { return boundaryWidth; }
    public double getBoundaryOpacity() { return boundaryOpacity; }
    public Color getMarkerColor() { return markerColor; }
    public Color getMarkerEdgeColor() { return markerEdgeColor; }
    public float getMarkerSize() { return markerSize; }
    public float getMarkerEdgeWidth() { return markerEdgeWidth; }
    public Color getLabelColor() { return labelColor; }
    public int getLabelFontSize() { return labelFontSize; }
    public double getLabelOffset() { return labelOffset; }
    public Color getTitleColor() { return titleColor; }
    public int getTitleFontSize() { return titleFontSize; }

    public boolean isLabelled(String name) {
        return name != null && labelCities.contains(name);
    }

    public static final class Builder {
        private double canvasBuffer = 30_000.0;
        private double satelliteOpacity = 0.6;
        private double lowPercentile = 5.0;
        private double highPercentile = 95.0;
        private double radarOpacity = 1.0;
        private Color boundaryColor = Color.YELLOW;
        private float boundaryWidth = 1.5f;
        private double boundaryOpacity = 0.8;
        private Color markerColor = Color.WHITE;
        private Color markerEdgeColor = Color.BLACK;
        private float markerSize = 6f;
        private float markerEdgeWidth = 1f;
        private Color labelColor = Color.WHITE;
        private int labelFontSize = 10;
        private double labelOffset = 3_000.0;
        private final Set<String> labelCities = new LinkedHashSet<>(DEFAULT_LABEL_CITIES);
        private Color titleColor = Color.WHITE;
        private int titleFontSize = 14;

        private Builder() {
        }

        public Builder canvasBuffer(double meters) {
            this.canvasBuffer = meters;
            return this;
        }

        public Builder satellite(double opacity, double lowPercentile, double highPercentile) {
            this.satelliteOpacity = opacity;
            this.lowPercentile = lowPercentile;
            this.highPercentile = highPercentile;
            return this;
        }

        public Builder radarOpacity(double opacity) {
            this.radarOpacity = opacity;
            return this;
        }

        public Builder boundary(Color color, float width, double opacity) {
            this.boundaryColor = color;
            this.boundaryWidth = width;
            this.boundaryOpacity = opacity;
            return this;
        }

        public Builder marker(Color color, float size, Color edgeColor, float edgeWidth) {
            this.markerColor = color;
            this.markerSize = size;
            this.markerEdgeColor = edgeColor;
            this.markerEdgeWidth = edgeWidth;
            return this;
        }

        public Builder label(Color color, int fontSize, double offset) {
            this.labelColor = color;
            this.labelFontSize = fontSize;
            this.labelOffset = offset;
            return this;
        }

        public Builder labelCities(List<String> names) {
            this.labelCities.clear();
            this.labelCities.addAll(names);
            return this;
        }

        public Builder title(Color color, int fontSize) {
            this.titleColor = color;
            this.titleFontSize = fontSize;
            return this;
        }

        public CompositorStyle build() {
            return new CompositorStyle(this);
        }
    }
}
