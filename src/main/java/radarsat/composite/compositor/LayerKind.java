package radarsat.composite.compositor;

/**
 * Layer categories in drawing order, bottom first.
 */
public enum LayerKind {
    SATELLITE(0),
    POLYGONS(1),
    RADAR(2),
    POINTS(3),
    TITLE(4);

    private final int zOrder;

    LayerKind(int zOrder) {
        this.zOrder = zOrder;
    }

    public int getZOrder() {
        return zOrder;
    }
}
