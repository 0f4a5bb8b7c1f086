package radarsat.composite.model;

/**
 * A measured correspondence between a radar image pixel and a projected coordinate.
 *
 * @param pixelX image column, corner-based (0 = left edge of the first column)
 * @param pixelY image row, corner-based (0 = top edge of the first row)
 * @param projX projected X in the control-point set's projection
 * @param projY projected Y in the control-point set's projection
 */
public record ControlPoint(double pixelX, double pixelY, double projX, double projY) {

    public ControlPoint {
        if (!Double.isFinite(pixelX) || !Double.isFinite(pixelY)
                || !Double.isFinite(projX) || !Double.isFinite(projY)) {
            throw new IllegalArgumentException("Control point coordinates must be finite");
        }
    }
}
