package radarsat.composite.errors;

/**
 * Failure categories a composite frame can end in.
 * Every kind is terminal for the frame being processed.
 */
public enum ErrorKind {
    INSUFFICIENT_CONTROL_POINTS,
    ILL_CONDITIONED_FIT,
    PROJECTION_UNDEFINED_AT_POINT,
    REGION_OUTSIDE_RASTER,
    MISSING_CALIBRATION,
    EMPTY_LAYER_SET,
    INCOMPATIBLE_LAYER_EXTENT,
    CANCELLED
}
