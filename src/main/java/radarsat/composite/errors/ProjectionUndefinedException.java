package radarsat.composite.errors;

/**
 * Thrown when a coordinate cannot be transformed, e.g. a point the geostationary satellite cannot see.
 */
public class ProjectionUndefinedException extends PipelineException {

    public ProjectionUndefinedException(String message) {
        super(ErrorKind.PROJECTION_UNDEFINED_AT_POINT, message);
    }

    public ProjectionUndefinedException(String message, Throwable cause) {
        super(ErrorKind.PROJECTION_UNDEFINED_AT_POINT, message, cause);
    }
}
