package radarsat.composite.errors;

/**
 * Thrown when a raster layer cannot be placed on the composite canvas.
 */
public class IncompatibleLayerExtentException extends PipelineException {

    public IncompatibleLayerExtentException(String message) {
        super(ErrorKind.INCOMPATIBLE_LAYER_EXTENT, message);
    }

    public IncompatibleLayerExtentException(String message, Throwable cause) {
        super(ErrorKind.INCOMPATIBLE_LAYER_EXTENT, message, cause);
    }
}
