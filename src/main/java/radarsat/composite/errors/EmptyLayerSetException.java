package radarsat.composite.errors;

/**
 * Thrown when the compositor is asked to draw no layers.
 */
public class EmptyLayerSetException extends PipelineException {

    public EmptyLayerSetException(String message) {
        super(ErrorKind.EMPTY_LAYER_SET, message);
    }

    public EmptyLayerSetException(String message, Throwable cause) {
        super(ErrorKind.EMPTY_LAYER_SET, message, cause);
    }
}
