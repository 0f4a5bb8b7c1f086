package radarsat.composite.errors;

/**
 * Thrown when a control-point set has fewer points than the polynomial degree requires.
 */
public class InsufficientControlPointsException extends PipelineException {

    public InsufficientControlPointsException(String message) {
        super(ErrorKind.INSUFFICIENT_CONTROL_POINTS, message);
    }

    public InsufficientControlPointsException(String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_CONTROL_POINTS, message, cause);
    }
}
