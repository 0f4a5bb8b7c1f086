package radarsat.composite.errors;

/**
 * Thrown when the least-squares normal equations are singular to working precision (collinear or coincident control points).
 */
public class IllConditionedFitException extends PipelineException {

    public IllConditionedFitException(String message) {
        super(ErrorKind.ILL_CONDITIONED_FIT, message);
    }

    public IllConditionedFitException(String message, Throwable cause) {
        super(ErrorKind.ILL_CONDITIONED_FIT, message, cause);
    }
}
