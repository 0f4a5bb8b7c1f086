package radarsat.composite.errors;

/**
 * Thrown when a frame is cancelled between stages. Any partially built intermediate rasters are dropped.
 */
public class PipelineCancelledException extends PipelineException {

    public PipelineCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
