package radarsat.composite.errors;

/**
 * Base class for failures raised by the composite pipeline stages.
 * Distinguishes data/configuration problems for a single frame from programming errors,
 * which are reported as unchecked exceptions instead.
 *
 * @since 0.1.0
 */
public class PipelineException extends Exception {

    private final ErrorKind kind;

    /**
     * Constructs a new pipeline exception.
     *
     * @param kind the failure category
     * @param message the detail message
     */
    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new pipeline exception with a cause.
     *
     * @param kind the failure category
     * @param message the detail message
     * @param cause the cause
     */
    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
