package radarsat.composite.errors;

/**
 * Thrown when a band is requested without calibration coefficients.
 */
public class MissingCalibrationException extends PipelineException {

    public MissingCalibrationException(String message) {
        super(ErrorKind.MISSING_CALIBRATION, message);
    }

    public MissingCalibrationException(String message, Throwable cause) {
        super(ErrorKind.MISSING_CALIBRATION, message, cause);
    }
}
