package radarsat.composite.controller;

import radarsat.composite.errors.ErrorKind;
import radarsat.composite.model.RasterImage;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one frame in a batch run.
 *
 * @param frameName name of the input frame
 * @param status what happened
 * @param composite composited raster, only when succeeded
 * @param outputFile written PNG, when output was requested and succeeded
 * @param errorKind failure kind for pipeline failures, null otherwise
 * @param message failure or cancellation message, null on success
 */
public record FrameResult(String frameName, Status status, RasterImage composite, Path outputFile,
                          ErrorKind errorKind, String message) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public static FrameResult succeeded(String frameName, RasterImage composite, Path outputFile) {
        return new FrameResult(frameName, Status.SUCCEEDED, composite, outputFile, null, null);
    }

    public static FrameResult failed(String frameName, ErrorKind errorKind, String message) {
        return new FrameResult(frameName, Status.FAILED, null, null, errorKind, message);
    }

    public static FrameResult cancelled(String frameName) {
        return new FrameResult(frameName, Status.CANCELLED, null, null, ErrorKind.CANCELLED, "Cancelled");
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public Optional<Path> getOutputFile() {
        return Optional.ofNullable(outputFile);
    }
}
