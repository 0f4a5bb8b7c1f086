package radarsat.composite.errors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PipelineExceptionTest {

    static Stream<Arguments> failures() {
        return Stream.of(
                Arguments.of(new InsufficientControlPointsException("m"), ErrorKind.INSUFFICIENT_CONTROL_POINTS),
                Arguments.of(new IllConditionedFitException("m"), ErrorKind.ILL_CONDITIONED_FIT),
                Arguments.of(new ProjectionUndefinedException("m"), ErrorKind.PROJECTION_UNDEFINED_AT_POINT),
                Arguments.of(new RegionOutsideRasterException("m"), ErrorKind.REGION_OUTSIDE_RASTER),
                Arguments.of(new MissingCalibrationException("m"), ErrorKind.MISSING_CALIBRATION),
                Arguments.of(new EmptyLayerSetException("m"), ErrorKind.EMPTY_LAYER_SET),
                Arguments.of(new IncompatibleLayerExtentException("m"), ErrorKind.INCOMPATIBLE_LAYER_EXTENT),
                Arguments.of(new PipelineCancelledException("m"), ErrorKind.CANCELLED));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("failures")
    @DisplayName("Each failure reports its kind")
    void testKinds(PipelineException e, ErrorKind expected) {
        assertEquals(expected, e.getKind());
        assertEquals("m", e.getMessage());
    }

    @Test
    @DisplayName("Cause is kept")
    void testCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        RegionOutsideRasterException e = new RegionOutsideRasterException("outside", cause);
        assertSame(cause, e.getCause());
        assertEquals(ErrorKind.REGION_OUTSIDE_RASTER, e.getKind());
    }
}
