package radarsat.composite.errors;

/**
 * Thrown when a requested subset window does not intersect the raster extent at all.
 */
public class RegionOutsideRasterException extends PipelineException {

    public RegionOutsideRasterException(String message) {
        super(ErrorKind.REGION_OUTSIDE_RASTER, message);
    }

    public RegionOutsideRasterException(String message, Throwable cause) {
        super(ErrorKind.REGION_OUTSIDE_RASTER, message, cause);
    }
}
