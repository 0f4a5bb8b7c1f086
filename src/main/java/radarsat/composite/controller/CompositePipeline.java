package radarsat.composite.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.compositor.CompositeLayer;
import radarsat.composite.compositor.Compositor;
import radarsat.composite.config.BandSpec;
import radarsat.composite.config.ControlPointSetManager;
import radarsat.composite.config.PipelineConfigManager;
import radarsat.composite.errors.EmptyLayerSetException;
import radarsat.composite.errors.IllConditionedFitException;
import radarsat.composite.errors.IncompatibleLayerExtentException;
import radarsat.composite.errors.InsufficientControlPointsException;
import radarsat.composite.errors.MissingCalibrationException;
import radarsat.composite.errors.PipelineCancelledException;
import radarsat.composite.errors.PipelineException;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.errors.RegionOutsideRasterException;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.ControlPointSet;
import radarsat.composite.model.RasterImage;
import radarsat.composite.model.SatelliteFrame;
import radarsat.composite.model.VectorOverlays;
import radarsat.composite.projection.ProjectionBridge;
import radarsat.composite.utilities.BandCalibrator;
import radarsat.composite.utilities.BandCalibrator.CalibratedBand;
import radarsat.composite.utilities.FrameTimestamps;
import radarsat.composite.utilities.GCPWarper;
import radarsat.composite.utilities.GCPWarper.WarpResult;
import radarsat.composite.utilities.GeoTransformFunctions;
import radarsat.composite.utilities.ImageCleaner;
import radarsat.composite.utilities.SatelliteSubsetter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one radar frame (and optionally one satellite product) through the whole chain:
 * clean, warp, bridge, subset, calibrate, composite.
 *
 * <p>The stages are built once from a {@link PipelineConfigManager}. The fitted {@link GCPWarper} is
 * immutable and the other stages hold no per-frame state, so one pipeline can serve many frames from
 * several threads. Each stage is also exposed on its own for callers that need only part of the
 * chain.</p>
 *
 * <p>The interrupt flag is checked between stages; an interrupted thread gets a
 * {@link PipelineCancelledException} and no partial output.</p>
 *
 * <pre>{@code
 * PipelineConfigManager config = PipelineConfigManager.loadDefault();
 * RasterImage composite = CompositePipeline.produceComposite(radar, satellite, vectors, config);
 * }</pre>
 *
 * @since 0.4.0
 */
public class CompositePipeline {
    private static final Logger logger = LoggerFactory.getLogger(CompositePipeline.class);

    private final ImageCleaner cleaner;
    private final GCPWarper warper;
    private final ProjectionBridge bridge;
    private final SatelliteSubsetter subsetter;
    private final BandCalibrator calibrator;
    private final Compositor compositor;
    private final List<BandSpec> bands;
    private final int compositeBand;
    private final String targetProjectionId;

    /**
     * Everything a frame produced, for callers that keep intermediate products.
     *
     * @param composite final RGBA image
     * @param radar warped radar frame in the target projection
     * @param calibratedBands calibrated satellite bands on the target grid, empty for radar-only runs
     * @param canvasExtent extent of the composite
     */
    public record CompositeResult(RasterImage composite, WarpResult radar, List<CalibratedBand> calibratedBands,
                                  BoundingBox canvasExtent) {
        public CompositeResult {
            calibratedBands = List.copyOf(calibratedBands);
        }
    }

    /**
     * Builds the stages from configuration, resolving the configured control-point set from the
     * bundled {@code control_points.json}.
     */
    public CompositePipeline(PipelineConfigManager config) throws PipelineException {
        this(config, ControlPointSetManager.fromClasspath());
    }

    /**
     * @throws InsufficientControlPointsException if the configured set is too small for its degree
     * @throws IllConditionedFitException if the configured set is degenerate
     * @throws ProjectionUndefinedException if a geographic set cannot be converted to the target projection
     * @throws IllegalStateException for unusable configuration
     */
    public CompositePipeline(PipelineConfigManager config, ControlPointSetManager controlPoints)
            throws PipelineException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(controlPoints, "controlPoints");
        this.targetProjectionId = config.targetProjectionId();
        this.bridge = new ProjectionBridge(config.projectionRegistry());
        this.cleaner = new ImageCleaner(config.cleanerSettings());
        ControlPointSet set = controlPoints.resolve(config.controlPointSetName(), targetProjectionId, bridge);
        this.warper = new GCPWarper(set);
        this.subsetter = new SatelliteSubsetter(config.subsetMarginMeters());
        this.calibrator = new BandCalibrator(bridge);
        this.compositor = new Compositor(bridge, config.compositorStyle());
        this.bands = config.wvBands();
        this.compositeBand = config.compositeBand();
        logger.info("Pipeline ready: control points {}, target {}, bands {}, composite band {}",
                set, targetProjectionId, bands, compositeBand);
    }

    /**
     * Produces a composite for one frame.
     *
     * @param radarFrame decoded raw radar frame, RGB or RGBA, footer included
     * @param satelliteFrame satellite product, or null for a radar-only composite
     * @param vectors overlays, or null
     * @param config pipeline configuration
     * @return the composited RGBA raster in the target projection
     * @throws PipelineException on the first stage that fails
     */
    public static RasterImage produceComposite(RasterImage radarFrame, SatelliteFrame satelliteFrame,
                                               VectorOverlays vectors, PipelineConfigManager config)
            throws PipelineException {
        return new CompositePipeline(config).produceComposite(radarFrame, satelliteFrame, vectors);
    }

    public RasterImage produceComposite(RasterImage radarFrame, SatelliteFrame satelliteFrame,
                                        VectorOverlays vectors) throws PipelineException {
        return run(radarFrame, satelliteFrame, vectors).composite();
    }

    /**
     * Same as {@link #produceComposite(RasterImage, SatelliteFrame, VectorOverlays)} but keeps the
     * intermediate products.
     */
    public CompositeResult run(RasterImage radarFrame, SatelliteFrame satelliteFrame, VectorOverlays vectors)
            throws PipelineException {
        return run(radarFrame, satelliteFrame, vectors, null);
    }

    /**
     * Runs the chain and titles the composite with the radar observation time.
     *
     * @param timestamp radar observation time, or null for an untitled composite
     */
    public CompositeResult run(RasterImage radarFrame, SatelliteFrame satelliteFrame, VectorOverlays vectors,
                               LocalDateTime timestamp) throws PipelineException {
        Objects.requireNonNull(radarFrame, "radarFrame");
        long start = System.currentTimeMillis();

        checkCancelled("clean");
        RasterImage cleaned = clean(radarFrame);

        checkCancelled("warp");
        WarpResult warped = warp(cleaned);

        List<CalibratedBand> calibrated = List.of();
        RasterImage satelliteLayer = null;
        if (satelliteFrame != null) {
            checkCancelled("bridge");
            BoundingBox nativeFootprint = bridge(warped.extent(), satelliteFrame.getProjectionId());

            checkCancelled("subset");
            RasterImage subset = subset(satelliteFrame.getRaster(), nativeFootprint);

            checkCancelled("calibrate");
            calibrated = calibrate(subset, satelliteFrame);
            satelliteLayer = selectCompositeBand(calibrated);
        } else {
            logger.info("No satellite product; producing a radar-only composite");
        }

        checkCancelled("composite");
        BoundingBox canvasExtent = compositor.resolveCanvasExtent(vectors, warped.extent());
        String title = timestamp == null ? null : FrameTimestamps.title(timestamp);
        List<CompositeLayer> layers = compositor.buildLayers(warped.raster(), satelliteLayer, vectors, title);
        RasterImage composite = composite(layers, canvasExtent,
                warped.raster().getGeoTransform().getPixelWidth());

        logger.info("Composite {}x{} produced in {} ms", composite.getWidth(), composite.getHeight(),
                System.currentTimeMillis() - start);
        return new CompositeResult(composite, warped, calibrated, canvasExtent);
    }

    // ==================== STAGES ====================

    public RasterImage clean(RasterImage radarFrame) {
        return cleaner.clean(radarFrame);
    }

    public WarpResult warp(RasterImage cleaned) {
        WarpResult result = warper.warp(cleaned);
        GeoTransformFunctions.logTransformDetails("Warped radar", result.raster().getGeoTransform());
        return result;
    }

    /**
     * Expresses a target-projection footprint in another projection.
     */
    public BoundingBox bridge(BoundingBox footprint, String projectionId) throws ProjectionUndefinedException {
        BoundingBox converted = bridge.transformBox(footprint, projectionId);
        logger.info("Footprint {} is {} in {}", footprint, converted, projectionId);
        return converted;
    }

    public RasterImage subset(RasterImage satellite, BoundingBox nativeFootprint)
            throws RegionOutsideRasterException {
        return subsetter.subset(satellite, nativeFootprint);
    }

    /**
     * Calibrates the configured bands and reprojects them onto a common target grid.
     */
    public List<CalibratedBand> calibrate(RasterImage subset, SatelliteFrame satelliteFrame)
            throws MissingCalibrationException, ProjectionUndefinedException {
        List<Integer> indices = new ArrayList<>();
        for (BandSpec band : bands) {
            indices.add(band.index());
        }
        if (!indices.contains(compositeBand)) {
            indices.add(compositeBand);
        }
        return calibrator.calibrateBands(subset, satelliteFrame.getCalibration(), indices, null,
                targetProjectionId);
    }

    public RasterImage composite(List<CompositeLayer> layers, BoundingBox extent, double resolution)
            throws EmptyLayerSetException, IncompatibleLayerExtentException, ProjectionUndefinedException {
        return compositor.composite(layers, extent, resolution);
    }

    private RasterImage selectCompositeBand(List<CalibratedBand> calibrated) {
        for (CalibratedBand band : calibrated) {
            if (band.band() == compositeBand) {
                return band.raster();
            }
        }
        throw new IllegalStateException("Composite band " + compositeBand + " was not calibrated");
    }

    private static void checkCancelled(String stage) throws PipelineCancelledException {
        if (Thread.interrupted()) {
            logger.info("Pipeline interrupted before stage '{}'", stage);
            throw new PipelineCancelledException("Cancelled before stage '" + stage + "'");
        }
    }

    // ==================== ACCESSORS ====================

    public GCPWarper getWarper() { return warper; }
    public ProjectionBridge getBridge() { return bridge; }
    public Compositor getCompositor() { return compositor; }
    public List<BandSpec> getBands() { return bands; }
    public String getTargetProjectionId() { return targetProjectionId; }
}
