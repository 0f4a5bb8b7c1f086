package radarsat.composite.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.config.PipelineConfigManager;
import radarsat.composite.errors.PipelineCancelledException;
import radarsat.composite.errors.PipelineException;
import radarsat.composite.model.RasterImage;
import radarsat.composite.model.SatelliteFrame;
import radarsat.composite.model.VectorOverlays;
import radarsat.composite.utilities.FrameTimestamps;
import radarsat.composite.utilities.RasterImageIO;
import radarsat.composite.utilities.RunLogger;
import radarsat.composite.utilities.SatelliteProductMatcher;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces composites for many frames on a fixed worker pool.
 *
 * <p>Each frame runs through its own {@link CompositePipeline#run} call on the shared pipeline and is
 * titled with its radar timestamp. A frame without its own satellite product is paired with the closest
 * candidate product by sensing time, within the matcher's tolerance; with no match it is composited
 * radar-only. A failing frame is logged, recorded in its {@link FrameResult} and the run moves on to
 * the next one.</p>
 *
 * <p>Every {@link #start} returns a {@link BatchRun} that owns its workers and cancellation state, so
 * runs sharing a runner do not affect each other. Cancelling a run drops frames not yet started and
 * stops running frames at their next stage boundary.</p>
 *
 * <p>When an output directory is set every composite is written there as
 * {@code enhanced_weather_YYYYMMDD_HHMMSS.png} (or {@code <frame name>.png} for frames without a
 * timestamp), and frames with a satellite product also get their band metadata as
 * {@code <output base>_water_vapor_metadata.json}. When a log directory is set the run is mirrored to
 * {@code composite.log} there.</p>
 *
 * @since 0.4.0
 */
public class BatchCompositeRunner {
    private static final Logger logger = LoggerFactory.getLogger(BatchCompositeRunner.class);

    private final CompositePipeline pipeline;
    private final int threads;
    private final Path outputDirectory;
    private final Path logDirectory;
    private final SatelliteProductMatcher matcher;
    private final BandMetadataWriter metadataWriter;

    private final Set<BatchRun> active = ConcurrentHashMap.newKeySet();

    /**
     * One frame to process.
     *
     * @param name frame name used in logs and results
     * @param timestamp radar observation time, may be null
     * @param radar raw radar frame
     * @param satellite satellite product for this frame, or null to match one from the run's candidates
     */
    public record Frame(String name, LocalDateTime timestamp, RasterImage radar, SatelliteFrame satellite) {
        public Frame {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(radar, "radar");
        }

        /**
         * Reads a radar image file; the timestamp comes from the {@code radar_ba_YYYYMMDD_HHMMSS} name.
         */
        public static Frame load(Path radarFile, SatelliteFrame satellite) throws IOException {
            RasterImage radar = RasterImageIO.read(radarFile);
            String name = radarFile.getFileName().toString();
            return new Frame(name, FrameTimestamps.parseRadarFileName(name).orElse(null), radar, satellite);
        }
    }

    /**
     * @param pipeline shared pipeline
     * @param threads worker count per run, at least 1
     * @param outputDirectory where PNGs and band metadata are written, or null to keep composites in memory only
     * @param logDirectory where the run log is written, or null for no run log
     * @param matcher pairs frames with candidate satellite products
     */
    public BatchCompositeRunner(CompositePipeline pipeline, int threads, Path outputDirectory, Path logDirectory,
                                SatelliteProductMatcher matcher) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threads);
        }
        this.threads = threads;
        this.outputDirectory = outputDirectory;
        this.logDirectory = logDirectory;
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.metadataWriter = new BandMetadataWriter();
    }

    public BatchCompositeRunner(CompositePipeline pipeline, int threads, Path outputDirectory, Path logDirectory) {
        this(pipeline, threads, outputDirectory, logDirectory, new SatelliteProductMatcher());
    }

    public BatchCompositeRunner(CompositePipeline pipeline, int threads) {
        this(pipeline, threads, null, null);
    }

    /**
     * Runner with the configured worker count and satellite time tolerance.
     */
    public static BatchCompositeRunner fromConfig(PipelineConfigManager config, CompositePipeline pipeline,
                                                  Path outputDirectory, Path logDirectory) {
        return new BatchCompositeRunner(pipeline, config.batchThreads(), outputDirectory, logDirectory,
                new SatelliteProductMatcher(config.satelliteTimeTolerance()));
    }

    /**
     * Processes all frames and waits for them.
     *
     * @param frames frames in output order
     * @param vectors overlays shared by every frame, may be null
     * @return one result per frame, in input order
     * @throws IOException if the run log cannot be opened
     */
    public List<FrameResult> run(List<Frame> frames, VectorOverlays vectors) throws IOException {
        return run(frames, List.of(), vectors);
    }

    /**
     * Processes all frames, pairing frames without a product with the closest of {@code products}, and
     * waits for them.
     *
     * @throws IOException if the run log cannot be opened
     */
    public List<FrameResult> run(List<Frame> frames, List<SatelliteFrame> products, VectorOverlays vectors)
            throws IOException {
        return start(frames, products, vectors).await();
    }

    /**
     * Submits all frames and returns at once.
     *
     * @param frames frames in output order
     * @param products candidate satellite products, may be empty
     * @param vectors overlays shared by every frame, may be null
     * @return the handle of the new run
     * @throws IOException if the run log cannot be opened
     */
    public BatchRun start(List<Frame> frames, List<SatelliteFrame> products, VectorOverlays vectors)
            throws IOException {
        RunLogger.Session session = logDirectory == null ? null : RunLogger.start(logDirectory);
        BatchRun run = new BatchRun(frames, session);
        active.add(run);
        logger.info("Batch of {} frames on {} threads, {} candidate products", frames.size(), threads,
                products == null ? 0 : products.size());
        List<SatelliteFrame> candidates = products == null ? List.of() : List.copyOf(products);
        for (Frame frame : frames) {
            run.submit(() -> process(run, frame, candidates, vectors));
        }
        return run;
    }

    private FrameResult process(BatchRun run, Frame frame, List<SatelliteFrame> products, VectorOverlays vectors) {
        if (run.isCancelled()) {
            return FrameResult.cancelled(frame.name());
        }
        logger.info("Processing frame {}", frame.name());
        try {
            SatelliteFrame satellite = frame.satellite() != null ? frame.satellite() : matchProduct(frame, products);
            CompositePipeline.CompositeResult result =
                    pipeline.run(frame.radar(), satellite, vectors, frame.timestamp());
            Path output = null;
            if (outputDirectory != null) {
                output = outputDirectory.resolve(outputName(frame));
                RasterImageIO.writePng(result.composite(), output);
                logger.info("Wrote {}", output);
                if (satellite != null && !result.calibratedBands().isEmpty()) {
                    metadataWriter.writeFile(outputDirectory.resolve(metadataName(frame)),
                            satellite.getName(), satellite.getSensingTime(), result.calibratedBands(),
                            pipeline.getBands());
                }
            }
            return FrameResult.succeeded(frame.name(), result.composite(), output);
        } catch (PipelineCancelledException e) {
            logger.info("Frame {} cancelled: {}", frame.name(), e.getMessage());
            return FrameResult.cancelled(frame.name());
        } catch (PipelineException e) {
            logger.error("Frame {} failed ({}): {}", frame.name(), e.getKind(), e.getMessage());
            return FrameResult.failed(frame.name(), e.getKind(), e.getMessage());
        } catch (IOException e) {
            logger.error("Frame {} could not be written: {}", frame.name(), e.getMessage());
            return FrameResult.failed(frame.name(), null, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Frame {} failed", frame.name(), e);
            return FrameResult.failed(frame.name(), null, e.toString());
        }
    }

    private SatelliteFrame matchProduct(Frame frame, List<SatelliteFrame> products) {
        if (products.isEmpty()) {
            return null;
        }
        if (frame.timestamp() == null) {
            logger.warn("Frame {} has no timestamp; no satellite product can be matched", frame.name());
            return null;
        }
        SatelliteFrame match = matcher.match(FrameTimestamps.toInstant(frame.timestamp()), products,
                SatelliteFrame::getSensingTime).orElse(null);
        if (match != null) {
            logger.info("Frame {} paired with {}", frame.name(), match);
        }
        return match;
    }

    static String outputName(Frame frame) {
        if (frame.timestamp() != null) {
            return FrameTimestamps.outputFileName(frame.timestamp());
        }
        String name = frame.name();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + ".png";
    }

    static String metadataName(Frame frame) {
        String png = outputName(frame);
        return png.substring(0, png.length() - ".png".length()) + "_" + BandMetadataWriter.FILE_NAME;
    }

    /**
     * Cancels every run in progress on this runner. Runs started afterwards are not affected.
     */
    public void cancel() {
        if (active.isEmpty()) {
            logger.info("Cancellation requested with no batch running");
        }
        for (BatchRun run : active) {
            run.cancel();
        }
    }

    /**
     * One submitted batch: its workers, futures and cancellation state.
     */
    public final class BatchRun {
        private final List<Frame> frames;
        private final RunLogger.Session session;
        private final ExecutorService executor;
        private final List<Future<FrameResult>> futures = new ArrayList<>();
        private volatile boolean cancelled;

        private BatchRun(List<Frame> frames, RunLogger.Session session) {
            this.frames = List.copyOf(frames);
            this.session = session;
            AtomicInteger counter = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(threads, r -> {
                Thread t = new Thread(r, "composite-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        private synchronized void submit(Callable<FrameResult> task) {
            Future<FrameResult> future = executor.submit(task);
            if (cancelled) {
                future.cancel(true);
            }
            futures.add(future);
        }

        /**
         * Frames not yet started are reported as cancelled; running frames stop at their next stage boundary.
         */
        public void cancel() {
            cancelled = true;
            synchronized (this) {
                for (Future<FrameResult> future : futures) {
                    future.cancel(true);
                }
            }
            logger.info("Batch cancellation requested");
        }

        public boolean isCancelled() {
            return cancelled;
        }

        /**
         * Waits for every frame, then releases the workers and the run log.
         *
         * @return one result per frame, in input order
         */
        public List<FrameResult> await() {
            try {
                return collect();
            } finally {
                executor.shutdownNow();
                active.remove(this);
                if (session != null) {
                    session.close();
                }
            }
        }

        private List<FrameResult> collect() {
            List<Future<FrameResult>> submitted;
            synchronized (this) {
                submitted = new ArrayList<>(futures);
            }
            List<FrameResult> results = new ArrayList<>();
            int succeeded = 0;
            for (int i = 0; i < submitted.size(); i++) {
                String name = frames.get(i).name();
                FrameResult result;
                try {
                    result = submitted.get(i).get();
                } catch (CancellationException e) {
                    result = FrameResult.cancelled(name);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while waiting for frame {}; cancelling the batch", name);
                    cancel();
                    result = FrameResult.cancelled(name);
                } catch (ExecutionException e) {
                    logger.error("Frame {} failed unexpectedly", name, e.getCause());
                    result = FrameResult.failed(name, null, String.valueOf(e.getCause()));
                }
                if (result.isSuccess()) {
                    succeeded++;
                }
                results.add(result);
            }
            logger.info("Batch finished: {} of {} frames succeeded", succeeded, frames.size());
            return results;
        }
    }
}
