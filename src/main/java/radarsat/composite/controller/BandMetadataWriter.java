package radarsat.composite.controller;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.config.BandSpec;
import radarsat.composite.model.BoundingBox;
import radarsat.composite.model.RasterImage;
import radarsat.composite.utilities.BandCalibrator.CalibratedBand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@code water_vapor_metadata.json} next to the calibrated satellite bands.
 *
 * <p>The file records where the bands came from, when they were observed and processed, and for each
 * band its name, description, units, product band index, calibration and extent.</p>
 */
public class BandMetadataWriter {
    private static final Logger logger = LoggerFactory.getLogger(BandMetadataWriter.class);

    public static final String FILE_NAME = "water_vapor_metadata.json";
    public static final String UNITS = "Brightness temperature (K)";

    private final String satellite;
    private final String instrument;
    private final Clock clock;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public BandMetadataWriter() {
        this("MSG3", "SEVIRI", Clock.systemUTC());
    }

    public BandMetadataWriter(String satellite, String instrument, Clock clock) {
        this.satellite = satellite;
        this.instrument = instrument;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds the metadata document.
     *
     * @param sourceName name of the satellite product
     * @param observationTime sensing time, may be null
     * @param bands calibrated bands, in output order
     * @param specs band descriptions; bands without a matching spec are named {@code band_N}
     */
    public JsonObject toJson(String sourceName, Instant observationTime, List<CalibratedBand> bands,
                             List<BandSpec> specs) {
        JsonObject root = new JsonObject();
        root.addProperty("source_file", sourceName);
        root.addProperty("processing_time", Instant.now(clock).toString());
        root.addProperty("observation_time", observationTime == null ? null : observationTime.toString());
        root.addProperty("satellite", satellite);
        root.addProperty("instrument", instrument);
        root.addProperty("projection", bands.isEmpty() ? null : bands.get(0).raster().getProjectionId());

        JsonObject bandsJson = new JsonObject();
        for (CalibratedBand band : bands) {
            BandSpec spec = findSpec(specs, band.band());
            JsonObject entry = new JsonObject();
            entry.addProperty("band", band.band());
            entry.addProperty("description", spec == null ? "" : spec.description());
            entry.addProperty("units", UNITS);
            JsonObject calibration = new JsonObject();
            calibration.addProperty("offset", band.calibration().offset());
            calibration.addProperty("slope", band.calibration().slope());
            entry.add("calibration", calibration);
            entry.add("extent", extentJson(band.raster()));
            bandsJson.add(spec == null ? "band_" + band.band() : spec.name(), entry);
        }
        root.add("bands", bandsJson);
        return root;
    }

    /**
     * Writes the metadata file into {@code directory}, creating it if needed.
     *
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path write(Path directory, String sourceName, Instant observationTime, List<CalibratedBand> bands,
                      List<BandSpec> specs) throws IOException {
        return writeFile(directory.resolve(FILE_NAME), sourceName, observationTime, bands, specs);
    }

    /**
     * Writes the metadata document to {@code file}, creating its directory if needed.
     */
    public Path writeFile(Path file, String sourceName, Instant observationTime, List<CalibratedBand> bands,
                          List<BandSpec> specs) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, gson.toJson(toJson(sourceName, observationTime, bands, specs)),
                StandardCharsets.UTF_8);
        logger.info("Metadata saved: {}", file);
        return file;
    }

    private static BandSpec findSpec(List<BandSpec> specs, int index) {
        if (specs != null) {
            for (BandSpec spec : specs) {
                if (spec.index() == index) {
                    return spec;
                }
            }
        }
        return null;
    }

    private static JsonArray extentJson(RasterImage raster) {
        JsonArray extent = new JsonArray();
        if (raster.isGeoreferenced()) {
            BoundingBox box = raster.getExtent();
            extent.add(box.getMinX());
            extent.add(box.getMinY());
            extent.add(box.getMaxX());
            extent.add(box.getMaxY());
        }
        return extent;
    }
}
