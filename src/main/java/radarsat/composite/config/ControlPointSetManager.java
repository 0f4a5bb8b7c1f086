package radarsat.composite.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import radarsat.composite.errors.ProjectionUndefinedException;
import radarsat.composite.model.ControlPoint;
import radarsat.composite.model.ControlPointSet;
import radarsat.composite.projection.ProjectionBridge;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages named control-point sets persisted as JSON.
 *
 * <p>Each entry holds the set name, the projection its projected coordinates are in ({@code crs}),
 * the polynomial degree to fit, free-form notes and the points as
 * {@code [pixelX, pixelY, projX, projY]} arrays. The bundled {@code control_points.json} ships the
 * authoritative 39-point set and the legacy 8-point set; a file-backed manager can also save and
 * delete sets.</p>
 *
 * @since 0.2.0
 */
public class ControlPointSetManager {
    private static final Logger logger = LoggerFactory.getLogger(ControlPointSetManager.class);

    public static final String DEFAULT_RESOURCE = "control_points.json";

    private static final Type SETS_TYPE = new TypeToken<LinkedHashMap<String, StoredSet>>() {}.getType();

    private final Path storePath;
    private final Map<String, ControlPointSet> sets;
    private final Gson gson;

    private ControlPointSetManager(Path storePath, Map<String, ControlPointSet> sets) {
        this.storePath = storePath;
        this.sets = sets;
        this.gson = createGson();
    }

    /**
     * Read-only manager over the bundled {@code control_points.json}.
     */
    public static ControlPointSetManager fromClasspath() {
        try (InputStream in = ControlPointSetManager.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Control-point resource not found on classpath: " + DEFAULT_RESOURCE);
            }
            Map<String, ControlPointSet> sets = parse(new InputStreamReader(in, StandardCharsets.UTF_8),
                    "classpath:" + DEFAULT_RESOURCE);
            return new ControlPointSetManager(null, sets);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * File-backed manager. A missing file starts an empty store; it is created on the first save.
     */
    public static ControlPointSetManager open(Path file) {
        if (!Files.exists(file)) {
            logger.info("No control-point file at {}, starting empty", file);
            return new ControlPointSetManager(file, new LinkedHashMap<>());
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return new ControlPointSetManager(file, parse(reader, file.toString()));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read control-point file " + file, e);
        }
    }

    private static Map<String, ControlPointSet> parse(Reader reader, String source) {
        Map<String, StoredSet> stored;
        try {
            stored = createGson().fromJson(reader, SETS_TYPE);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed control-point JSON in " + source, e);
        }
        Map<String, ControlPointSet> sets = new LinkedHashMap<>();
        if (stored != null) {
            for (Map.Entry<String, StoredSet> entry : stored.entrySet()) {
                StoredSet s = entry.getValue();
                String name = s.name != null ? s.name : entry.getKey();
                try {
                    sets.put(name, new ControlPointSet(name, s.crs, s.degree, s.notes,
                            s.points == null ? List.of() : s.points));
                } catch (IllegalArgumentException | NullPointerException e) {
                    throw new IllegalStateException("Invalid control-point set '" + name + "' in " + source, e);
                }
            }
        }
        logger.info("Loaded {} control-point sets from {}", sets.size(), source);
        return sets;
    }

    private static Gson createGson() {
        return new GsonBuilder()
                .registerTypeAdapter(ControlPoint.class, new ControlPointAdapter())
                .setPrettyPrinting()
                .create();
    }

    /**
     * Serialized form of a set.
     */
    private static class StoredSet {
        String name;
        String crs;
        int degree;
        String notes;
        List<ControlPoint> points;

        StoredSet(ControlPointSet set) {
            this.name = set.getName();
            this.crs = set.getProjectionId();
            this.degree = set.getDegree();
            this.notes = set.getNotes();
            this.points = new ArrayList<>(set.getPoints());
        }
    }

    /**
     * Writes a control point as a compact {@code [pixelX, pixelY, projX, projY]} array.
     */
    private static class ControlPointAdapter extends TypeAdapter<ControlPoint> {

        @Override
        public void write(JsonWriter out, ControlPoint point) throws IOException {
            if (point == null) {
                out.nullValue();
                return;
            }
            out.beginArray();
            out.value(point.pixelX());
            out.value(point.pixelY());
            out.value(point.projX());
            out.value(point.projY());
            out.endArray();
        }

        @Override
        public ControlPoint read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            double[] v = new double[4];
            int n = 0;
            in.beginArray();
            while (in.hasNext()) {
                if (n >= 4) {
                    throw new JsonParseException("Control point has more than 4 values at " + in.getPath());
                }
                v[n++] = in.nextDouble();
            }
            in.endArray();
            if (n != 4) {
                throw new JsonParseException("Control point needs 4 values, got " + n + " at " + in.getPath());
            }
            return new ControlPoint(v[0], v[1], v[2], v[3]);
        }
    }

    // ==================== QUERIES ====================

    public Optional<ControlPointSet> find(String name) {
        return Optional.ofNullable(sets.get(name));
    }

    /**
     * @throws IllegalStateException if no set has this name
     */
    public ControlPointSet get(String name) {
        ControlPointSet set = sets.get(name);
        if (set == null) {
            throw new IllegalStateException("Unknown control-point set '" + name + "', available: " + sets.keySet());
        }
        return set;
    }

    public Collection<ControlPointSet> getAllSets() {
        return Collections.unmodifiableCollection(sets.values());
    }

    /**
     * Returns the named set with its projected coordinates expressed in {@code targetProjectionId}.
     *
     * @throws IllegalStateException if the set is unknown
     * @throws ProjectionUndefinedException if a point cannot be converted
     */
    public ControlPointSet resolve(String name, String targetProjectionId, ProjectionBridge bridge)
            throws ProjectionUndefinedException {
        ControlPointSet set = get(name);
        if (set.getProjectionId().equalsIgnoreCase(targetProjectionId)) {
            return set;
        }
        ProjectionBridge.PointTransformer toTarget = bridge.pointTransformer(set.getProjectionId(), targetProjectionId);
        List<ControlPoint> converted = new ArrayList<>();
        for (ControlPoint p : set.getPoints()) {
            double[] xy = toTarget.apply(p.projX(), p.projY());
            converted.add(new ControlPoint(p.pixelX(), p.pixelY(), xy[0], xy[1]));
        }
        logger.info("Converted control-point set '{}' from {} to {}", name, set.getProjectionId(), targetProjectionId);
        return new ControlPointSet(set.getName(), targetProjectionId, set.getDegree(), set.getNotes(), converted);
    }

    // ==================== PERSISTENCE ====================

    /**
     * Adds or replaces a set and writes the store.
     *
     * @throws IOException if the file cannot be written
     * @throws IllegalStateException if this manager is read-only
     */
    public void save(ControlPointSet set) throws IOException {
        requireWritable();
        sets.put(set.getName(), set);
        write();
        logger.info("Saved control-point set: {}", set);
    }

    /**
     * @return true if the set existed and was removed
     * @throws IOException if the file cannot be written
     */
    public boolean delete(String name) throws IOException {
        requireWritable();
        if (sets.remove(name) == null) {
            return false;
        }
        write();
        logger.info("Deleted control-point set: {}", name);
        return true;
    }

    private void requireWritable() {
        if (storePath == null) {
            throw new IllegalStateException("Bundled control-point sets are read-only");
        }
    }

    private void write() throws IOException {
        Map<String, StoredSet> stored = new LinkedHashMap<>();
        sets.forEach((name, set) -> stored.put(name, new StoredSet(set)));
        Path parent = storePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(storePath, gson.toJson(stored, SETS_TYPE), StandardCharsets.UTF_8);
        logger.debug("Wrote {} control-point sets to {}", sets.size(), storePath);
    }
}
