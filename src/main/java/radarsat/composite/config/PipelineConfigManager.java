package radarsat.composite.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import radarsat.composite.compositor.CompositorStyle;
import radarsat.composite.projection.GeostationaryProjection;
import radarsat.composite.projection.Projection;
import radarsat.composite.projection.ProjectionRegistry;
import radarsat.composite.projection.WebMercatorProjection;

import java.awt.Color;
import java.awt.Rectangle;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PipelineConfigManager
 *
 * <p>Loads and queries the composite pipeline YAML configuration:
 *   - Parses nested YAML into a Map&lt;String,Object&gt;.
 *   - Offers key-path getters (getDouble, getSection, getList, etc.).
 *   - Builds the typed settings each stage needs (cleaner layout, projections, compositor style).
 *
 * <p>Instances are immutable once loaded and may be shared between pipeline runs. A missing or
 * malformed configuration is fatal: loaders and {@code require*} getters raise
 * {@link IllegalStateException} naming the file or key path.</p>
 */
public class PipelineConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigManager.class);

    public static final String DEFAULT_RESOURCE = "composite_config.yml";

    private final Map<String, Object> configData;
    private final String source;

    private PipelineConfigManager(Map<String, Object> configData, String source) {
        this.configData = Collections.unmodifiableMap(configData);
        this.source = source;
    }

    /**
     * Loads {@code composite_config.yml} from the classpath.
     */
    public static PipelineConfigManager loadDefault() {
        try (InputStream in = PipelineConfigManager.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Configuration resource not found on classpath: " + DEFAULT_RESOURCE);
            }
            return parse(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read configuration resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads a YAML configuration file.
     */
    public static PipelineConfigManager load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read configuration file " + path, e);
        }
    }

    /**
     * Parses YAML text, e.g. an inline configuration.
     */
    public static PipelineConfigManager fromString(String yamlText) {
        return parse(new StringReader(yamlText), "inline");
    }

    @SuppressWarnings("unchecked")
    private static PipelineConfigManager parse(Reader reader, String source) {
        Object loaded;
        try {
            loaded = new Yaml().load(reader);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Error parsing YAML: " + source, e);
        }
        if (!(loaded instanceof Map)) {
            throw new IllegalStateException("YAML root is not a map: " + source);
        }
        logger.info("Loaded pipeline configuration from {}", source);
        return new PipelineConfigManager(new LinkedHashMap<>((Map<String, Object>) loaded), source);
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getAllConfig() {
        return configData;
    }

    // ==================== KEY-PATH GETTERS ====================

    /**
     * Walks the nested maps along {@code keys}.
     *
     * @return the value, or null if any key along the path is missing
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                logger.debug("Config key path {} not found in {}", String.join("/", keys), source);
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return v == null ? null : v.toString();
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Expected int at " + String.join("/", keys) + " but got " + v, e);
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Expected number at " + String.join("/", keys) + " but got " + v, e);
        }
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    public String requireString(String... keys) {
        return require(getString(keys), keys);
    }

    public int requireInteger(String... keys) {
        return require(getInteger(keys), keys);
    }

    public double requireDouble(String... keys) {
        return require(getDouble(keys), keys);
    }

    private <T> T require(T value, String... keys) {
        if (value == null) {
            throw new IllegalStateException("Missing configuration value " + String.join("/", keys) + " in " + source);
        }
        return value;
    }

    // ==================== TYPED SETTINGS ====================

    /**
     * Radar frame layout and colour rules.
     */
    public CleanerSettings cleanerSettings() {
        CleanerSettings.Builder builder = CleanerSettings.builder()
                .footerHeight(requireInteger("cleaner", "footer_height"));

        Map<String, Object> regions = getSection("cleaner", "blank_regions");
        if (regions != null) {
            List<Rectangle> rects = new ArrayList<>();
            for (Map.Entry<String, Object> entry : regions.entrySet()) {
                int[] r = intArray(entry.getValue(), 4, "cleaner/blank_regions/" + entry.getKey());
                rects.add(new Rectangle(r[0], r[1], r[2], r[3]));
            }
            builder.blankRegions(rects);
        }

        List<Object> colors = getList("cleaner", "background_colors");
        if (colors != null) {
            List<int[]> parsed = new ArrayList<>();
            for (Object c : colors) {
                parsed.add(intArray(c, 3, "cleaner/background_colors"));
            }
            builder.backgroundColors(parsed);
        }

        builder.markerThresholds(
                requireInteger("cleaner", "marker", "red_min"),
                requireInteger("cleaner", "marker", "green_min"),
                requireInteger("cleaner", "marker", "blue_max"),
                requireInteger("cleaner", "marker", "red_green_max_diff"));
        return builder.build();
    }

    private static int[] intArray(Object value, int length, String path) {
        if (!(value instanceof List<?> list) || list.size() != length) {
            throw new IllegalStateException("Expected a list of " + length + " integers at " + path + " but got " + value);
        }
        int[] out = new int[length];
        for (int i = 0; i < length; i++) {
            if (!(list.get(i) instanceof Number n)) {
                throw new IllegalStateException("Non-numeric entry at " + path + ": " + list.get(i));
            }
            out[i] = n.intValue();
        }
        return out;
    }

    public String controlPointSetName() {
        return requireString("georeferencing", "control_point_set");
    }

    public String targetProjectionId() {
        String id = getString("georeferencing", "target_projection");
        return id == null ? WebMercatorProjection.ID : id;
    }

    /**
     * Builds a projection from a {@code projections/<key>} section.
     */
    public Projection projection(String key) {
        Map<String, Object> section = getSection("projections", key);
        if (section == null) {
            throw new IllegalStateException("No projection section projections/" + key + " in " + source);
        }
        String type = requireString("projections", key, "type");
        if (!"geostationary".equalsIgnoreCase(type)) {
            throw new IllegalStateException("Unsupported projection type '" + type + "' at projections/" + key);
        }
        return new GeostationaryProjection(
                requireString("projections", key, "id"),
                requireDouble("projections", key, "central_longitude"),
                requireDouble("projections", key, "height"),
                requireDouble("projections", key, "semi_major"),
                requireDouble("projections", key, "semi_minor"),
                getString("projections", key, "sweep"));
    }

    /**
     * Registry with the built-in projections plus every configured one.
     */
    public ProjectionRegistry projectionRegistry() {
        ProjectionRegistry registry = ProjectionRegistry.withDefaults();
        Map<String, Object> section = getSection("projections");
        if (section != null) {
            for (String key : section.keySet()) {
                registry.register(projection(key));
            }
        }
        if (!registry.isRegistered(targetProjectionId())) {
            throw new IllegalStateException("Target projection " + targetProjectionId() + " is not available");
        }
        return registry;
    }

    public String satelliteProjectionId() {
        return requireString("projections", "satellite", "id");
    }

    public double subsetMarginMeters() {
        Double margin = getDouble("satellite", "subset_margin_m");
        return margin == null ? 50_000.0 : margin;
    }

    public Duration satelliteTimeTolerance() {
        Integer minutes = getInteger("satellite", "time_tolerance_minutes");
        return Duration.ofMinutes(minutes == null ? 7 : minutes);
    }

    /**
     * Water-vapour bands, in configuration order.
     */
    public List<BandSpec> wvBands() {
        List<Object> bands = getList("satellite", "bands");
        if (bands == null || bands.isEmpty()) {
            throw new IllegalStateException("No satellite/bands configured in " + source);
        }
        List<BandSpec> result = new ArrayList<>();
        for (Object b : bands) {
            if (!(b instanceof Map<?, ?> m) || !(m.get("index") instanceof Number index) || m.get("name") == null) {
                throw new IllegalStateException("Malformed satellite band entry: " + b);
            }
            Object description = m.get("description");
            result.add(new BandSpec(index.intValue(), m.get("name").toString(),
                    description == null ? "" : description.toString()));
        }
        return result;
    }

    /**
     * Band drawn under the radar; defaults to the first configured band.
     */
    public int compositeBand() {
        Integer band = getInteger("satellite", "composite_band");
        return band != null ? band : wvBands().get(0).index();
    }

    public CompositorStyle compositorStyle() {
        CompositorStyle.Builder b = CompositorStyle.builder();
        Double buffer = getDouble("compositor", "canvas_buffer_m");
        if (buffer != null) {
            b.canvasBuffer(buffer);
        }
        if (getSection("compositor", "satellite") != null) {
            b.satellite(requireDouble("compositor", "satellite", "opacity"),
                    requireDouble("compositor", "satellite", "low_percentile"),
                    requireDouble("compositor", "satellite", "high_percentile"));
        }
        Double radarOpacity = getDouble("compositor", "radar", "opacity");
        if (radarOpacity != null) {
            b.radarOpacity(radarOpacity);
        }
        if (getSection("compositor", "boundary") != null) {
            b.boundary(color("compositor", "boundary", "color"),
                    (float) requireDouble("compositor", "boundary", "width"),
                    requireDouble("compositor", "boundary", "opacity"));
        }
        if (getSection("compositor", "marker") != null) {
            b.marker(color("compositor", "marker", "color"),
                    (float) requireDouble("compositor", "marker", "size"),
                    color("compositor", "marker", "edge_color"),
                    (float) requireDouble("compositor", "marker", "edge_width"));
        }
        if (getSection("compositor", "label") != null) {
            b.label(color("compositor", "label", "color"),
                    requireInteger("compositor", "label", "font_size"),
                    requireDouble("compositor", "label", "offset_m"));
            List<Object> cities = getList("compositor", "label", "cities");
            if (cities != null) {
                b.labelCities(cities.stream().map(Object::toString).toList());
            }
        }
        if (getSection("compositor", "title") != null) {
            b.title(color("compositor", "title", "color"), requireInteger("compositor", "title", "font_size"));
        }
        return b.build();
    }

    private Color color(String... keys) {
        String value = requireString(keys);
        try {
            return Color.decode(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid colour at " + String.join("/", keys) + ": " + value, e);
        }
    }

    public int batchThreads() {
        Integer threads = getInteger("batch", "threads");
        return threads == null ? 1 : Math.max(1, threads);
    }
}
