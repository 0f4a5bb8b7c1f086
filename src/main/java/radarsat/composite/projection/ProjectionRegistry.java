package radarsat.composite.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe lookup of {@link Projection} implementations by identifier.
 *
 * <p>Every registry knows EPSG:4326 and EPSG:3857; satellite native projections are registered from
 * configuration. Lookups are case-insensitive. Unlike a fallback-to-default lookup, an unknown identifier
 * is a configuration error and raises {@link IllegalStateException}: a raster tagged with a projection
 * nobody can evaluate must not be composited as if it were something else.</p>
 *
 * <pre>{@code
 * ProjectionRegistry registry = ProjectionRegistry.withDefaults();
 * registry.register(GeostationaryProjection.seviri("SEVIRI:GEOS", 0.0));
 * Projection mercator = registry.get("epsg:3857");
 * }</pre>
 *
 * <p>Instances are independent of each other; there is no process-wide registry.</p>
 *
 * @since 0.2.0
 */
public final class ProjectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionRegistry.class);

    private final Map<String, Projection> projections = new ConcurrentHashMap<>();

    /**
     * @return a registry holding the geographic and Web Mercator projections
     */
    public static ProjectionRegistry withDefaults() {
        ProjectionRegistry registry = new ProjectionRegistry();
        registry.register(new GeographicProjection());
        registry.register(new WebMercatorProjection());
        return registry;
    }

    /**
     * Registers a projection under its own identifier, replacing any previous registration.
     */
    public void register(Projection projection) {
        if (projection == null || projection.getId() == null || projection.getId().isBlank()) {
            throw new IllegalArgumentException("Projection and its id must be non-null");
        }
        Projection previous = projections.put(key(projection.getId()), projection);
        if (previous != null && previous != projection) {
            logger.warn("Replaced projection registered as '{}'", projection.getId());
        } else {
            logger.debug("Registered projection '{}'", projection.getId());
        }
    }

    /**
     * @throws IllegalStateException if no projection is registered under the identifier
     */
    public Projection get(String id) {
        if (id == null) {
            throw new IllegalStateException("No projection identifier given");
        }
        Projection projection = projections.get(key(id));
        if (projection == null) {
            throw new IllegalStateException("Unknown projection '" + id + "', registered: " + getRegisteredIds());
        }
        return projection;
    }

    public boolean isRegistered(String id) {
        return id != null && projections.containsKey(key(id));
    }

    public Set<String> getRegisteredIds() {
        Set<String> ids = new TreeSet<>();
        projections.values().forEach(p -> ids.add(p.getId()));
        return ids;
    }

    private static String key(String id) {
        return id.trim().toUpperCase(Locale.ROOT);
    }
}
