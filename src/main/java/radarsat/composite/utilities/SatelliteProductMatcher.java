package radarsat.composite.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

/**
 * Picks the satellite product whose sensing time is closest to a radar frame, within a tolerance.
 *
 * @since 0.3.0
 */
public class SatelliteProductMatcher {
    private static final Logger logger = LoggerFactory.getLogger(SatelliteProductMatcher.class);

    public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(7);

    private final Duration tolerance;

    public SatelliteProductMatcher() {
        this(DEFAULT_TOLERANCE);
    }

    public SatelliteProductMatcher(Duration tolerance) {
        if (tolerance == null || tolerance.isNegative()) {
            throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public Duration getTolerance() {
        return tolerance;
    }

    /**
     * @param radarTime radar observation time
     * @param candidates available products
     * @param sensingTime extracts a product's sensing time; products without one are ignored
     * @return the closest product within the tolerance, or empty; ties go to the earlier candidate
     */
    public <T> Optional<T> match(Instant radarTime, Collection<T> candidates, Function<T, Instant> sensingTime) {
        T best = null;
        Duration bestGap = null;
        for (T candidate : candidates) {
            Instant t = sensingTime.apply(candidate);
            if (t == null) {
                continue;
            }
            Duration gap = Duration.between(radarTime, t).abs();
            if (gap.compareTo(tolerance) > 0) {
                continue;
            }
            if (bestGap == null || gap.compareTo(bestGap) < 0) {
                best = candidate;
                bestGap = gap;
            }
        }
        if (best == null) {
            logger.warn("No satellite product within {} of {} ({} candidates)", tolerance, radarTime, candidates.size());
        } else {
            logger.debug("Matched satellite product {} s from radar time {}", bestGap.getSeconds(), radarTime);
        }
        return Optional.ofNullable(best);
    }

    public Optional<Instant> match(Instant radarTime, Collection<Instant> sensingTimes) {
        return match(radarTime, sensingTimes, Function.identity());
    }
}
