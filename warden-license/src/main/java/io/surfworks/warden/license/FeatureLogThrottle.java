package io.surfworks.warden.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Limits how often an action runs per feature.
 *
 * <p>Used to keep "feature is unlicensed" warnings from flooding the log
 * when a gated code path is hit repeatedly.
 */
final class FeatureLogThrottle {

    static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    private final Clock clock;
    private final Duration window;
    private final Object lock = new Object();

    // Guarded by lock
    private final Map<Feature, Instant> lastRun = new EnumMap<>(Feature.class);

    FeatureLogThrottle(Clock clock) {
        this(clock, DEFAULT_WINDOW);
    }

    FeatureLogThrottle(Clock clock, Duration window) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = Objects.requireNonNull(window, "window");
    }

    /**
     * Run {@code action} if it has not run for {@code feature} within the window.
     *
     * @return true if the action ran
     */
    boolean runIfDue(Feature feature, Runnable action) {
        synchronized (lock) {
            Instant now = clock.instant();
            Instant last = lastRun.get(feature);
            if (last != null && Duration.between(last, now).compareTo(window) <= 0) {
                return false;
            }
            action.run();
            lastRun.put(feature, now);
            return true;
        }
    }
}
