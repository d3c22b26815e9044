package io.surfworks.warden.license.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link ValidationEngine} backed by a host-supplied validator factory and
 * {@link PollingEngineWatcher}.
 *
 * <p>Usage:
 * <pre>{@code
 * ValidationEngine engine = new DefaultValidationEngine(
 *     buildDate -> blob -> verifier.verify(blob, buildDate));
 * }</pre>
 */
public class DefaultValidationEngine implements ValidationEngine {

    private final Function<Instant, LicenseValidator> validatorFactory;
    private final Clock clock;
    private final Duration checkInterval;
    private final Duration warningWindow;
    private final Duration warningInterval;

    /**
     * Create an engine with default check and warning intervals.
     *
     * @param validatorFactory creates a validator bound to a build date
     */
    public DefaultValidationEngine(Function<Instant, LicenseValidator> validatorFactory) {
        this(
            validatorFactory,
            Clock.systemUTC(),
            PollingEngineWatcher.DEFAULT_CHECK_INTERVAL,
            PollingEngineWatcher.DEFAULT_WARNING_WINDOW,
            PollingEngineWatcher.DEFAULT_WARNING_INTERVAL
        );
    }

    public DefaultValidationEngine(
            Function<Instant, LicenseValidator> validatorFactory,
            Clock clock,
            Duration checkInterval,
            Duration warningWindow,
            Duration warningInterval) {
        this.validatorFactory = Objects.requireNonNull(validatorFactory, "validatorFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.checkInterval = checkInterval;
        this.warningWindow = warningWindow;
        this.warningInterval = warningInterval;
    }

    @Override
    public LicenseValidator newValidator(Instant buildDate) {
        return Objects.requireNonNull(validatorFactory.apply(buildDate), "validator factory returned null");
    }

    @Override
    public EngineWatcher newWatcher(WatcherOptions options) {
        PollingEngineWatcher watcher = new PollingEngineWatcher(
            options, clock, checkInterval, warningWindow, warningInterval);
        watcher.start();
        return watcher;
    }
}
