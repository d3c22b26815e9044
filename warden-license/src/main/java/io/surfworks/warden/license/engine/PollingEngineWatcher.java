package io.surfworks.warden.license.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * {@link EngineWatcher} that periodically re-validates the stored license.
 *
 * <p>On every check the stored blob is passed back through the validator:
 * <ul>
 *   <li>a failure is reported once as {@link LicenseEvent.Failed} until a
 *       check succeeds again or a new license is set</li>
 *   <li>inside the warning window before expiration an
 *       {@link LicenseEvent.ExpiringSoon} is emitted at most once per
 *       warning interval</li>
 * </ul>
 * Every successful {@link #setLicense(String)} emits {@link LicenseEvent.Updated}.
 *
 * <p>Events are offered to a bounded queue and dropped when it is full, so a
 * slow consumer never stalls the checker.
 */
public class PollingEngineWatcher implements EngineWatcher {

    private static final Logger LOG = Logger.getLogger(PollingEngineWatcher.class.getName());

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_WARNING_WINDOW = Duration.ofDays(30);
    public static final Duration DEFAULT_WARNING_INTERVAL = Duration.ofDays(1);

    private static final int EVENT_QUEUE_CAPACITY = 64;

    private final LicenseValidator validator;
    private final Clock clock;
    private final Duration checkInterval;
    private final Duration warningWindow;
    private final Duration warningInterval;
    private final BlockingQueue<LicenseEvent> events = new LinkedBlockingQueue<>(EVENT_QUEUE_CAPACITY);
    private final AtomicReference<Stored> stored = new AtomicReference<>();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final ScheduledExecutorService scheduler;

    // Guarded by this
    private boolean failureReported;
    private Instant lastWarning;

    /**
     * Create a watcher and store the initial license.
     *
     * <p>Checks are not scheduled until {@link #start()} is called.
     *
     * @throws LicenseEngineException if the initial license is not valid
     */
    public PollingEngineWatcher(
            WatcherOptions options,
            Clock clock,
            Duration checkInterval,
            Duration warningWindow,
            Duration warningInterval) {
        this.validator = options.validator();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.checkInterval = requirePositive(checkInterval, "checkInterval");
        this.warningWindow = Objects.requireNonNull(warningWindow, "warningWindow");
        this.warningInterval = requirePositive(warningInterval, "warningInterval");

        String blob = options.initialBlob();
        stored.set(new Stored(blob, validator.validate(blob)));

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "license-engine-watcher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start periodic checks.
     */
    public void start() {
        long millis = checkInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::check, millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public EngineLicense validateLicense(String blob) {
        return validator.validate(blob);
    }

    @Override
    public synchronized EngineLicense setLicense(String blob) {
        EngineLicense license = validator.validate(blob);
        stored.set(new Stored(blob, license));
        failureReported = false;
        lastWarning = null;
        emit(new LicenseEvent.Updated(license));
        return license;
    }

    @Override
    public EngineLicense license() {
        return stored.get().license();
    }

    @Override
    public BlockingQueue<LicenseEvent> events() {
        return events;
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            scheduler.shutdownNow();
            LOG.fine("License engine watcher stopped");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Run one validation pass over the stored license.
     */
    synchronized void check() {
        Stored current = stored.get();
        EngineLicense license;
        try {
            license = validator.validate(current.blob());
        } catch (LicenseEngineException e) {
            reportFailure(e);
            return;
        } catch (RuntimeException e) {
            reportFailure(new LicenseEngineException(
                "license validation failed: " + e.getMessage(), LicenseEngineException.Reason.UNKNOWN, e));
            return;
        }
        failureReported = false;

        Instant expiration = license.expirationTime();
        if (expiration == null) {
            return;
        }
        Instant now = clock.instant();
        boolean inWindow = !now.isBefore(expiration.minus(warningWindow));
        boolean due = lastWarning == null || !now.isBefore(lastWarning.plus(warningInterval));
        if (inWindow && due) {
            emit(new LicenseEvent.ExpiringSoon(expiration));
            lastWarning = now;
        }
    }

    private void reportFailure(LicenseEngineException error) {
        if (!failureReported) {
            emit(new LicenseEvent.Failed(error));
            failureReported = true;
        }
    }

    private void emit(LicenseEvent event) {
        if (!events.offer(event)) {
            LOG.fine("Event queue full, dropping " + event);
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
        return d;
    }

    private record Stored(String blob, EngineLicense license) {
    }
}
