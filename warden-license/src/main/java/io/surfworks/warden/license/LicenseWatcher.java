package io.surfworks.warden.license;

import io.surfworks.warden.license.engine.EngineLicense;
import io.surfworks.warden.license.engine.EngineWatcher;
import io.surfworks.warden.license.engine.LicenseValidator;
import io.surfworks.warden.license.engine.ValidationEngine;
import io.surfworks.warden.license.engine.WatcherOptions;
import io.surfworks.warden.license.metrics.JfrMetricsSink;
import io.surfworks.warden.license.metrics.MetricsSink;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the server's active license and answers entitlement queries.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseWatcher watcher = LicenseWatcher.create(config, engine);
 * LicenseMonitor monitor = watcher.start();
 *
 * // Gate a licensed code path
 * watcher.featureCheck(Feature.AUDIT_LOGGING, true);
 *
 * // On shutdown
 * monitor.close();
 * }</pre>
 *
 * <p>The active license is published as an immutable {@link LicenseSnapshot}
 * through a single atomic reference, so queries never lock and never see a
 * license paired with another license's blob. Mutations are serialized.
 *
 * <p>Entitlement fails closed: once the license the server booted with no
 * longer validates, {@link #features()} reports nothing, while
 * {@link #currentLicense()} keeps returning the last applied license and the
 * server keeps running.
 */
public class LicenseWatcher {

    private static final Logger LOG = Logger.getLogger(LicenseWatcher.class.getName());

    private static final Set<Feature> NO_FEATURES =
        Collections.unmodifiableSet(EnumSet.noneOf(Feature.class));

    private final AtomicReference<LicenseSnapshot> snapshot = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean monitorStarted = new AtomicBoolean();

    private final String fileLicense;
    private final EngineWatcher engineWatcher;
    private final FeatureLogThrottle logThrottle;
    private final MetricsSink metricsSink;
    private final Clock clock;

    /**
     * Create a watcher for the license described by {@code config}.
     *
     * @throws LicenseConfigException if no license is configured or the build date is unset
     * @throws LicenseValidationException if the license does not validate
     */
    public static LicenseWatcher create(LicenseConfig config, ValidationEngine engine) {
        return new LicenseWatcher(config.licenseString(), config.buildDate(), engine);
    }

    /**
     * Create a watcher reporting metrics to JFR.
     *
     * @param blob the license loaded from file or environment
     * @param buildDate build timestamp of the running binary
     * @param engine the validation engine
     * @throws LicenseConfigException if {@code blob} is empty or {@code buildDate} is unset
     * @throws LicenseValidationException if the license does not validate
     */
    public LicenseWatcher(String blob, Instant buildDate, ValidationEngine engine) {
        this(blob, buildDate, engine, Clock.systemUTC(), new JfrMetricsSink());
    }

    public LicenseWatcher(
            String blob,
            Instant buildDate,
            ValidationEngine engine,
            Clock clock,
            MetricsSink metricsSink) {
        Objects.requireNonNull(engine, "engine");
        if (blob == null || blob.isBlank()) {
            throw LicenseConfigException.missingLicense();
        }
        // An unset build date would let licenses effectively never expire
        if (!LicenseConfig.isBuildDateSet(buildDate)) {
            throw LicenseConfigException.unsetBuildDate();
        }

        this.fileLicense = blob;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
        this.logThrottle = new FeatureLogThrottle(clock);

        LicenseValidator validator = engine.newValidator(buildDate);
        EngineWatcher created;
        try {
            created = engine.newWatcher(new WatcherOptions(blob, validator));
        } catch (RuntimeException e) {
            throw new LicenseValidationException("failed to initialize license", e);
        }
        this.engineWatcher = created;

        try {
            applyLicense(blob);
        } catch (LicenseValidationException e) {
            engineWatcher.stop();
            throw new LicenseValidationException("failed to set license", e);
        }
        LOG.fine("License watcher initialized with license " + currentLicense().licenseId());
    }

    /**
     * Re-read the license from {@code config} and apply it.
     *
     * <p>If no license is configured the current license is kept.
     *
     * @throws LicenseConfigException if a configured license file cannot be read
     * @throws LicenseValidationException if the new license does not validate
     */
    public void reload(LicenseConfig config) {
        String blob = config.licenseString();
        if (blob.isEmpty()) {
            return;
        }
        setLicense(blob);
    }

    /**
     * The license currently in effect.
     */
    public License currentLicense() {
        return snapshot.get().license();
    }

    /**
     * The blob of the license currently in effect.
     */
    public String currentBlob() {
        return snapshot.get().blob();
    }

    /**
     * The license and blob currently in effect, read together.
     */
    public LicenseSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * The license loaded from file or environment when the watcher was created.
     *
     * <p>Not necessarily the license currently in effect if a newer one was
     * applied with {@link #setLicense(String)}.
     */
    public String fileLicense() {
        return fileLicense;
    }

    /**
     * Validate a blob with the engine and convert it, without applying it.
     *
     * @throws LicenseValidationException if the blob does not validate or convert
     */
    public License validateLicense(String blob) {
        EngineLicense engineLicense;
        try {
            engineLicense = engineWatcher.validateLicense(blob);
        } catch (RuntimeException e) {
            throw new LicenseValidationException("error validating license", e);
        }
        return convert(engineLicense);
    }

    /**
     * Features granted by the current license.
     *
     * <p>Returns an empty set if the file license no longer validates,
     * for example after it expired.
     */
    public Set<Feature> features() {
        License license = currentLicense();

        try {
            validateLicense(fileLicense);
        } catch (LicenseValidationException e) {
            return NO_FEATURES;
        }

        return license.features();
    }

    public boolean hasFeature(Feature feature) {
        return features().contains(feature);
    }

    /**
     * Check that the current license grants {@code feature}.
     *
     * <p>With {@code emitLog} set, a warning is logged at most once every
     * five minutes per feature.
     *
     * @throws UnlicensedFeatureException if the feature is not granted
     */
    public void featureCheck(Feature feature, boolean emitLog) {
        if (hasFeature(feature)) {
            return;
        }

        UnlicensedFeatureException error = new UnlicensedFeatureException(feature);
        if (emitLog) {
            logThrottle.runIfDue(feature, () -> LOG.warning(error.getMessage()));
        }
        throw error;
    }

    /**
     * Validate, persist and apply a new license.
     *
     * <p>Trailing line terminators are removed first. On failure the current
     * license is left unchanged.
     *
     * @throws LicenseValidationException if validation, persistence, retrieval or conversion fails
     */
    public void setLicense(String blob) {
        Objects.requireNonNull(blob, "blob");
        applyLicense(blob);
    }

    /**
     * Start the monitor loop. Callers own the returned handle and must
     * close it on shutdown.
     *
     * @throws IllegalStateException if the monitor was already started
     */
    public LicenseMonitor start() {
        if (!monitorStarted.compareAndSet(false, true)) {
            throw new IllegalStateException("License monitor already started");
        }
        LicenseMonitor monitor = new LicenseMonitor(this, engineWatcher, metricsSink, clock);
        monitor.start();
        return monitor;
    }

    EngineWatcher engineWatcher() {
        return engineWatcher;
    }

    private void applyLicense(String rawBlob) {
        String blob = trimLineTerminators(rawBlob);

        writeLock.lock();
        try {
            try {
                engineWatcher.validateLicense(blob);
            } catch (RuntimeException e) {
                throw new LicenseValidationException("error validating license", e);
            }

            try {
                engineWatcher.setLicense(blob);
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "failed to persist license", e);
                throw new LicenseValidationException("failed to persist license", e);
            }

            EngineLicense stored;
            try {
                stored = engineWatcher.license();
            } catch (RuntimeException e) {
                throw new LicenseValidationException("failed to retrieve license", e);
            }

            snapshot.set(new LicenseSnapshot(convert(stored), blob));
        } finally {
            writeLock.unlock();
        }
    }

    private static License convert(EngineLicense engineLicense) {
        try {
            return License.fromEngine(engineLicense);
        } catch (IllegalArgumentException e) {
            throw new LicenseValidationException("failed to convert license", e);
        }
    }

    static String trimLineTerminators(String blob) {
        int end = blob.length();
        while (end > 0 && (blob.charAt(end - 1) == '\n' || blob.charAt(end - 1) == '\r')) {
            end--;
        }
        return blob.substring(0, end);
    }
}
