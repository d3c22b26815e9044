package io.surfworks.warden.license.engine;

import java.time.Instant;

/**
 * Entry point to the license validation engine.
 *
 * <p>The engine owns cryptographic validation and persistence of the
 * active license. The license watcher consumes it through this interface
 * and never parses blobs itself.
 */
public interface ValidationEngine {

    /**
     * Create a validator bound to the given build date.
     *
     * @param buildDate build timestamp of the running binary
     * @return a validator
     */
    LicenseValidator newValidator(Instant buildDate);

    /**
     * Create a watcher for the given initial license.
     *
     * <p>The watcher validates and stores {@code options.initialBlob()}
     * before returning and starts emitting {@link LicenseEvent}s.
     *
     * @param options initial blob and validator
     * @return a running watcher
     * @throws LicenseEngineException if the initial license is not valid
     */
    EngineWatcher newWatcher(WatcherOptions options);
}
