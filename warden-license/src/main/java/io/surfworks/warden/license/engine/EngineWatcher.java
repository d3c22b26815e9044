package io.surfworks.warden.license.engine;

import java.util.concurrent.BlockingQueue;

/**
 * Handle to the engine's background license watcher.
 *
 * <p>The watcher holds the engine's persisted license and reports its
 * lifecycle (renewal, upcoming expiration, expiration or termination)
 * on {@link #events()}.
 */
public interface EngineWatcher {

    /**
     * Validate a blob with the watcher's validator without storing it.
     *
     * @throws LicenseEngineException if the blob is not valid
     */
    EngineLicense validateLicense(String blob);

    /**
     * Validate and persist a new license.
     *
     * @throws LicenseEngineException if validation or persistence fails
     */
    EngineLicense setLicense(String blob);

    /**
     * The canonical license currently persisted by the engine.
     *
     * @throws LicenseEngineException if no valid license is stored
     */
    EngineLicense license();

    /**
     * Lifecycle events. A single consumer is expected.
     */
    BlockingQueue<LicenseEvent> events();

    /**
     * Stop background work. Safe to call more than once.
     */
    void stop();
}
