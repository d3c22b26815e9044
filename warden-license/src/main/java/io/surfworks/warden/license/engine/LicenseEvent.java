package io.surfworks.warden.license.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Event emitted by an {@link EngineWatcher}.
 */
public sealed interface LicenseEvent {

    /**
     * The engine stored a new license.
     *
     * @param license the license now active in the engine
     */
    record Updated(EngineLicense license) implements LicenseEvent {
    }

    /**
     * The active license stopped validating, usually because it expired
     * or was terminated.
     *
     * @param error what the engine reported
     */
    record Failed(LicenseEngineException error) implements LicenseEvent {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }

    /**
     * The active license is inside its expiration warning window.
     *
     * @param expirationTime when the license expires
     */
    record ExpiringSoon(Instant expirationTime) implements LicenseEvent {
        public ExpiringSoon {
            Objects.requireNonNull(expirationTime, "expirationTime");
        }
    }
}
