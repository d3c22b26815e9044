package io.surfworks.warden.license.engine;

import java.util.Objects;

/**
 * Options for {@link ValidationEngine#newWatcher(WatcherOptions)}.
 *
 * @param initialBlob the license blob the watcher starts with
 * @param validator the validator used for every blob the watcher sees
 */
public record WatcherOptions(String initialBlob, LicenseValidator validator) {

    public WatcherOptions {
        Objects.requireNonNull(initialBlob, "initialBlob");
        Objects.requireNonNull(validator, "validator");
    }
}
