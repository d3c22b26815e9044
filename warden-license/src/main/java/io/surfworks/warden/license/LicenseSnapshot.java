package io.surfworks.warden.license;

import java.util.Objects;

/**
 * Immutable pairing of a license and the blob it was validated from.
 *
 * <p>Replaced as a unit by {@link LicenseWatcher}; never modified.
 *
 * @param license the validated license
 * @param blob the raw license text
 */
public record LicenseSnapshot(License license, String blob) {

    public LicenseSnapshot {
        Objects.requireNonNull(license, "license");
        Objects.requireNonNull(blob, "blob");
    }

    @Override
    public String toString() {
        return "LicenseSnapshot[licenseId=" + license.licenseId() + ", blobLength=" + blob.length() + "]";
    }
}
