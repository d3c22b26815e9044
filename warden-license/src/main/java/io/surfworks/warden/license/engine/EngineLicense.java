package io.surfworks.warden.license.engine;

import java.time.Instant;
import java.util.Map;

/**
 * License object as produced by the validation engine.
 *
 * <p>This is the engine's generic representation. Product-specific
 * entitlements live in {@link #flags()} and are interpreted by the caller.
 *
 * @param licenseId unique license identifier
 * @param customerId customer the license was issued to
 * @param installationId installation binding, or {@code "*"} for any
 * @param product product the license applies to
 * @param issueTime when the license was issued
 * @param startTime when the license becomes valid
 * @param expirationTime when the license expires
 * @param terminationTime when the license stops working entirely
 * @param flags product-specific claims (e.g. {@code "features"})
 */
public record EngineLicense(
    String licenseId,
    String customerId,
    String installationId,
    String product,
    Instant issueTime,
    Instant startTime,
    Instant expirationTime,
    Instant terminationTime,
    Map<String, Object> flags
) {

    public EngineLicense {
        flags = flags != null ? Map.copyOf(flags) : Map.of();
    }
}
