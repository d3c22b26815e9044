package io.surfworks.warden.license;

import io.surfworks.warden.license.engine.EngineLicense;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A validated license as the server sees it.
 *
 * @param licenseId unique license identifier
 * @param customerId customer the license was issued to
 * @param product product the license applies to
 * @param issueTime when the license was issued
 * @param startTime when the license becomes valid
 * @param expirationTime when the license expires (never null)
 * @param terminationTime when the license stops working entirely (may be null)
 * @param features granted features
 */
public record License(
    String licenseId,
    String customerId,
    String product,
    Instant issueTime,
    Instant startTime,
    Instant expirationTime,
    Instant terminationTime,
    Set<Feature> features
) {

    /**
     * Engine flag holding the granted feature names.
     */
    public static final String FEATURES_FLAG = "features";

    public License {
        Objects.requireNonNull(expirationTime, "expirationTime");
        features = features == null || features.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(Feature.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(features));
    }

    public boolean hasFeature(Feature feature) {
        return features.contains(feature);
    }

    /**
     * Convert an engine license.
     *
     * <p>The {@value #FEATURES_FLAG} flag must be absent or a collection of
     * feature names understood by {@link Feature#fromName(String)}.
     *
     * @throws IllegalArgumentException if the engine license cannot be represented
     */
    public static License fromEngine(EngineLicense engineLicense) {
        if (engineLicense.expirationTime() == null) {
            throw new IllegalArgumentException(
                "license " + engineLicense.licenseId() + " has no expiration time");
        }

        Set<Feature> features = EnumSet.noneOf(Feature.class);
        Object flag = engineLicense.flags().get(FEATURES_FLAG);
        if (flag instanceof Collection<?> names) {
            for (Object name : names) {
                Feature feature = Feature.fromName(String.valueOf(name))
                    .orElseThrow(() -> new IllegalArgumentException("unknown feature: " + name));
                features.add(feature);
            }
        } else if (flag != null) {
            throw new IllegalArgumentException(
                "flag '" + FEATURES_FLAG + "' must be a list, got " + flag.getClass().getSimpleName());
        }

        return new License(
            engineLicense.licenseId(),
            engineLicense.customerId(),
            engineLicense.product(),
            engineLicense.issueTime(),
            engineLicense.startTime(),
            engineLicense.expirationTime(),
            engineLicense.terminationTime(),
            features
        );
    }
}
