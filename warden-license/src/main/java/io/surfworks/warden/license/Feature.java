package io.surfworks.warden.license;

import java.util.Locale;
import java.util.Optional;

/**
 * Licensable server capabilities.
 *
 * <p>A license grants a set of features. Callers gate behavior with
 * {@link LicenseWatcher#featureCheck(Feature, boolean)}.
 */
public enum Feature {

    AUDIT_LOGGING("Audit Logging"),

    POLICY_ENFORCEMENT("Policy Enforcement"),

    MULTIREGION_DEPLOYMENTS("Multiregion Deployments"),

    AUTOMATED_BACKUPS("Automated Backups"),

    RESOURCE_QUOTAS("Resource Quotas"),

    DYNAMIC_SIZING("Dynamic Application Sizing"),

    /**
     * Read replicas that do not vote in leader election.
     */
    READ_SCALABILITY("Read Scalability"),

    /**
     * Placement of voters across failure domains.
     */
    REDUNDANCY_ZONES("Redundancy Zones");

    private final String displayName;

    Feature(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Look up a feature by enum name or display name, ignoring case.
     *
     * @param name e.g. {@code "AUDIT_LOGGING"} or {@code "Audit Logging"}
     * @return the feature, or empty if unknown
     */
    public static Optional<Feature> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (Feature feature : values()) {
            if (feature.name().equalsIgnoreCase(trimmed)
                    || feature.displayName.toLowerCase(Locale.ROOT).equals(trimmed.toLowerCase(Locale.ROOT))) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
