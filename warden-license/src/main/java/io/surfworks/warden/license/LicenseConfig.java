package io.surfworks.warden.license;

import io.surfworks.warden.license.engine.LicenseValidator;
import io.surfworks.warden.license.engine.ValidationEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Where the server's license comes from and the build date it is checked against.
 *
 * <p>A license can be supplied three ways:
 * <ul>
 *   <li>the {@value #LICENSE_PATH_SETTING} setting in the server configuration</li>
 *   <li>the {@value #ENV_LICENSE} environment variable holding the license itself</li>
 *   <li>the {@value #ENV_LICENSE_PATH} environment variable pointing at a license file</li>
 * </ul>
 * An inline license wins over a path; a configured path wins over the
 * environment path.
 */
public final class LicenseConfig {

    /**
     * Server configuration setting for the license file path.
     */
    public static final String LICENSE_PATH_SETTING = "license_path";

    /**
     * Environment variable holding the license blob.
     */
    public static final String ENV_LICENSE = "WARDEN_LICENSE";

    /**
     * Environment variable holding a path to the license file.
     */
    public static final String ENV_LICENSE_PATH = "WARDEN_LICENSE_PATH";

    private final Path licensePath;
    private final String license;
    private final Instant buildDate;
    private final UnaryOperator<String> env;

    private LicenseConfig(Builder builder) {
        this.licensePath = builder.licensePath;
        this.license = builder.license;
        this.buildDate = builder.buildDate;
        this.env = builder.env;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path licensePath() {
        return licensePath;
    }

    public String license() {
        return license;
    }

    public Instant buildDate() {
        return buildDate;
    }

    /**
     * Resolve the license blob from the configured sources.
     *
     * @return the trimmed blob, or an empty string if no source is configured
     * @throws LicenseConfigException if a configured license file cannot be read
     */
    public String licenseString() {
        String inline = firstNonBlank(license, env.apply(ENV_LICENSE));
        if (inline != null) {
            return inline.trim();
        }

        Path path = licensePath;
        if (path == null) {
            String envPath = env.apply(ENV_LICENSE_PATH);
            if (envPath != null && !envPath.isBlank()) {
                try {
                    path = Path.of(envPath.trim());
                } catch (InvalidPathException e) {
                    throw new LicenseConfigException(
                        "invalid " + ENV_LICENSE_PATH + " value: " + envPath, e);
                }
            }
        }
        if (path == null) {
            return "";
        }

        try {
            return Files.readString(path).trim();
        } catch (IOException e) {
            throw new LicenseConfigException("failed to read license file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Create the engine validator bound to this configuration's build date.
     *
     * @throws LicenseConfigException if the build date is unset
     */
    public LicenseValidator validator(ValidationEngine engine) {
        if (!isBuildDateSet(buildDate)) {
            throw LicenseConfigException.unsetBuildDate();
        }
        return engine.newValidator(buildDate);
    }

    /**
     * A build date is unset when null or the epoch.
     */
    static boolean isBuildDateSet(Instant buildDate) {
        return buildDate != null && !Instant.EPOCH.equals(buildDate);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }

    /**
     * Builder for {@link LicenseConfig}.
     */
    public static final class Builder {

        private Path licensePath;
        private String license;
        private Instant buildDate;
        private UnaryOperator<String> env = System::getenv;

        private Builder() {}

        public Builder licensePath(Path licensePath) {
            this.licensePath = licensePath;
            return this;
        }

        public Builder license(String license) {
            this.license = license;
            return this;
        }

        public Builder buildDate(Instant buildDate) {
            this.buildDate = buildDate;
            return this;
        }

        /**
         * Replace the environment lookup (for testing).
         */
        public Builder env(UnaryOperator<String> env) {
            this.env = Objects.requireNonNull(env, "env");
            return this;
        }

        public LicenseConfig build() {
            return new LicenseConfig(this);
        }
    }
}
