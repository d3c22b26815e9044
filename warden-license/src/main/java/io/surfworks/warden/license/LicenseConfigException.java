package io.surfworks.warden.license;

/**
 * The license source or build date is missing or unusable.
 */
public class LicenseConfigException extends LicenseException {

    public LicenseConfigException(String message) {
        super(message, ErrorCode.CONFIG);
    }

    public LicenseConfigException(String message, Throwable cause) {
        super(message, ErrorCode.CONFIG, cause);
    }

    public static LicenseConfigException missingLicense() {
        return new LicenseConfigException(
            "failed to read license: license is missing. To add a license, configure \""
                + LicenseConfig.LICENSE_PATH_SETTING + "\" in your server configuration file, use the "
                + LicenseConfig.ENV_LICENSE + " environment variable, or use the "
                + LicenseConfig.ENV_LICENSE_PATH + " environment variable.");
    }

    public static LicenseConfigException unsetBuildDate() {
        return new LicenseConfigException("error unset build date");
    }
}
