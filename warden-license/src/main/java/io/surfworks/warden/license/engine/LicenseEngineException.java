package io.surfworks.warden.license.engine;

/**
 * Exception raised by the validation engine.
 */
public class LicenseEngineException extends RuntimeException {

    private final Reason reason;

    public LicenseEngineException(String message) {
        this(message, Reason.UNKNOWN);
    }

    public LicenseEngineException(String message, Reason reason) {
        super(message);
        this.reason = reason;
    }

    public LicenseEngineException(String message, Reason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Why the engine rejected a license.
     */
    public enum Reason {
        /** Unknown or unclassified error */
        UNKNOWN,

        /** Malformed blob or bad signature */
        INVALID,

        /** Past the expiration time */
        EXPIRED,

        /** Past the termination time */
        TERMINATED,

        /** Before the start time */
        NOT_YET_VALID,

        /** The engine could not store the license */
        PERSISTENCE
    }

    public static LicenseEngineException invalid(String detail) {
        return new LicenseEngineException("invalid license: " + detail, Reason.INVALID);
    }

    public static LicenseEngineException expired(String licenseId) {
        return new LicenseEngineException("license " + licenseId + " has expired", Reason.EXPIRED);
    }

    public static LicenseEngineException terminated(String licenseId) {
        return new LicenseEngineException("license " + licenseId + " has been terminated", Reason.TERMINATED);
    }
}
