package io.surfworks.warden.license;

/**
 * Base exception for license watcher failures.
 */
public class LicenseException extends RuntimeException {

    private final ErrorCode errorCode;

    public LicenseException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LicenseException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * License error codes.
     */
    public enum ErrorCode {
        /** No usable license source or build date */
        CONFIG,

        /** The engine rejected the license */
        VALIDATION,

        /** The current license does not grant a feature */
        UNLICENSED_FEATURE
    }
}
