package io.surfworks.warden.license;

/**
 * A license blob failed validation, persistence or conversion.
 *
 * <p>The cause is the underlying engine or conversion error.
 */
public class LicenseValidationException extends LicenseException {

    public LicenseValidationException(String message, Throwable cause) {
        super(cause.getMessage() != null ? message + ": " + cause.getMessage() : message, ErrorCode.VALIDATION, cause);
    }
}
