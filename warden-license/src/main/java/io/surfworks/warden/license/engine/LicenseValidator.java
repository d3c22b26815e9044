package io.surfworks.warden.license.engine;

/**
 * Validates a license blob: signature, format and time bounds.
 *
 * <p>Implementations are supplied by the host and are typically bound to
 * the build date of the running binary.
 */
@FunctionalInterface
public interface LicenseValidator {

    /**
     * Validate a license blob.
     *
     * @param blob the raw license text
     * @return the validated license
     * @throws LicenseEngineException if the blob is not a currently valid license
     */
    EngineLicense validate(String blob);
}
