package io.surfworks.warden.license;

/**
 * The current license does not grant a feature.
 */
public class UnlicensedFeatureException extends LicenseException {

    private final Feature feature;

    public UnlicensedFeatureException(Feature feature) {
        super("Feature \"" + feature.getDisplayName() + "\" is unlicensed", ErrorCode.UNLICENSED_FEATURE);
        this.feature = feature;
    }

    public Feature feature() {
        return feature;
    }
}
