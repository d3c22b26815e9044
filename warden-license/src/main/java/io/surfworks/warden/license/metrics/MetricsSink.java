package io.surfworks.warden.license.metrics;

import java.util.List;

/**
 * Destination for license metrics.
 */
@FunctionalInterface
public interface MetricsSink {

    /**
     * Record the current value of a gauge.
     *
     * @param key metric key segments, e.g. {@code ["license", "expiration_time_epoch"]}
     * @param value gauge value
     */
    void setGauge(List<String> key, double value);
}
