package io.surfworks.warden.license.metrics;

import java.util.List;

/**
 * {@link MetricsSink} that records gauges as {@link LicenseGaugeEvent}s.
 */
public class JfrMetricsSink implements MetricsSink {

    @Override
    public void setGauge(List<String> key, double value) {
        LicenseGaugeEvent event = new LicenseGaugeEvent();
        if (!event.isEnabled()) {
            return;
        }
        event.key = String.join(".", key);
        event.value = value;
        event.commit();
    }
}
