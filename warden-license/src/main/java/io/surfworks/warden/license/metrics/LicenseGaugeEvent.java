package io.surfworks.warden.license.metrics;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event carrying a license gauge sample.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseGaugeEvent event = new LicenseGaugeEvent();
 * event.key = "license.expiration_time_epoch";
 * event.value = expiration.getEpochSecond();
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.warden.LicenseGauge")
@Label("License Gauge")
@Category({"Warden", "License"})
@Description("Periodic gauge sample emitted by the license monitor")
public class LicenseGaugeEvent extends Event {

    @Label("Key")
    @Description("Dotted metric key")
    public String key;

    @Label("Value")
    @Description("Gauge value")
    public double value;
}
