package com.questrail.microgrid.driver;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.Metric;

/**
 * Inbound seam through which drivers push asynchronous reports into the
 * control plane.
 */
public interface ComponentTelemetryListener
{
    /**
     * A fresh hardware snapshot. Settles pending transitions such as precharge.
     */
    void onHardwareState(ComponentId id, HardwareState state);

    /**
     * A measured metric sample.
     *
     * @return {@code true} if the value lies within the active inclusion bounds
     */
    boolean onMetricSample(ComponentId id, Metric metric, double value);

    /**
     * The component changed its error condition.
     */
    void onErrorReported(ComponentId id, ErrorState errorState);
}
