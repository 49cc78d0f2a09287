package com.questrail.microgrid.api;

/**
 * Kind of power setpoint.
 * <ul>
 *   <li>{@link #ACTIVE}: watts; negative discharges, positive charges.</li>
 *   <li>{@link #REACTIVE}: VAr; positive inductive, negative capacitive (IEEE 1459-2010).</li>
 * </ul>
 */
public enum PowerKind
{
    ACTIVE(Metric.AC_POWER_ACTIVE),
    REACTIVE(Metric.AC_POWER_REACTIVE);

    private final Metric metric;

    PowerKind(Metric metric) {
        this.metric = metric;
    }

    /**
     * The measured metric corresponding to this setpoint kind.
     */
    public Metric metric() {
        return metric;
    }
}
