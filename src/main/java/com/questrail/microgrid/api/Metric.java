package com.questrail.microgrid.api;

import java.util.Optional;

/**
 * Metric
 * -----------------------------------------------------------------------------
 * Measured quantities on which inclusion bounds may be placed.
 *
 * <p>Power metrics are special: a value of exactly zero is always considered in
 * range regardless of configured bounds, so any component may always be
 * brought to rest.</p>
 */
public enum Metric
{
    DC_VOLTAGE(false),
    DC_CURRENT(false),
    DC_POWER(true),
    AC_FREQUENCY(false),
    AC_VOLTAGE(false),
    AC_CURRENT(false),
    AC_POWER_APPARENT(true),
    AC_POWER_ACTIVE(true),
    AC_POWER_REACTIVE(true),
    BATTERY_SOC_PCT(false),
    BATTERY_CAPACITY(false),
    BATTERY_TEMPERATURE(false);

    private final boolean power;

    Metric(boolean power) {
        this.power = power;
    }

    public boolean isPowerMetric() {
        return power;
    }

    /**
     * The setpoint kind that drives this metric, if any.
     */
    public Optional<PowerKind> powerKind() {
        if (this == AC_POWER_ACTIVE) {
            return Optional.of(PowerKind.ACTIVE);
        }
        if (this == AC_POWER_REACTIVE) {
            return Optional.of(PowerKind.REACTIVE);
        }
        return Optional.empty();
    }
}
