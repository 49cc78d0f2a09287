package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.driver.HardwareState;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successfully executed {@link ActionPlan}.
 *
 * @param hardware  last confirmed hardware snapshot
 * @param executed  names of the steps that issued a driver command
 * @param skipped   names of the steps skipped as satisfied or not applicable
 * @param settled   {@code false} if an asynchronous step is still in flight
 */
public record SequenceResult(HardwareState hardware,
                             List<String> executed,
                             List<String> skipped,
                             boolean settled)
{
    public SequenceResult {
        Objects.requireNonNull(hardware, "hardware");
        executed = List.copyOf(executed);
        skipped = List.copyOf(skipped);
    }

    /**
     * Whether the last confirmed snapshot shows zero active and reactive power.
     */
    public boolean powerAtZero() {
        return hardware.activePower() == 0.0 && hardware.reactivePower() == 0.0;
    }
}
