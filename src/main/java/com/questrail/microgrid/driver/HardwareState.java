package com.questrail.microgrid.driver;

import com.questrail.microgrid.api.PowerKind;

import java.util.Objects;

/**
 * HardwareState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a component's hardware substates, as reported by its
 * driver.
 *
 * <p>It contains no behavior beyond small helpers; the command sequencer reads
 * it to decide which plan steps are already satisfied.</p>
 */
public record HardwareState(RelayPosition acRelay,
                            RelayPosition dcRelay,
                            double activePower,
                            double reactivePower,
                            boolean prechargeInProgress)
{
    public HardwareState {
        Objects.requireNonNull(acRelay, "acRelay");
        Objects.requireNonNull(dcRelay, "dcRelay");
    }

    /**
     * Snapshot used before a component has reported anything.
     */
    public static HardwareState unknown() {
        return new HardwareState(RelayPosition.ABSENT, RelayPosition.ABSENT, 0.0, 0.0, false);
    }

    public RelayPosition relay(RelayKind kind) {
        return kind == RelayKind.AC ? acRelay : dcRelay;
    }

    public double power(PowerKind kind) {
        return kind == PowerKind.ACTIVE ? activePower : reactivePower;
    }

    // ---------------------------------------------------------------------
    // State transition helpers
    // ---------------------------------------------------------------------

    public HardwareState withRelay(RelayKind kind, RelayPosition position) {
        return kind == RelayKind.AC
                ? new HardwareState(position, dcRelay, activePower, reactivePower, prechargeInProgress)
                : new HardwareState(acRelay, position, activePower, reactivePower, prechargeInProgress);
    }

    public HardwareState withPower(PowerKind kind, double power) {
        return kind == PowerKind.ACTIVE
                ? new HardwareState(acRelay, dcRelay, power, reactivePower, prechargeInProgress)
                : new HardwareState(acRelay, dcRelay, activePower, power, prechargeInProgress);
    }

    public HardwareState withPrechargeInProgress(boolean inProgress) {
        return new HardwareState(acRelay, dcRelay, activePower, reactivePower, inProgress);
    }
}
