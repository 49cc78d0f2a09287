package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.HardwareState;
import com.questrail.microgrid.driver.RelayKind;
import com.questrail.microgrid.driver.RelayPosition;

import java.util.Objects;

/**
 * ActionStep
 * -----------------------------------------------------------------------------
 * Tagged descriptor of one step in an {@link ActionPlan}.
 *
 * <p>A step is idempotent: {@link #isSatisfied(HardwareState)} tells whether its
 * effect is already visible in the hardware, in which case the sequencer skips
 * it without issuing a driver call.</p>
 *
 * @param name          stable name surfaced in errors ("close-dc-relay", ...)
 * @param kind          what the step does
 * @param relay         relay targeted by relay steps, {@code null} otherwise
 * @param requires      capability the step depends on
 * @param skipIfAbsent  skip the step when the capability is missing; otherwise
 *                      the missing capability fails the plan
 * @param guards        for verify steps: how many following action steps the
 *                      check protects
 */
public record ActionStep(String name,
                         StepKind kind,
                         RelayKind relay,
                         Capability requires,
                         boolean skipIfAbsent,
                         int guards)
{
    public ActionStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requires, "requires");
        if (guards < 0 || (guards > 0 && !kind.isVerify())) {
            throw new IllegalArgumentException("only verify steps may guard other steps: " + name);
        }
        boolean relayStep = kind == StepKind.CLOSE_RELAY
                || kind == StepKind.OPEN_RELAY
                || kind == StepKind.VERIFY_RELAY_CLOSED;
        if (relayStep != (relay != null)) {
            throw new IllegalArgumentException("relay must be given exactly for relay steps: " + name);
        }
    }

    public boolean isVerify() {
        return kind.isVerify();
    }

    /**
     * Whether this verify step may be skipped when every step it guards is
     * already satisfied. Only relay checks qualify: a power-zero check protects
     * the hardware regardless of relay positions.
     */
    public boolean isSkippableWhenGuardedDone() {
        return kind == StepKind.VERIFY_RELAY_CLOSED;
    }

    public boolean isApplicable(ComponentFeatures features) {
        return requires.presentIn(features);
    }

    /**
     * Completes only once the hardware reports back, after the plan returns.
     */
    public boolean isAsynchronous() {
        return kind == StepKind.BEGIN_PRECHARGE;
    }

    /**
     * Whether this step's effect (or, for verify steps, its condition) already
     * holds in the given snapshot.
     */
    public boolean isSatisfied(HardwareState hw) {
        return switch (kind) {
            case VERIFY_RELAY_CLOSED, CLOSE_RELAY -> hw.relay(relay) == RelayPosition.CLOSED;
            // An in-flight precharge still drives the DC side; opening aborts it.
            case OPEN_RELAY -> hw.relay(relay) != RelayPosition.CLOSED
                    && !(relay == RelayKind.DC && hw.prechargeInProgress());
            case VERIFY_POWER_ZERO, SET_POWER_ZERO -> hw.activePower() == 0.0 && hw.reactivePower() == 0.0;
            case BEGIN_PRECHARGE -> hw.dcRelay() == RelayPosition.CLOSED || hw.prechargeInProgress();
        };
    }

    /**
     * Whether the step's final effect has been observed. Differs from
     * {@link #isSatisfied} only for asynchronous steps.
     */
    public boolean isSettled(HardwareState hw) {
        if (kind == StepKind.BEGIN_PRECHARGE) {
            return hw.dcRelay() == RelayPosition.CLOSED;
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    static ActionStep closeRelay(RelayKind relay) {
        return new ActionStep("close-" + label(relay) + "-relay", StepKind.CLOSE_RELAY, relay,
                capabilityOf(relay), true, 0);
    }

    static ActionStep openRelay(RelayKind relay) {
        return new ActionStep("open-" + label(relay) + "-relay", StepKind.OPEN_RELAY, relay,
                capabilityOf(relay), true, 0);
    }

    static ActionStep verifyRelayClosed(RelayKind relay, int guards) {
        return new ActionStep("verify-" + label(relay) + "-relay-closed", StepKind.VERIFY_RELAY_CLOSED, relay,
                capabilityOf(relay), true, guards);
    }

    static ActionStep verifyPowerZero(int guards) {
        return new ActionStep("verify-power-zero", StepKind.VERIFY_POWER_ZERO, null,
                Capability.NONE, false, guards);
    }

    static ActionStep setPowerZero() {
        return new ActionStep("set-power-zero", StepKind.SET_POWER_ZERO, null,
                Capability.NONE, false, 0);
    }

    static ActionStep beginPrecharge() {
        return new ActionStep("begin-precharge", StepKind.BEGIN_PRECHARGE, null,
                Capability.PRECHARGE, false, 0);
    }

    private static Capability capabilityOf(RelayKind relay) {
        return relay == RelayKind.AC ? Capability.AC_RELAY : Capability.DC_RELAY;
    }

    private static String label(RelayKind relay) {
        return relay == RelayKind.AC ? "ac" : "dc";
    }
}
