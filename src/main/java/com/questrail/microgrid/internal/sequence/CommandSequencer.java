package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.api.PowerKind;
import com.questrail.microgrid.driver.ComponentDriver;
import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.ComponentUnreachableException;
import com.questrail.microgrid.driver.DriverException;
import com.questrail.microgrid.driver.HardwareState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * CommandSequencer
 * =============================================================================
 * Executes an {@link ActionPlan} against a component through its
 * {@link ComponentDriver}.
 *
 * <h2>Execution model</h2>
 * <ol>
 *   <li>Read the current hardware snapshot.</li>
 *   <li>Guard pass: check capabilities of non-skippable steps, then evaluate
 *       every verify step. A relay verify whose guarded steps are all already
 *       satisfied is skipped; a power-zero verify is always evaluated. A failed
 *       check raises {@code PRECONDITION_FAILED}. No command has been issued
 *       at this point.</li>
 *   <li>Action pass: in order, skip steps that are not applicable or already
 *       satisfied; otherwise issue the step's driver command and re-read the
 *       snapshot to confirm it.</li>
 * </ol>
 *
 * <h2>Partial success</h2>
 * A failing driver call aborts the remaining steps and surfaces as
 * {@code DRIVER_ERROR} (or {@code UNAVAILABLE}) naming the step. Completed
 * steps are not rolled back; every confirmed snapshot is handed to the
 * caller's {@code onConfirmed} callback, so the caller's record reflects the
 * last confirmed step. Because each step is idempotent, repeating the command
 * resumes where the failure happened.
 *
 * <h2>Threading</h2>
 * The sequencer is stateless. Callers hold the component's lock.
 */
public final class CommandSequencer
{
    private static final Logger log = LoggerFactory.getLogger(CommandSequencer.class);

    private static final String READ_STEP = "read-hardware-state";

    private final ComponentDriver driver;

    public CommandSequencer(ComponentDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    /**
     * Runs {@code plan} for component {@code id}.
     *
     * @param onConfirmed receives every hardware snapshot read during execution
     * @throws ControlException on a failed guard or driver call
     */
    public SequenceResult execute(ComponentId id,
                                  ComponentFeatures features,
                                  ActionPlan plan,
                                  Consumer<HardwareState> onConfirmed) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(features, "features");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(onConfirmed, "onConfirmed");

        HardwareState hw = read(id, READ_STEP);
        onConfirmed.accept(hw);

        List<String> skipped = new ArrayList<>();
        checkGuards(id, features, plan, hw, skipped);

        List<String> executed = new ArrayList<>();
        for (ActionStep step : plan.steps()) {
            if (step.isVerify()) {
                continue;
            }
            if (!step.isApplicable(features) || step.isSatisfied(hw)) {
                skipped.add(step.name());
                continue;
            }

            log.debug("{}: {} step {}", id, plan.name(), step.name());
            issue(id, step, hw);
            executed.add(step.name());

            hw = read(id, step.name());
            onConfirmed.accept(hw);
        }

        boolean settled = plan.isSettled(hw, features);
        return new SequenceResult(hw, executed, skipped, settled);
    }

    private void checkGuards(ComponentId id,
                             ComponentFeatures features,
                             ActionPlan plan,
                             HardwareState hw,
                             List<String> skipped) {
        List<ActionStep> steps = plan.steps();
        for (int i = 0; i < steps.size(); i++) {
            ActionStep step = steps.get(i);

            if (!step.isApplicable(features)) {
                if (!step.skipIfAbsent()) {
                    throw ControlException.preconditionFailed(id, step.name(),
                            id + " lacks " + step.requires() + " required by " + plan.name());
                }
                continue;
            }
            if (!step.isVerify()) {
                continue;
            }

            if (step.isSkippableWhenGuardedDone() && isGuardedDone(plan, i, features, hw)) {
                skipped.add(step.name());
                continue;
            }
            if (!step.isSatisfied(hw)) {
                throw ControlException.preconditionFailed(id, step.name(),
                        plan.name() + " precondition " + step.name() + " not met on " + id + ": " + hw);
            }
        }
    }

    private static boolean isGuardedDone(ActionPlan plan, int index, ComponentFeatures features, HardwareState hw) {
        return plan.guardedBy(index).stream()
                .allMatch(g -> !g.isApplicable(features) || g.isSatisfied(hw));
    }

    private void issue(ComponentId id, ActionStep step, HardwareState hw) {
        try {
            switch (step.kind()) {
                case CLOSE_RELAY -> driver.setRelay(id, step.relay(), true);
                case OPEN_RELAY -> driver.setRelay(id, step.relay(), false);
                case SET_POWER_ZERO -> {
                    for (PowerKind kind : PowerKind.values()) {
                        if (hw.power(kind) != 0.0) {
                            driver.setPower(id, kind, 0.0);
                        }
                    }
                }
                case BEGIN_PRECHARGE -> driver.beginPrecharge(id);
                default -> throw new IllegalStateException("not an action step: " + step);
            }
        } catch (DriverException e) {
            throw translate(id, step.name(), e);
        }
    }

    private HardwareState read(ComponentId id, String stepName) {
        try {
            return Objects.requireNonNull(driver.hardwareState(id), "hardwareState");
        } catch (DriverException e) {
            throw translate(id, stepName, e);
        }
    }

    private static ControlException translate(ComponentId id, String stepName, DriverException e) {
        if (e instanceof ComponentUnreachableException) {
            return ControlException.unavailable(id, stepName, id + " unreachable during " + stepName, e);
        }
        return ControlException.driverError(id, stepName, "step " + stepName + " failed on " + id + ": " + e.getMessage(), e);
    }
}
