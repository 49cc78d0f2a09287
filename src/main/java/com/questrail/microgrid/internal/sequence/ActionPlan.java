package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.HardwareState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ActionPlan
 * -----------------------------------------------------------------------------
 * Ordered, named list of idempotent steps realizing one lifecycle
 * {@link Transition} for one {@link ComponentCategory}.
 *
 * <p>Plans are immutable and live in the static {@link ActionPlans} table.</p>
 */
public final class ActionPlan
{
    private final ComponentCategory category;
    private final Transition transition;
    private final List<ActionStep> steps;

    ActionPlan(ComponentCategory category, Transition transition, List<ActionStep> steps) {
        this.category = Objects.requireNonNull(category, "category");
        this.transition = Objects.requireNonNull(transition, "transition");
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public ComponentCategory category() {
        return category;
    }

    public Transition transition() {
        return transition;
    }

    public List<ActionStep> steps() {
        return steps;
    }

    public String name() {
        return category + "/" + transition;
    }

    /**
     * The action steps protected by the verify step at {@code index}: the next
     * {@code guards} non-verify steps after it.
     */
    public List<ActionStep> guardedBy(int index) {
        ActionStep verify = steps.get(index);
        List<ActionStep> guarded = new ArrayList<>(verify.guards());
        for (int i = index + 1; i < steps.size() && guarded.size() < verify.guards(); i++) {
            if (!steps.get(i).isVerify()) {
                guarded.add(steps.get(i));
            }
        }
        return guarded;
    }

    /**
     * Whether the plan drives or requires the component's power output to be
     * zero. Callers still check {@link SequenceResult#powerAtZero()} before
     * treating the output as zeroed.
     */
    public boolean resetsPower() {
        return steps.stream().anyMatch(s -> s.kind() == StepKind.SET_POWER_ZERO
                || s.kind() == StepKind.VERIFY_POWER_ZERO);
    }

    /**
     * Whether every applicable asynchronous step has settled in {@code hw}.
     */
    public boolean isSettled(HardwareState hw, ComponentFeatures features) {
        return steps.stream()
                .filter(ActionStep::isAsynchronous)
                .filter(s -> s.isApplicable(features))
                .allMatch(s -> s.isSettled(hw));
    }

    @Override
    public String toString() {
        return name() + steps.stream().map(ActionStep::name).toList();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    static Builder of(ComponentCategory category, Transition transition) {
        return new Builder(category, transition);
    }

    static final class Builder {
        private final ComponentCategory category;
        private final Transition transition;
        private final List<ActionStep> steps = new ArrayList<>();

        private Builder(ComponentCategory category, Transition transition) {
            this.category = category;
            this.transition = transition;
        }

        Builder then(ActionStep step) {
            steps.add(Objects.requireNonNull(step, "step"));
            return this;
        }

        /**
         * Appends every step of another plan, in order.
         */
        Builder thenAll(ActionPlan plan) {
            steps.addAll(plan.steps());
            return this;
        }

        ActionPlan build() {
            return new ActionPlan(category, transition, steps);
        }
    }
}
