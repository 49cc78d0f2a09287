package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentState;
import com.questrail.microgrid.driver.RelayKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.questrail.microgrid.internal.sequence.ActionStep.beginPrecharge;
import static com.questrail.microgrid.internal.sequence.ActionStep.closeRelay;
import static com.questrail.microgrid.internal.sequence.ActionStep.openRelay;
import static com.questrail.microgrid.internal.sequence.ActionStep.setPowerZero;
import static com.questrail.microgrid.internal.sequence.ActionStep.verifyPowerZero;
import static com.questrail.microgrid.internal.sequence.ActionStep.verifyRelayClosed;

/**
 * ActionPlans
 * =============================================================================
 * Static table mapping (category, transition) to its {@link ActionPlan}.
 *
 * <pre>
 *   INVERTER         START    close DC (if present) → close AC → set power 0
 *   INVERTER         STANDBY  verify AC+DC closed → set power 0 → open AC
 *   INVERTER         STOP     STANDBY plan → open DC
 *   BATTERY          START    close DC
 *   BATTERY          STOP     verify power 0 → open DC
 *   RELAY            START    close relay
 *   RELAY            STOP     open relay
 *   PRECHARGE_MODULE START    begin precharge (completion closes DC)
 *   PRECHARGE_MODULE STOP     open DC
 * </pre>
 *
 * Pairs missing from the table are unsupported. The table is built once at
 * class initialization and never changes.
 */
public final class ActionPlans
{
    private static final Map<ComponentCategory, Map<Transition, ActionPlan>> PLANS;
    private static final Map<ComponentCategory, ComponentState> RECOVERY;

    static {
        Map<ComponentCategory, Map<Transition, ActionPlan>> plans = new EnumMap<>(ComponentCategory.class);

        ActionPlan inverterStandby = ActionPlan.of(ComponentCategory.INVERTER, Transition.STANDBY)
                .then(verifyRelayClosed(RelayKind.AC, 2))
                .then(verifyRelayClosed(RelayKind.DC, 2))
                .then(setPowerZero())
                .then(openRelay(RelayKind.AC))
                .build();

        register(plans, ActionPlan.of(ComponentCategory.INVERTER, Transition.START)
                .then(closeRelay(RelayKind.DC))
                .then(closeRelay(RelayKind.AC))
                .then(setPowerZero())
                .build());
        register(plans, inverterStandby);
        register(plans, ActionPlan.of(ComponentCategory.INVERTER, Transition.STOP)
                .thenAll(inverterStandby)
                .then(openRelay(RelayKind.DC))
                .build());

        register(plans, ActionPlan.of(ComponentCategory.BATTERY, Transition.START)
                .then(closeRelay(RelayKind.DC))
                .build());
        register(plans, ActionPlan.of(ComponentCategory.BATTERY, Transition.STOP)
                .then(verifyPowerZero(1))
                .then(openRelay(RelayKind.DC))
                .build());

        // A standalone relay reports its contact on whichever side it switches.
        register(plans, ActionPlan.of(ComponentCategory.RELAY, Transition.START)
                .then(closeRelay(RelayKind.AC))
                .then(closeRelay(RelayKind.DC))
                .build());
        register(plans, ActionPlan.of(ComponentCategory.RELAY, Transition.STOP)
                .then(openRelay(RelayKind.AC))
                .then(openRelay(RelayKind.DC))
                .build());

        register(plans, ActionPlan.of(ComponentCategory.PRECHARGE_MODULE, Transition.START)
                .then(beginPrecharge())
                .build());
        register(plans, ActionPlan.of(ComponentCategory.PRECHARGE_MODULE, Transition.STOP)
                .then(openRelay(RelayKind.DC))
                .build());

        PLANS = Collections.unmodifiableMap(plans);

        Map<ComponentCategory, ComponentState> recovery = new EnumMap<>(ComponentCategory.class);
        for (ComponentCategory c : ComponentCategory.values()) {
            recovery.put(c, ComponentState.STOPPED);
        }
        // Inverters recover into cold standby.
        recovery.put(ComponentCategory.INVERTER, ComponentState.STANDBY);
        RECOVERY = Collections.unmodifiableMap(recovery);
    }

    private ActionPlans() {}

    public static Optional<ActionPlan> lookup(ComponentCategory category, Transition transition) {
        Map<Transition, ActionPlan> byTransition = PLANS.get(category);
        return byTransition == null ? Optional.empty() : Optional.ofNullable(byTransition.get(transition));
    }

    /**
     * State a component of {@code category} lands in after its error is acknowledged.
     */
    public static ComponentState recoveryState(ComponentCategory category) {
        return RECOVERY.get(category);
    }

    private static void register(Map<ComponentCategory, Map<Transition, ActionPlan>> plans, ActionPlan plan) {
        plans.computeIfAbsent(plan.category(), c -> new EnumMap<>(Transition.class))
                .put(plan.transition(), plan);
    }
}
