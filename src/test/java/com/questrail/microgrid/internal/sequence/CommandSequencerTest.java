package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ControlErrorCode;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.api.PowerKind;
import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.ComponentUnreachableException;
import com.questrail.microgrid.driver.DriverException;
import com.questrail.microgrid.driver.FakeComponentDriver;
import com.questrail.microgrid.driver.HardwareState;
import com.questrail.microgrid.driver.RelayPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandSequencerTest {

    private static final ComponentId INVERTER = ComponentId.of(1);
    private static final ComponentId BATTERY = ComponentId.of(2);
    private static final ComponentId PRECHARGER = ComponentId.of(3);
    private static final ComponentId AC_ONLY_INVERTER = ComponentId.of(4);

    private FakeComponentDriver driver;
    private CommandSequencer sequencer;
    private List<HardwareState> confirmed;

    @BeforeEach
    void setUp() {
        driver = new FakeComponentDriver()
                .addInverter(INVERTER)
                .addBattery(BATTERY)
                .addPrechargeModule(PRECHARGER)
                .add(AC_ONLY_INVERTER, ComponentFeatures.builder().withAcRelay(true).build());
        sequencer = new CommandSequencer(driver);
        confirmed = new ArrayList<>();
    }

    private SequenceResult run(ComponentId id, ComponentCategory category, Transition transition) {
        ActionPlan plan = ActionPlans.lookup(category, transition).orElseThrow();
        return sequencer.execute(id, driver.features(id), plan, confirmed::add);
    }

    @Test
    void inverterStartClosesDcThenAc() {
        SequenceResult result = run(INVERTER, ComponentCategory.INVERTER, Transition.START);

        assertEquals(List.of("setRelay(component#1, DC=closed)", "setRelay(component#1, AC=closed)"),
                driver.commandLog());
        assertEquals(List.of("close-dc-relay", "close-ac-relay"), result.executed());
        assertEquals(List.of("set-power-zero"), result.skipped());
        assertTrue(result.settled());
        assertEquals(RelayPosition.CLOSED, result.hardware().acRelay());
    }

    @Test
    void inverterStartDrivesResidualPowerToZero() {
        driver.setHardware(INVERTER, driver.hardware(INVERTER).withPower(PowerKind.ACTIVE, 250));

        run(INVERTER, ComponentCategory.INVERTER, Transition.START);

        assertEquals("setPower(component#1, ACTIVE=0.0)", driver.commandLog().get(2));
        assertEquals(3, driver.commands().size());
    }

    @Test
    void inverterWithoutDcRelaySkipsTheDcStep() {
        SequenceResult result = run(AC_ONLY_INVERTER, ComponentCategory.INVERTER, Transition.START);

        assertEquals(List.of("setRelay(component#4, AC=closed)"), driver.commandLog());
        assertTrue(result.skipped().contains("close-dc-relay"));
    }

    @Test
    void everyConfirmedSnapshotIsReported() {
        run(INVERTER, ComponentCategory.INVERTER, Transition.START);

        // initial read plus one read per executed step
        assertEquals(3, confirmed.size());
        assertEquals(RelayPosition.OPEN, confirmed.get(0).dcRelay());
        assertEquals(RelayPosition.CLOSED, confirmed.get(1).dcRelay());
    }

    @Test
    void inverterStandbyRequiresClosedRelays() {
        driver.setHardware(INVERTER, new HardwareState(RelayPosition.OPEN, RelayPosition.CLOSED, 100, 0, false));

        ControlException ex = assertThrows(ControlException.class,
                () -> run(INVERTER, ComponentCategory.INVERTER, Transition.STANDBY));

        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ex.code());
        assertEquals("verify-ac-relay-closed", ex.failedStep().orElseThrow());
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void inverterStandbyFromOperational() {
        driver.setHardware(INVERTER, new HardwareState(RelayPosition.CLOSED, RelayPosition.CLOSED, 300, -20, false));

        run(INVERTER, ComponentCategory.INVERTER, Transition.STANDBY);

        assertEquals(List.of(
                "setPower(component#1, ACTIVE=0.0)",
                "setPower(component#1, REACTIVE=0.0)",
                "setRelay(component#1, AC=open)"), driver.commandLog());
        assertEquals(RelayPosition.CLOSED, driver.hardware(INVERTER).dcRelay());
    }

    @Test
    void inverterStopFromStandbySkipsTheStandbyChecks() {
        driver.setHardware(INVERTER, new HardwareState(RelayPosition.OPEN, RelayPosition.CLOSED, 0, 0, false));

        SequenceResult result = run(INVERTER, ComponentCategory.INVERTER, Transition.STOP);

        assertEquals(List.of("setRelay(component#1, DC=open)"), driver.commandLog());
        assertTrue(result.skipped().containsAll(List.of("verify-ac-relay-closed", "verify-dc-relay-closed")));
    }

    @Test
    void batteryStopWithPowerFlowingIsRejectedWithoutRelayCalls() {
        driver.setHardware(BATTERY, new HardwareState(RelayPosition.ABSENT, RelayPosition.CLOSED, 1500, 0, false));

        ControlException ex = assertThrows(ControlException.class,
                () -> run(BATTERY, ComponentCategory.BATTERY, Transition.STOP));

        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ex.code());
        assertEquals("verify-power-zero", ex.failedStep().orElseThrow());
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void batteryStopChecksPowerEvenWhenDcIsAlreadyOpen() {
        driver.setHardware(BATTERY, new HardwareState(RelayPosition.ABSENT, RelayPosition.OPEN, 1500, 0, false));

        ControlException ex = assertThrows(ControlException.class,
                () -> run(BATTERY, ComponentCategory.BATTERY, Transition.STOP));

        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ex.code());
        assertEquals("verify-power-zero", ex.failedStep().orElseThrow());
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void batteryStopAlreadyOpenAndIdleSucceedsWithoutCommands() {
        driver.setHardware(BATTERY, new HardwareState(RelayPosition.ABSENT, RelayPosition.OPEN, 0, 0, false));

        SequenceResult result = run(BATTERY, ComponentCategory.BATTERY, Transition.STOP);

        assertTrue(result.executed().isEmpty());
        assertTrue(result.powerAtZero());
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void prechargeLeavesPlanUnsettledUntilDcCloses() {
        SequenceResult result = run(PRECHARGER, ComponentCategory.PRECHARGE_MODULE, Transition.START);

        assertEquals(List.of("beginPrecharge(component#3)"), driver.commandLog());
        assertFalse(result.settled());

        driver.clear();
        SequenceResult again = run(PRECHARGER, ComponentCategory.PRECHARGE_MODULE, Transition.START);
        assertTrue(driver.commands().isEmpty(), "precharge in flight must not be restarted");
        assertFalse(again.settled());
    }

    @Test
    void prechargePlanNeedsThePrechargeCapability() {
        ControlException ex = assertThrows(ControlException.class,
                () -> run(BATTERY, ComponentCategory.PRECHARGE_MODULE, Transition.START));

        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ex.code());
        assertEquals("begin-precharge", ex.failedStep().orElseThrow());
    }

    @Test
    void failedStepIsNamedAndEarlierStepsStayApplied() {
        driver.failNext("setRelay(component#1, AC=closed)", new DriverException("contactor stuck"));

        ControlException ex = assertThrows(ControlException.class,
                () -> run(INVERTER, ComponentCategory.INVERTER, Transition.START));

        assertEquals(ControlErrorCode.DRIVER_ERROR, ex.code());
        assertEquals("close-ac-relay", ex.failedStep().orElseThrow());
        assertEquals(RelayPosition.CLOSED, driver.hardware(INVERTER).dcRelay());
        assertEquals(RelayPosition.CLOSED, confirmed.get(confirmed.size() - 1).dcRelay());

        driver.clear();
        run(INVERTER, ComponentCategory.INVERTER, Transition.START);
        assertEquals(List.of("setRelay(component#1, AC=closed)"), driver.commandLog(), "retry resumes at the failed step");
    }

    @Test
    void unreachableDuringReadIsUnavailable() {
        driver.setUnreachable(INVERTER, true);

        ControlException ex = assertThrows(ControlException.class,
                () -> run(INVERTER, ComponentCategory.INVERTER, Transition.START));

        assertEquals(ControlErrorCode.UNAVAILABLE, ex.code());
        assertEquals("read-hardware-state", ex.failedStep().orElseThrow());
        assertInstanceOf(ComponentUnreachableException.class, ex.getCause());
    }
}
