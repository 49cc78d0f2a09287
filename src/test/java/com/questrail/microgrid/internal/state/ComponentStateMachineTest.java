package com.questrail.microgrid.internal.state;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ComponentState;
import com.questrail.microgrid.api.ComponentStatus;
import com.questrail.microgrid.api.ControlErrorCode;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.api.PowerKind;
import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.DriverException;
import com.questrail.microgrid.driver.ErrorState;
import com.questrail.microgrid.driver.FakeComponentDriver;
import com.questrail.microgrid.driver.RelayKind;
import com.questrail.microgrid.driver.RelayPosition;
import com.questrail.microgrid.internal.exec.ComponentLocks;
import com.questrail.microgrid.internal.sequence.CommandSequencer;
import com.questrail.microgrid.observability.ComponentTransitionEvent;
import com.questrail.microgrid.observability.RecordingObservabilitySink;
import com.questrail.microgrid.time.ManualMonotonicClock;
import com.questrail.microgrid.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ComponentStateMachineTest
 * -----------------------------------------------------------------------------
 * Lifecycle transitions against a fake driver.
 */
class ComponentStateMachineTest {

    private static final ComponentId INVERTER = ComponentId.of(1);
    private static final ComponentId BATTERY = ComponentId.of(2);
    private static final ComponentId PRECHARGER = ComponentId.of(3);
    private static final ComponentId METER = ComponentId.of(4);

    private FakeComponentDriver driver;
    private RecordingObservabilitySink sink;
    private List<ComponentId> powerResets;
    private ComponentLocks locks;
    private ComponentStateMachine machine;

    @BeforeEach
    void setUp() {
        driver = new FakeComponentDriver()
                .addInverter(INVERTER)
                .addBattery(BATTERY)
                .addPrechargeModule(PRECHARGER)
                .add(METER, ComponentFeatures.builder().build());
        sink = new RecordingObservabilitySink();
        powerResets = new ArrayList<>();
        locks = new ComponentLocks();

        machine = new ComponentStateMachine(
                new ComponentRegistry(),
                locks,
                new CommandSequencer(driver),
                driver,
                new ManualWallClock(new ManualMonotonicClock()),
                sink,
                powerResets::add);

        machine.register(INVERTER, ComponentCategory.INVERTER);
        machine.register(BATTERY, ComponentCategory.BATTERY);
        machine.register(PRECHARGER, ComponentCategory.PRECHARGE_MODULE);
        machine.register(METER, ComponentCategory.OTHER);
        driver.clear();
    }

    private ComponentState state(ComponentId id) {
        return machine.record(id).state();
    }

    private static ControlErrorCode codeOf(Runnable action) {
        return assertThrows(ControlException.class, action::run).code();
    }

    // ---------------------------------------------------------------------
    // Start / standby / stop
    // ---------------------------------------------------------------------

    @Test
    void secondStartOnInverterMakesNoDriverCalls() {
        driver.setHardware(INVERTER, driver.hardware(INVERTER).withPower(PowerKind.ACTIVE, 40));

        machine.start(INVERTER);
        assertEquals(List.of(
                "setRelay(component#1, DC=closed)",
                "setRelay(component#1, AC=closed)",
                "setPower(component#1, ACTIVE=0.0)"), driver.commandLog());
        assertEquals(ComponentState.OPERATIONAL, state(INVERTER));

        driver.clear();
        machine.start(INVERTER);

        assertEquals(0, driver.totalCalls());
        assertEquals(ComponentState.OPERATIONAL, state(INVERTER));
    }

    @Test
    void startStandbyStopWalkThroughTheLifecycle() {
        machine.start(INVERTER);
        machine.standby(INVERTER);
        assertEquals(ComponentState.STANDBY, state(INVERTER));
        assertEquals(RelayPosition.OPEN, driver.hardware(INVERTER).acRelay());
        assertEquals(RelayPosition.CLOSED, driver.hardware(INVERTER).dcRelay());

        machine.stop(INVERTER);
        assertEquals(ComponentState.STOPPED, state(INVERTER));
        assertEquals(RelayPosition.OPEN, driver.hardware(INVERTER).dcRelay());

        List<ComponentTransitionEvent> transitions = sink.getStateTransitions();
        assertEquals(3, transitions.size());
        assertEquals(ComponentState.STANDBY, transitions.get(2).oldState());
        assertEquals(ComponentState.STOPPED, transitions.get(2).newState());
    }

    @Test
    void plansThatZeroPowerResetTheWatchdog() {
        machine.start(INVERTER);
        machine.stop(INVERTER);
        machine.start(BATTERY);

        assertEquals(List.of(INVERTER, INVERTER), powerResets);
    }

    @Test
    void standbyFromStoppedIsInvalidState() {
        machine.stop(INVERTER);

        assertEquals(ControlErrorCode.INVALID_STATE, codeOf(() -> machine.standby(INVERTER)));
    }

    @Test
    void stopWhenAlreadyStoppedIsANoOp() {
        machine.stop(BATTERY);
        driver.clear();

        machine.stop(BATTERY);

        assertEquals(0, driver.totalCalls());
    }

    @Test
    void batteryStopWithPowerFlowingIsPreconditionFailed() {
        machine.start(BATTERY);
        driver.setHardware(BATTERY, driver.hardware(BATTERY).withPower(PowerKind.ACTIVE, -800));
        driver.clear();

        ControlException ex = assertThrows(ControlException.class, () -> machine.stop(BATTERY));

        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ex.code());
        assertTrue(driver.commands().isEmpty());
        assertEquals(ComponentState.OPERATIONAL, state(BATTERY));
    }

    @Test
    void batteryStopWithDcAlreadyOpenStillRequiresZeroPower() {
        machine.start(BATTERY);
        driver.setHardware(BATTERY, driver.hardware(BATTERY)
                .withRelay(RelayKind.DC, RelayPosition.OPEN)
                .withPower(PowerKind.ACTIVE, 500));
        machine.onHardwareState(BATTERY, driver.hardware(BATTERY));
        driver.clear();

        ControlException ex = assertThrows(ControlException.class, () -> machine.stop(BATTERY));

        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ex.code());
        assertEquals("verify-power-zero", ex.failedStep().orElseThrow());
        assertEquals(ComponentState.OPERATIONAL, state(BATTERY));
        assertTrue(powerResets.isEmpty(), "a live setpoint must keep its revert");
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void activeSetpointResumesFromStandbyOnly() {
        machine.start(INVERTER);
        machine.standby(INVERTER);
        driver.clear();

        assertTrue(machine.resumeFromStandby(INVERTER));
        assertEquals(ComponentState.OPERATIONAL, state(INVERTER));
        assertEquals(List.of("setRelay(component#1, AC=closed)"), driver.commandLog());

        driver.clear();
        assertFalse(machine.resumeFromStandby(INVERTER));
        assertFalse(machine.resumeFromStandby(BATTERY));
        assertEquals(0, driver.totalCalls());
        assertEquals(ComponentState.UNKNOWN, state(BATTERY));
    }

    @Test
    void categoriesWithoutAPlanArePreconditionFailed() {
        assertEquals(ControlErrorCode.PRECONDITION_FAILED, codeOf(() -> machine.start(METER)));
        assertEquals(ControlErrorCode.PRECONDITION_FAILED, codeOf(() -> machine.standby(BATTERY)));
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void driverFailureLeavesStateButRecordsConfirmedHardware() {
        driver.failNext("setRelay(component#1, AC=closed)", new DriverException("contactor stuck"));

        ControlException ex = assertThrows(ControlException.class, () -> machine.start(INVERTER));

        assertEquals(ControlErrorCode.DRIVER_ERROR, ex.code());
        assertEquals(ComponentState.UNKNOWN, state(INVERTER));
        assertEquals(RelayPosition.CLOSED, machine.record(INVERTER).hardware().dcRelay());

        machine.start(INVERTER);
        assertEquals(ComponentState.OPERATIONAL, state(INVERTER));
    }

    // ---------------------------------------------------------------------
    // Asynchronous precharge
    // ---------------------------------------------------------------------

    @Test
    void prechargeStaysInTransitionUntilHardwareReportsDcClosed() {
        machine.start(PRECHARGER);

        ComponentStatus status = machine.record(PRECHARGER).toStatus();
        assertTrue(status.inTransition());
        assertEquals(ComponentState.OPERATIONAL, status.pendingTarget().orElseThrow());
        assertEquals(ComponentState.UNKNOWN, status.state());

        machine.onHardwareState(PRECHARGER, driver.completePrecharge(PRECHARGER));

        ComponentStatus settled = machine.record(PRECHARGER).toStatus();
        assertFalse(settled.inTransition());
        assertEquals(ComponentState.OPERATIONAL, settled.state());
    }

    @Test
    void repeatedStartDuringPrechargeDoesNotRestartIt() {
        machine.start(PRECHARGER);
        driver.clear();

        machine.start(PRECHARGER);

        assertTrue(driver.commands().isEmpty());
        assertTrue(machine.record(PRECHARGER).toStatus().inTransition());
    }

    @Test
    void stopDuringPrechargeAbortsIt() {
        machine.start(PRECHARGER);
        driver.clear();

        machine.stop(PRECHARGER);

        assertEquals(List.of("setRelay(component#3, DC=open)"), driver.commandLog());
        assertFalse(driver.hardware(PRECHARGER).prechargeInProgress());
        ComponentStatus status = machine.record(PRECHARGER).toStatus();
        assertEquals(ComponentState.STOPPED, status.state());
        assertFalse(status.inTransition());
    }

    @Test
    void reportWithoutDcClosedKeepsTransitionPending() {
        machine.start(PRECHARGER);

        machine.onHardwareState(PRECHARGER, driver.hardware(PRECHARGER));

        assertTrue(machine.record(PRECHARGER).toStatus().inTransition());
    }

    // ---------------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------------

    @Test
    void errorReportMovesComponentToError() {
        machine.start(INVERTER);

        machine.onErrorReported(INVERTER, ErrorState.RECOVERABLE);

        assertEquals(ComponentState.ERROR, state(INVERTER));
    }

    @Test
    void ackErrorRecoversInverterToStandbyAndBatteryToStopped() {
        driver.setErrorState(INVERTER, ErrorState.RECOVERABLE);
        driver.setErrorState(BATTERY, ErrorState.RECOVERABLE);
        machine.onErrorReported(INVERTER, ErrorState.RECOVERABLE);
        machine.onErrorReported(BATTERY, ErrorState.RECOVERABLE);

        machine.ackError(INVERTER);
        machine.ackError(BATTERY);

        assertEquals(ComponentState.STANDBY, state(INVERTER));
        assertEquals(ComponentState.STOPPED, state(BATTERY));
        assertEquals(List.of("ackError(component#1)", "ackError(component#2)"), driver.commandLog());
    }

    @Test
    void ackErrorOutsideErrorIsInvalidState() {
        assertEquals(ControlErrorCode.INVALID_STATE, codeOf(() -> machine.ackError(INVERTER)));
        assertEquals(0, driver.totalCalls());
    }

    @Test
    void fatalErrorCannotBeAcknowledgedOrStarted() {
        driver.setErrorState(BATTERY, ErrorState.FATAL);
        machine.onErrorReported(BATTERY, ErrorState.FATAL);

        ControlException ack = assertThrows(ControlException.class, () -> machine.ackError(BATTERY));
        assertEquals(ControlErrorCode.PRECONDITION_FAILED, ack.code());
        assertEquals(ControlErrorCode.PRECONDITION_FAILED, codeOf(() -> machine.start(BATTERY)));

        assertEquals(ComponentState.ERROR, state(BATTERY));
        assertTrue(driver.commands().isEmpty());
    }

    @Test
    void standbyFromErrorIsInvalidState() {
        machine.onErrorReported(INVERTER, ErrorState.RECOVERABLE);

        assertEquals(ControlErrorCode.INVALID_STATE, codeOf(() -> machine.standby(INVERTER)));
    }

    // ---------------------------------------------------------------------
    // Inventory
    // ---------------------------------------------------------------------

    @Test
    void unknownComponentIsNotFound() {
        assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.start(ComponentId.of(99))));
        assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.record(ComponentId.of(99))));
    }

    @Test
    void unknownComponentsNeverAllocateALock() {
        int before = locks.size();

        for (int raw = 100; raw < 110; raw++) {
            ComponentId unknown = ComponentId.of(raw);
            assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.start(unknown)));
            assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.standby(unknown)));
            assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.stop(unknown)));
            assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.ackError(unknown)));
            assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.resumeFromStandby(unknown)));
            machine.markUnreachable(unknown);
            machine.onHardwareState(unknown, driver.hardware(INVERTER));
            machine.onErrorReported(unknown, ErrorState.RECOVERABLE);
        }

        assertEquals(before, locks.size());
    }

    @Test
    void unreachableComponentIsUnavailableThenStale() {
        driver.setUnreachable(BATTERY, true);

        assertEquals(ControlErrorCode.UNAVAILABLE, codeOf(() -> machine.start(BATTERY)));
        assertFalse(machine.record(BATTERY).reachable());
        assertEquals(ControlErrorCode.NOT_FOUND, codeOf(() -> machine.start(BATTERY)));

        driver.setUnreachable(BATTERY, false);
        machine.onHardwareState(BATTERY, driver.hardware(BATTERY));
        assertTrue(machine.record(BATTERY).reachable());

        machine.start(BATTERY);
        assertEquals(ComponentState.OPERATIONAL, state(BATTERY));
    }

    @Test
    void reRegisteringRevivesAStaleComponent() {
        machine.markUnreachable(INVERTER);
        assertFalse(machine.record(INVERTER).reachable());

        machine.register(INVERTER, ComponentCategory.INVERTER);

        assertTrue(machine.record(INVERTER).reachable());
    }

    @Test
    void registeringUnderAnotherCategoryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> machine.register(INVERTER, ComponentCategory.BATTERY));
    }
}
