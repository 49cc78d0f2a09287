package com.questrail.microgrid.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ControlException
 * -----------------------------------------------------------------------------
 * Signals that a control operation was rejected or failed.
 *
 * <p>Carries enough detail for a caller to decide on retry: the
 * {@link ControlErrorCode}, the component involved, and for sequencer failures
 * the name of the step that failed. The core never retries on its own.</p>
 */
public final class ControlException extends RuntimeException
{
    private final ControlErrorCode code;
    private final ComponentId componentId;
    private final String failedStep;

    public ControlException(ControlErrorCode code,
                            ComponentId componentId,
                            String failedStep,
                            String message,
                            Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.componentId = componentId;
        this.failedStep = failedStep;
    }

    public ControlException(ControlErrorCode code, ComponentId componentId, String message) {
        this(code, componentId, null, message, null);
    }

    public ControlErrorCode code() {
        return code;
    }

    public Optional<ComponentId> componentId() {
        return Optional.ofNullable(componentId);
    }

    public Optional<String> failedStep() {
        return Optional.ofNullable(failedStep);
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    public static ControlException invalidArgument(String message) {
        return new ControlException(ControlErrorCode.INVALID_ARGUMENT, null, message);
    }

    public static ControlException invalidArgument(ComponentId id, String message) {
        return new ControlException(ControlErrorCode.INVALID_ARGUMENT, id, message);
    }

    public static ControlException notFound(ComponentId id, String message) {
        return new ControlException(ControlErrorCode.NOT_FOUND, id, message);
    }

    public static ControlException invalidState(ComponentId id, String message) {
        return new ControlException(ControlErrorCode.INVALID_STATE, id, message);
    }

    public static ControlException preconditionFailed(ComponentId id, String step, String message) {
        return new ControlException(ControlErrorCode.PRECONDITION_FAILED, id, step, message, null);
    }

    public static ControlException driverError(ComponentId id, String step, String message, Throwable cause) {
        return new ControlException(ControlErrorCode.DRIVER_ERROR, id, step, message, cause);
    }

    public static ControlException unavailable(ComponentId id, String step, String message, Throwable cause) {
        return new ControlException(ControlErrorCode.UNAVAILABLE, id, step, message, cause);
    }
}
