package com.questrail.microgrid.internal.sequence;

/**
 * Tag of an action plan step. Verify kinds only inspect hardware state; all
 * other kinds issue exactly one kind of driver command.
 */
public enum StepKind
{
    VERIFY_RELAY_CLOSED(true),
    VERIFY_POWER_ZERO(true),
    CLOSE_RELAY(false),
    OPEN_RELAY(false),
    SET_POWER_ZERO(false),
    BEGIN_PRECHARGE(false);

    private final boolean verify;

    StepKind(boolean verify) {
        this.verify = verify;
    }

    public boolean isVerify() {
        return verify;
    }
}
