package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.driver.ComponentFeatures;

/**
 * Feature a plan step depends on.
 */
public enum Capability
{
    NONE,
    AC_RELAY,
    DC_RELAY,
    PRECHARGE;

    public boolean presentIn(ComponentFeatures features) {
        return switch (this) {
            case NONE -> true;
            case AC_RELAY -> features.hasAcRelay();
            case DC_RELAY -> features.hasDcRelay();
            case PRECHARGE -> features.supportsPrecharge();
        };
    }
}
