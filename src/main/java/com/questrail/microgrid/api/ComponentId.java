package com.questrail.microgrid.api;

/**
 * ComponentId
 * -----------------------------------------------------------------------------
 * Numeric identity of an electrical component within one microgrid.
 *
 * <p>Ids are assigned by the external inventory and are never reused while a
 * session is running.</p>
 */
public record ComponentId(long value)
{
    public ComponentId {
        if (value < 0) {
            throw new IllegalArgumentException("component id must be >= 0: " + value);
        }
    }

    public static ComponentId of(long value) {
        return new ComponentId(value);
    }

    @Override
    public String toString() {
        return "component#" + value;
    }
}
