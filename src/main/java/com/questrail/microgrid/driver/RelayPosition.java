package com.questrail.microgrid.driver;

/**
 * Last reported position of a relay. {@link #ABSENT} means the component has no
 * relay of that kind.
 */
public enum RelayPosition
{
    OPEN,
    CLOSED,
    ABSENT;

    public static RelayPosition of(boolean closed) {
        return closed ? CLOSED : OPEN;
    }
}
