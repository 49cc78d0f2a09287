package com.questrail.microgrid.driver;

/**
 * Which side of a component a relay switches.
 */
public enum RelayKind
{
    AC,
    DC
}
