package com.questrail.microgrid.driver;

/**
 * Error condition reported by a component's hardware.
 */
public enum ErrorState
{
    NONE,

    /** Cleared by acknowledging the error. */
    RECOVERABLE,

    /** Requires service; cannot be acknowledged away. */
    FATAL
}
