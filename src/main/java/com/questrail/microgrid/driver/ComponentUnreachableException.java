package com.questrail.microgrid.driver;

/**
 * Raised by a {@link ComponentDriver} when the component cannot be reached at all.
 */
public final class ComponentUnreachableException extends DriverException
{
    public ComponentUnreachableException(String message) {
        super(message);
    }

    public ComponentUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
