package com.questrail.microgrid.driver;

/**
 * Raised by a {@link ComponentDriver} when a hardware call fails or times out.
 */
public class DriverException extends RuntimeException
{
    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
