package com.explify.sidecar.exception;

/**
 * Raised for networked-only functionality when the process runs in local mode. Surfaces as 404 so
 * the compliance endpoints look absent rather than denied.
 */
public class NotAvailableException extends RuntimeException {
    public static final String DEFAULT_MESSAGE = "Not available in desktop mode.";

    public NotAvailableException() {
        super(DEFAULT_MESSAGE);
    }
}
