package com.indigententerprises.telemetry.common.serviceinterfaces;

public class IntegrityCheckException extends Exception {
    public IntegrityCheckException(final String message) {
        super(message);
    }

    public IntegrityCheckException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
