package com.indigententerprises.telemetry.common.serviceinterfaces;

public class MalformedRecordException extends Exception {
    public MalformedRecordException(final String message) {
        super(message);
    }

    public MalformedRecordException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
