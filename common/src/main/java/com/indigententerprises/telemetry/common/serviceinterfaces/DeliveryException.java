package com.indigententerprises.telemetry.common.serviceinterfaces;

public class DeliveryException extends Exception {
    public DeliveryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
