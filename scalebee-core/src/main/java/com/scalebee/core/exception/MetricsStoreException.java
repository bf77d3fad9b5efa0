package com.scalebee.core.exception;

public class MetricsStoreException extends RuntimeException {

    public MetricsStoreException(String message) {
        super(message);
    }

    public MetricsStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
