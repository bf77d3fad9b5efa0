package com.scalebee.core.exception;

public class WorkloadRuntimeException extends RuntimeException {

    public WorkloadRuntimeException(String message) {
        super(message);
    }

    public WorkloadRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
