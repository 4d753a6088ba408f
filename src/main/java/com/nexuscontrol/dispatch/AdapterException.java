package com.nexuscontrol.dispatch;

/**
 * Thrown by an adapter to fail a call with a specific error code.
 */
public class AdapterException extends RuntimeException {

    private final String errorCode;

    public AdapterException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AdapterException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
