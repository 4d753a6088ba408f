package com.nexuscontrol.control;

/**
 * An import refused before anything was written.
 */
public class ImportRejectedException extends RuntimeException {

    public static final String BUNDLE_INVALID = "BUNDLE_INVALID";
    public static final String INTEGRITY_MISMATCH = "INTEGRITY_MISMATCH";
    public static final String DECISION_EXISTS = "DECISION_EXISTS";
    public static final String REPLAY_INVALID = "REPLAY_INVALID";

    private final String errorCode;

    public ImportRejectedException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ImportRejectedException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
