package com.contentcuration.curator.exception;

/**
 * Base class for curator pipeline failures.
 */
public class CuratorException extends RuntimeException {

    private final String errorCode;

    public CuratorException(String message) {
        super(message);
        this.errorCode = "CURATOR_ERROR";
    }

    public CuratorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CuratorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
