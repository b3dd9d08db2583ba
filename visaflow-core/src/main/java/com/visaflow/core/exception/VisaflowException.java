package com.visaflow.core.exception;

/**
 * Base exception for all visaflow errors.
 */
public class VisaflowException extends RuntimeException {
    
    private final String errorCode;
    
    public VisaflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public VisaflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
