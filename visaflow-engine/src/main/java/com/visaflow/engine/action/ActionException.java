package com.visaflow.engine.action;

/**
 * Exception thrown by action handlers on failure.
 * Never escapes {@link ActionExecutor}: it becomes a failed {@link ActionResult}.
 */
public class ActionException extends Exception {
    
    private final String errorCode;
    private final boolean retryable;
    
    public ActionException(String errorCode, String message) {
        this(errorCode, message, true);
    }
    
    public ActionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public ActionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = true;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    /**
     * Whether running the action again could succeed (network error, 5xx).
     * Configuration errors are not retryable.
     */
    public boolean isRetryable() {
        return retryable;
    }
    
    /**
     * Create a non-retryable exception (misconfigured action).
     */
    public static ActionException misconfigured(String errorCode, String message) {
        return new ActionException(errorCode, message, false);
    }
}
