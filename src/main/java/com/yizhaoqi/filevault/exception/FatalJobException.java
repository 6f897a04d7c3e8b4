package com.yizhaoqi.filevault.exception;

/**
 * Job failure that no retry can fix. Registered as not-retryable with the
 * listener error handler, so the record is dropped after the first attempt.
 */
public class FatalJobException extends JobException {

    public FatalJobException(String message) {
        super(message);
    }

    public FatalJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
