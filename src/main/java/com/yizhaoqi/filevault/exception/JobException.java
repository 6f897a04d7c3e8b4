package com.yizhaoqi.filevault.exception;

/**
 * Job failure that leaves the record eligible for redelivery.
 */
public class JobException extends RuntimeException {

    public JobException(String message) {
        super(message);
    }

    public JobException(String message, Throwable cause) {
        super(message, cause);
    }
}
