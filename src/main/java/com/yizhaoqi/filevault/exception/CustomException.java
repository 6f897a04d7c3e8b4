package com.yizhaoqi.filevault.exception;

import org.springframework.http.HttpStatus;

/**
 * Business failure carrying the HTTP status it should be reported with.
 * Covers missing input, authentication, not-found, duplicate registration
 * and folder-has-no-content conditions.
 */
public class CustomException extends RuntimeException {

    private final HttpStatus status;

    public CustomException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public static CustomException badRequest(String message) {
        return new CustomException(message, HttpStatus.BAD_REQUEST);
    }

    public static CustomException unauthorized() {
        return new CustomException("Unauthorized", HttpStatus.UNAUTHORIZED);
    }

    public static CustomException notFound() {
        return new CustomException("Not found", HttpStatus.NOT_FOUND);
    }
}
