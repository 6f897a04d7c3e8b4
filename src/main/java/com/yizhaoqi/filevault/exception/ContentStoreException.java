package com.yizhaoqi.filevault.exception;

import java.io.IOException;

public class ContentStoreException extends IOException {

    public ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
