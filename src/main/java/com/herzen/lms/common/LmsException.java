package com.herzen.lms.common;

import org.springframework.http.HttpStatus;

public abstract class LmsException extends RuntimeException {
    protected LmsException(String message) {
        super(message);
    }

    protected LmsException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus status();
}
