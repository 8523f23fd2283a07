package com.herzen.lms.common;

import org.springframework.http.HttpStatus;

public class ConflictException extends LmsException {
    public ConflictException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.CONFLICT;
    }
}
