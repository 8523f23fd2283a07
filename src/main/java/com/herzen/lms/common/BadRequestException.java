package com.herzen.lms.common;

import org.springframework.http.HttpStatus;

public class BadRequestException extends LmsException {
    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
