package com.herzen.lms.common;

import org.springframework.http.HttpStatus;

public class NotFoundException extends LmsException {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
