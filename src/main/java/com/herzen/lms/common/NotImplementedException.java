package com.herzen.lms.common;

import org.springframework.http.HttpStatus;

public class NotImplementedException extends LmsException {
    public NotImplementedException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_IMPLEMENTED;
    }
}
