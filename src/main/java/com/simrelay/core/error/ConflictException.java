package com.simrelay.core.error;

import org.springframework.http.HttpStatus;

public class ConflictException extends RelayException {

    public ConflictException(String detail) {
        super(detail);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.CONFLICT;
    }
}
