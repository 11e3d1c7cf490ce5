package com.simrelay.core.error;

import org.springframework.http.HttpStatus;

public class BadRequestException extends RelayException {

    public BadRequestException(String detail) {
        super(detail);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
