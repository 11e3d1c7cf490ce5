package com.simrelay.core.error;

import org.springframework.http.HttpStatus;

public class NotFoundException extends RelayException {

    public NotFoundException(String detail) {
        super(detail);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
