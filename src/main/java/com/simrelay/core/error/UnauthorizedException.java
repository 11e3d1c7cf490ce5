package com.simrelay.core.error;

import org.springframework.http.HttpStatus;

/** Missing or invalid credential. */
public class UnauthorizedException extends RelayException {

    public UnauthorizedException(String detail) {
        super(detail);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.UNAUTHORIZED;
    }
}
