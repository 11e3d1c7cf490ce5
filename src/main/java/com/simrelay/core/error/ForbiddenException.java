package com.simrelay.core.error;

import org.springframework.http.HttpStatus;

/** Credential was presented but did not verify. */
public class ForbiddenException extends RelayException {

    public ForbiddenException(String detail) {
        super(detail);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.FORBIDDEN;
    }
}
