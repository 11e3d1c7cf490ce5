package com.simrelay.core.error;

import org.springframework.http.HttpStatus;

/**
 * Base class for errors surfaced to API callers. Each subclass fixes the HTTP status
 * it maps to; the message is returned verbatim as the response {@code detail}.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String detail) {
        super(detail);
    }

    public abstract HttpStatus status();
}
