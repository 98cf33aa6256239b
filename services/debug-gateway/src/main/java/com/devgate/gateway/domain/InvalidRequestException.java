package com.devgate.gateway.domain;

/** Thrown when a caller-supplied value fails validation; the message is safe to return to the caller. */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
