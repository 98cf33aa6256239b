package com.devgate.gateway.domain;

/** Thrown when a request names an entity, conversation or item that does not exist. */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String message) {
        super(message);
    }
}
