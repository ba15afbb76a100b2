package com.propertyintel.crimeintel.client;

/**
 * A graph or search backend call failed. Callers treat it as "no evidence".
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
