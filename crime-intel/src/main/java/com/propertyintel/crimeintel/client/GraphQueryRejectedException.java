package com.propertyintel.crimeintel.client;

/**
 * The graph store answered but refused the statement, e.g. a Cypher syntax
 * or constraint error. Repeating the call gives the same answer, so it is
 * not a {@link CollaboratorException} and is never retried.
 */
public class GraphQueryRejectedException extends RuntimeException {

    private final String code;

    public GraphQueryRejectedException(String code, String message) {
        super("Graph query rejected: " + code + " " + message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
