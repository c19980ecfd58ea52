package com.jqflow.graph;

/**
 * A graph operation referenced an id that is taken, missing, or outside a valid scope.
 */
public class GraphMutationException extends RuntimeException {
    public GraphMutationException(String message) {
        super(message);
    }

    public GraphMutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
