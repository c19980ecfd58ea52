package com.jqflow.diagram;

/**
 * Traversal position inside one scope: the node new stages attach to and the
 * counter that numbers the next one. Each child scope gets its own cursor, so
 * numbering restarts at {@code node_0} there.
 */
public final class Cursor {
    public static final String START = "start";

    private String lastNodeId;
    private int counter;

    public Cursor(String lastNodeId, int counter) {
        this.lastNodeId = lastNodeId;
        this.counter = counter;
    }

    public static Cursor fresh() {
        return new Cursor(START, 0);
    }

    /** Null while detached. */
    public String lastNodeId() {
        return lastNodeId;
    }

    public int counter() {
        return counter;
    }

    public String nextNodeId() {
        return "node_" + counter++;
    }

    public void moveTo(String nodeId) {
        this.lastNodeId = nodeId;
    }

    /** Stops the next stage from being connected to anything. */
    public void detach() {
        this.lastNodeId = null;
    }

    @Override
    public String toString() {
        return "Cursor{last=" + lastNodeId + ", counter=" + counter + "}";
    }
}
