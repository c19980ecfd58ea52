package com.jqflow.graph;

public enum NodeShape {
    RECTANGLE("rectangle"),
    CIRCLE("circle");

    private final String shapeName;

    NodeShape(String shapeName) {
        this.shapeName = shapeName;
    }

    public String shapeName() {
        return shapeName;
    }

    public static NodeShape fromName(String name) {
        for (NodeShape shape : values()) {
            if (shape.shapeName.equals(name)) {
                return shape;
            }
        }
        throw new GraphMutationException("Unknown shape: " + name);
    }
}
