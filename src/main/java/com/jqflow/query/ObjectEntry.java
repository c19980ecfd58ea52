package com.jqflow.query;

import java.util.Objects;

public record ObjectEntry(Key key, Query value) {
    public ObjectEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public sealed interface Key {
        record Named(String name) implements Key {}
        record Computed(Query expression) implements Key {}
    }
}
