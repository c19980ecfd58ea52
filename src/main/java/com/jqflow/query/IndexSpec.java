package com.jqflow.query;

/**
 * What an index operation selects: a field, a quoted key, a computed key, or a range.
 */
public sealed interface IndexSpec {
    record Field(String name) implements IndexSpec {}        // .foo
    record Key(String key) implements IndexSpec {}           // ."foo"
    record Expression(Query index) implements IndexSpec {}   // .[expr]
    record Slice(Query start, Query end) implements IndexSpec {}  // .[start:end], either bound may be null
}
