package com.jqflow.query;

public sealed interface Suffix {
    record Index(IndexSpec index) implements Suffix {}
    record Iterate() implements Suffix {}                    // []
    record Suppress() implements Suffix {}                   // ?
    record Bind(String variable) implements Suffix {}        // as $variable
}
