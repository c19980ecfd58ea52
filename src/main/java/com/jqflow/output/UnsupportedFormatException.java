package com.jqflow.output;

public class UnsupportedFormatException extends IllegalArgumentException {
    public UnsupportedFormatException(String message) {
        super(message);
    }
}
