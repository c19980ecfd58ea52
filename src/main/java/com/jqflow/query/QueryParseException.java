package com.jqflow.query;

public class QueryParseException extends IllegalArgumentException {
    private final int offset;

    public QueryParseException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public QueryParseException(String message, int offset, Throwable cause) {
        super(message + " at offset " + offset, cause);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
