package com.jqflow.output;

public enum Direction {
    RIGHT("LR"),
    DOWN("TB");

    private final String rankdir;

    Direction(String rankdir) {
        this.rankdir = rankdir;
    }

    public String rankdir() {
        return rankdir;
    }
}
