package com.datapatch.ast;

/**
 * Source position of a node: the document it came from plus a 1-based line and 0-based column.
 */
public record Coordinate(String file, int line, int column) {

    public static final Coordinate UNKNOWN = new Coordinate("<unknown>", 0, 0);

    public Coordinate {
        if (file == null) {
            file = UNKNOWN.file;
        }
    }

    public static Coordinate of(String file, int line, int column) {
        return new Coordinate(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
