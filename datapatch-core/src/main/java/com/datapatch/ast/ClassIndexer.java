package com.datapatch.ast;

public record ClassIndexer(
    Coordinate coordinate,
    String className
) implements Indexer {

    @Override
    public String type() {
        return "ClassIndexer";
    }
}
