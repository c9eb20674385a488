package com.datapatch.ast;

public record ElementIndexer(
    Coordinate coordinate,
    String elementType
) implements Indexer {

    @Override
    public String type() {
        return "ElementIndexer";
    }
}
