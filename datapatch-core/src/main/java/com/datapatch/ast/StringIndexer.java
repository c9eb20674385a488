package com.datapatch.ast;

public record StringIndexer(
    Coordinate coordinate,
    String key
) implements Indexer {

    @Override
    public String type() {
        return "StringIndexer";
    }
}
