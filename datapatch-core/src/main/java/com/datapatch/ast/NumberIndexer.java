package com.datapatch.ast;

/**
 * @param index unsigned; compare with {@link Long#compareUnsigned(long, long)}
 */
public record NumberIndexer(
    Coordinate coordinate,
    long index
) implements Indexer {

    @Override
    public String type() {
        return "NumberIndexer";
    }
}
