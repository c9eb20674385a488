package com.datapatch.ast;

/**
 * Base interface for all patch AST nodes.
 *
 * <p>Nodes are immutable records built once by the transformer. They may be cached and
 * shared between runs and between threads.</p>
 */
public sealed interface Node permits
    Patch,
    Statement,
    Expression,
    Selector,
    Indexer,
    Attribute,
    Argument,
    CallArgument,
    KeyValue {

    String type();

    Coordinate coordinate();
}
