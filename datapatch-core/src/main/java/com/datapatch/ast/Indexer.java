package com.datapatch.ast;

/**
 * Narrows a field to one nested location: the n-th item, the item of an element type,
 * the item carrying a class, or the entry under a key.
 */
public sealed interface Indexer extends Node permits
    NumberIndexer,
    ElementIndexer,
    ClassIndexer,
    StringIndexer,
    ErrorNode {
}
