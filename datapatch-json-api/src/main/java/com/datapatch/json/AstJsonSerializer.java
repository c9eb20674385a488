package com.datapatch.json;

import com.datapatch.ast.Node;

/**
 * Writes transformed patch ASTs as JSON, typically to cache them between runs.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node to a JSON string.
     *
     * @param node the node to serialize, usually a {@link com.datapatch.ast.Patch}
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     */
    String serializePretty(Node node) throws AstJsonException;
}
