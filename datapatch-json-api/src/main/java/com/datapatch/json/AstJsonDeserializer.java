package com.datapatch.json;

import com.datapatch.ast.Node;
import com.datapatch.ast.Patch;
import com.datapatch.parse.ParseNode;

/**
 * Reads patch ASTs written by an {@link AstJsonSerializer}, and parse trees produced by the
 * external patch grammar.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if the JSON is not a serialized {@link Patch}
     */
    Patch deserializePatch(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific AST node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;

    /**
     * Reads a parse tree, ready to be handed to the transformer. Each node is an object with a
     * {@code rule}, and optionally {@code text}, {@code coordinate}, {@code labels} and
     * {@code children}.
     *
     * @throws AstJsonException if the JSON does not describe a parse tree
     */
    ParseNode deserializeParseTree(String json) throws AstJsonException;
}
