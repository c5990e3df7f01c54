package com.mqparser.json;

import com.mqparser.ast.Node;

/**
 * Writes finished nodes as JSON objects.
 * <p>
 * Every object starts with {@code kind}, {@code id}, {@code tokenRange} and {@code isLeaf}, followed
 * by the node's named attributes. Absent optional attributes (a missing {@code ?}, a function
 * without a return type) are left out, and constants are written as their source text. Ids are
 * the registry ids of the parse that built the node.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented.
     */
    String serializePretty(Node node) throws AstJsonException;
}
