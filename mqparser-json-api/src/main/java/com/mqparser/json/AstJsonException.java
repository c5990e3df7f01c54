package com.mqparser.json;

/**
 * Thrown when a node cannot be written as JSON. Carries the registry id of the node that was
 * being serialized.
 */
public class AstJsonException extends RuntimeException {

    private final int nodeId;

    public AstJsonException(int nodeId, Throwable cause) {
        super("Failed to serialize AST node " + nodeId, cause);
        this.nodeId = nodeId;
    }

    public int getNodeId() {
        return nodeId;
    }
}
