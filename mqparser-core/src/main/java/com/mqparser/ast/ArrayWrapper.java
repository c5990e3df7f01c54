package com.mqparser.ast;

import java.util.List;

/**
 * An ordered run of sibling nodes, e.g. the CSV entries of a list or the members of a section.
 */
public record ArrayWrapper(
    int id,
    TokenRange tokenRange,
    List<Node> elements
) implements Node {

    public ArrayWrapper {
        elements = List.copyOf(elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARRAY_WRAPPER;
    }

    @Override
    public List<Node> children() {
        return elements;
    }
}
