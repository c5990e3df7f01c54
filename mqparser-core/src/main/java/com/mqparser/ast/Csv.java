package com.mqparser.ast;

import java.util.List;

public record Csv(
    int id,
    TokenRange tokenRange,
    Node node,
    Constant commaConstant  // Can be null
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.CSV;
    }

    @Override
    public List<Node> children() {
        return Children.of(node, commaConstant);
    }
}
