package com.mqparser.ast;

import java.util.List;

public record RecordType(
    int id,
    TokenRange tokenRange,
    FieldSpecificationList fields
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.RECORD_TYPE;
    }

    @Override
    public List<Node> children() {
        return Children.of(fields);
    }
}
