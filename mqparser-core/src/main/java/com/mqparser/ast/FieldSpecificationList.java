package com.mqparser.ast;

import java.util.List;

public record FieldSpecificationList(
    int id,
    TokenRange tokenRange,
    Constant openWrapperConstant,
    ArrayWrapper content,
    Constant openRecordMarkerConstant,  // Can be null
    Constant closeWrapperConstant
) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.FIELD_SPECIFICATION_LIST;
    }

    @Override
    public List<Node> children() {
        return Children.of(openWrapperConstant, content, openRecordMarkerConstant, closeWrapperConstant);
    }
}
