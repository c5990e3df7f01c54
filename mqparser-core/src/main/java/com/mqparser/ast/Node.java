package com.mqparser.ast;

import java.util.List;

/**
 * Base interface for all finished syntax tree nodes.
 */
public sealed interface Node permits
    ArrayWrapper,
    BinOpExpression,
    Constant,
    Csv,
    ErrorHandlingExpression,
    FieldSpecification,
    FieldSpecificationList,
    FunctionExpression,
    FunctionType,
    GeneralizedIdentifier,
    Identifier,
    IdentifierExpression,
    IfExpression,
    KeyValuePair,
    LetExpression,
    LiteralExpression,
    NotImplementedExpression,
    PairedConstant,
    Parameter,
    PrimitiveType,
    RangeExpression,
    RecordType,
    RecursivePrimaryExpression,
    Section,
    SectionMember,
    UnaryExpression,
    Wrapped {

    int id();
    NodeKind kind();
    TokenRange tokenRange();

    default boolean isLeaf() {
        return false;
    }

    /**
     * Present children in attribute order. Absent optional attributes are skipped.
     */
    List<Node> children();
}
