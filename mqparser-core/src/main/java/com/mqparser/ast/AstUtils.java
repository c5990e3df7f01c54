package com.mqparser.ast;

import java.util.EnumSet;
import java.util.Set;

/**
 * Shape predicates over the expression hierarchy. Each level accepts its own node kind plus
 * everything that binds tighter, e.g. an arithmetic operand may be a metadata expression or a
 * plain unary expression.
 */
public final class AstUtils {

    private static final Set<NodeKind> PRIMARY_EXPRESSION = EnumSet.of(
        NodeKind.FIELD_PROJECTION,
        NodeKind.FIELD_SELECTOR,
        NodeKind.IDENTIFIER_EXPRESSION,
        NodeKind.INVOKE_EXPRESSION,
        NodeKind.ITEM_ACCESS_EXPRESSION,
        NodeKind.LIST_EXPRESSION,
        NodeKind.LITERAL_EXPRESSION,
        NodeKind.NOT_IMPLEMENTED_EXPRESSION,
        NodeKind.PARENTHESIZED_EXPRESSION,
        NodeKind.RECORD_EXPRESSION,
        NodeKind.RECURSIVE_PRIMARY_EXPRESSION);

    private static final Set<NodeKind> TYPE_EXPRESSION = with(PRIMARY_EXPRESSION, NodeKind.TYPE_PRIMARY_TYPE);
    private static final Set<NodeKind> UNARY_EXPRESSION = with(TYPE_EXPRESSION, NodeKind.UNARY_EXPRESSION);
    private static final Set<NodeKind> METADATA_EXPRESSION = with(UNARY_EXPRESSION, NodeKind.METADATA_EXPRESSION);
    private static final Set<NodeKind> ARITHMETIC_EXPRESSION = with(METADATA_EXPRESSION, NodeKind.ARITHMETIC_EXPRESSION);
    private static final Set<NodeKind> RELATIONAL_EXPRESSION = with(ARITHMETIC_EXPRESSION, NodeKind.RELATIONAL_EXPRESSION);
    private static final Set<NodeKind> EQUALITY_EXPRESSION = with(RELATIONAL_EXPRESSION, NodeKind.EQUALITY_EXPRESSION);
    private static final Set<NodeKind> AS_EXPRESSION = with(EQUALITY_EXPRESSION, NodeKind.AS_EXPRESSION);
    private static final Set<NodeKind> IS_EXPRESSION = with(AS_EXPRESSION, NodeKind.IS_EXPRESSION);
    private static final Set<NodeKind> LOGICAL_EXPRESSION = with(IS_EXPRESSION, NodeKind.LOGICAL_EXPRESSION);
    private static final Set<NodeKind> NULL_COALESCING_EXPRESSION =
        with(LOGICAL_EXPRESSION, NodeKind.NULL_COALESCING_EXPRESSION);

    private static final Set<NodeKind> NULLABLE_PRIMITIVE_TYPE =
        EnumSet.of(NodeKind.NULLABLE_PRIMITIVE_TYPE, NodeKind.PRIMITIVE_TYPE);

    private AstUtils() {
        // Utility class
    }

    public static boolean isTUnaryExpression(Node node) {
        return UNARY_EXPRESSION.contains(node.kind());
    }

    public static boolean isTEqualityExpression(Node node) {
        return EQUALITY_EXPRESSION.contains(node.kind());
    }

    public static boolean isTAsExpression(Node node) {
        return AS_EXPRESSION.contains(node.kind());
    }

    public static boolean isTIsExpression(Node node) {
        return IS_EXPRESSION.contains(node.kind());
    }

    public static boolean isTLogicalExpression(Node node) {
        return LOGICAL_EXPRESSION.contains(node.kind());
    }

    public static boolean isTNullCoalescingExpression(Node node) {
        return NULL_COALESCING_EXPRESSION.contains(node.kind());
    }

    public static boolean isTNullablePrimitiveType(Node node) {
        return NULLABLE_PRIMITIVE_TYPE.contains(node.kind());
    }

    public static boolean isLogicalAndExpression(Node node) {
        return node instanceof BinOpExpression binOp
            && binOp.kind() == NodeKind.LOGICAL_EXPRESSION
            && binOp.operatorConstant().constantKind() == ConstantKind.AND;
    }

    private static Set<NodeKind> with(Set<NodeKind> base, NodeKind kind) {
        EnumSet<NodeKind> extended = EnumSet.copyOf(base);
        extended.add(kind);
        return extended;
    }
}
