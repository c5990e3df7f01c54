package com.mqparser.ast;

public enum NodeKind {
    ARRAY_WRAPPER,
    ARITHMETIC_EXPRESSION,
    AS_EXPRESSION,
    AS_NULLABLE_PRIMITIVE_TYPE,
    AS_TYPE,
    CATCH_EXPRESSION,
    CONSTANT,
    CSV,
    EACH_EXPRESSION,
    EQUALITY_EXPRESSION,
    ERROR_HANDLING_EXPRESSION,
    ERROR_RAISING_EXPRESSION,
    FIELD_PROJECTION,
    FIELD_SELECTOR,
    FIELD_SPECIFICATION,
    FIELD_SPECIFICATION_LIST,
    FIELD_TYPE_SPECIFICATION,
    FUNCTION_EXPRESSION,
    FUNCTION_TYPE,
    GENERALIZED_IDENTIFIER,
    GENERALIZED_IDENTIFIER_PAIRED_ANY_LITERAL,
    GENERALIZED_IDENTIFIER_PAIRED_EXPRESSION,
    IDENTIFIER,
    IDENTIFIER_EXPRESSION,
    IDENTIFIER_PAIRED_EXPRESSION,
    IF_EXPRESSION,
    INVOKE_EXPRESSION,
    IS_EXPRESSION,
    ITEM_ACCESS_EXPRESSION,
    LET_EXPRESSION,
    LIST_EXPRESSION,
    LIST_LITERAL,
    LIST_TYPE,
    LITERAL_EXPRESSION,
    LOGICAL_EXPRESSION,
    METADATA_EXPRESSION,
    NOT_IMPLEMENTED_EXPRESSION,
    NULL_COALESCING_EXPRESSION,
    NULLABLE_PRIMITIVE_TYPE,
    NULLABLE_TYPE,
    OTHERWISE_EXPRESSION,
    PARAMETER,
    PARAMETER_LIST,
    PARENTHESIZED_EXPRESSION,
    PRIMITIVE_TYPE,
    RANGE_EXPRESSION,
    RECORD_EXPRESSION,
    RECORD_LITERAL,
    RECORD_TYPE,
    RECURSIVE_PRIMARY_EXPRESSION,
    RELATIONAL_EXPRESSION,
    SECTION,
    SECTION_MEMBER,
    TABLE_TYPE,
    TYPE_PRIMARY_TYPE,
    UNARY_EXPRESSION;

    public boolean isBinOpExpression() {
        return switch (this) {
            case ARITHMETIC_EXPRESSION, AS_EXPRESSION, EQUALITY_EXPRESSION, IS_EXPRESSION,
                 LOGICAL_EXPRESSION, METADATA_EXPRESSION, NULL_COALESCING_EXPRESSION,
                 RELATIONAL_EXPRESSION -> true;
            default -> false;
        };
    }
}
