package com.mqparser.engine;

import com.mqparser.ast.AstUtils;
import com.mqparser.ast.BinOpOperator;
import com.mqparser.ast.Node;

import java.util.function.Predicate;

/**
 * Operand shapes each binary operator accepts once the combinator has grouped a run.
 * <p>
 * A failed check means the run was grouped into something the grammar cannot produce. The
 * combinator then re-reads the offending operand with the matching {@link Fallback} production,
 * which reports the error exactly where the recursive descent parser would.
 */
enum BinOpValidator {
    META(AstUtils::isTUnaryExpression, AstUtils::isTUnaryExpression,
        Fallback.READ_UNARY, Fallback.READ_UNARY),
    ARITHMETIC(AstUtils::isTEqualityExpression, AstUtils::isTEqualityExpression,
        Fallback.READ_METADATA, Fallback.READ_METADATA),
    RELATIONAL(AstUtils::isTEqualityExpression, AstUtils::isTEqualityExpression,
        Fallback.READ_METADATA, Fallback.READ_METADATA),
    EQUALITY(AstUtils::isTEqualityExpression, AstUtils::isTEqualityExpression,
        Fallback.READ_METADATA, Fallback.READ_METADATA),
    AS(AstUtils::isTAsExpression, AstUtils::isTNullablePrimitiveType,
        Fallback.READ_EQUALITY, Fallback.READ_NULLABLE_PRIMITIVE_TYPE),
    IS(AstUtils::isTIsExpression, AstUtils::isTNullablePrimitiveType,
        Fallback.READ_LOGICAL, Fallback.READ_NULLABLE_PRIMITIVE_TYPE),
    AND(AstUtils::isTLogicalExpression, AstUtils::isTIsExpression,
        Fallback.READ_IS, Fallback.READ_IS),
    OR(AstUtils::isTLogicalExpression,
        node -> AstUtils.isTIsExpression(node) || AstUtils.isLogicalAndExpression(node),
        Fallback.READ_LOGICAL, Fallback.READ_LOGICAL),
    NULL_COALESCING(AstUtils::isTLogicalExpression, AstUtils::isTNullCoalescingExpression,
        Fallback.READ_LOGICAL, Fallback.READ_LOGICAL);

    enum Fallback {
        READ_UNARY,
        READ_METADATA,
        READ_EQUALITY,
        READ_NULLABLE_PRIMITIVE_TYPE,
        READ_LOGICAL,
        READ_IS
    }

    private final Predicate<Node> leftCheck;
    private final Predicate<Node> rightCheck;
    private final Fallback leftFallback;
    private final Fallback rightFallback;

    BinOpValidator(Predicate<Node> leftCheck, Predicate<Node> rightCheck, Fallback leftFallback,
                   Fallback rightFallback) {
        this.leftCheck = leftCheck;
        this.rightCheck = rightCheck;
        this.leftFallback = leftFallback;
        this.rightFallback = rightFallback;
    }

    boolean acceptsLeft(Node left) {
        return leftCheck.test(left);
    }

    boolean acceptsRight(Node right) {
        return rightCheck.test(right);
    }

    Fallback leftFallback() {
        return leftFallback;
    }

    Fallback rightFallback() {
        return rightFallback;
    }

    static BinOpValidator forOperator(BinOpOperator operator) {
        return switch (operator) {
            case META -> META;
            case MULTIPLICATION, DIVISION, ADDITION, SUBTRACTION, CONCATENATION -> ARITHMETIC;
            case LESS_THAN, LESS_THAN_EQUAL_TO, GREATER_THAN, GREATER_THAN_EQUAL_TO -> RELATIONAL;
            case EQUAL_TO, NOT_EQUAL_TO -> EQUALITY;
            case AS -> AS;
            case IS -> IS;
            case AND -> AND;
            case OR -> OR;
            case NULL_COALESCING -> NULL_COALESCING;
        };
    }
}
