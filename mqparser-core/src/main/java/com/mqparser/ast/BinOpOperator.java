package com.mqparser.ast;

import com.mqparser.lexer.TokenKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Binary operators and their precedence. A higher precedence binds tighter.
 * This table is the single source of operator ordering for both parsers.
 */
public enum BinOpOperator {
    META(ConstantKind.META, TokenKind.KEYWORD_META, NodeKind.METADATA_EXPRESSION, 110),

    MULTIPLICATION(ConstantKind.MULTIPLICATION, TokenKind.ASTERISK, NodeKind.ARITHMETIC_EXPRESSION, 100),
    DIVISION(ConstantKind.DIVISION, TokenKind.DIVISION, NodeKind.ARITHMETIC_EXPRESSION, 100),
    ADDITION(ConstantKind.ADDITION, TokenKind.PLUS, NodeKind.ARITHMETIC_EXPRESSION, 90),
    SUBTRACTION(ConstantKind.SUBTRACTION, TokenKind.MINUS, NodeKind.ARITHMETIC_EXPRESSION, 90),
    CONCATENATION(ConstantKind.CONCATENATION, TokenKind.AMPERSAND, NodeKind.ARITHMETIC_EXPRESSION, 90),

    LESS_THAN(ConstantKind.LESS_THAN, TokenKind.LESS_THAN, NodeKind.RELATIONAL_EXPRESSION, 80),
    LESS_THAN_EQUAL_TO(ConstantKind.LESS_THAN_EQUAL_TO, TokenKind.LESS_THAN_EQUAL_TO, NodeKind.RELATIONAL_EXPRESSION, 80),
    GREATER_THAN(ConstantKind.GREATER_THAN, TokenKind.GREATER_THAN, NodeKind.RELATIONAL_EXPRESSION, 80),
    GREATER_THAN_EQUAL_TO(ConstantKind.GREATER_THAN_EQUAL_TO, TokenKind.GREATER_THAN_EQUAL_TO, NodeKind.RELATIONAL_EXPRESSION, 80),

    EQUAL_TO(ConstantKind.EQUAL_TO, TokenKind.EQUAL, NodeKind.EQUALITY_EXPRESSION, 70),
    NOT_EQUAL_TO(ConstantKind.NOT_EQUAL_TO, TokenKind.NOT_EQUAL, NodeKind.EQUALITY_EXPRESSION, 70),

    AS(ConstantKind.AS, TokenKind.KEYWORD_AS, NodeKind.AS_EXPRESSION, 60),
    IS(ConstantKind.IS, TokenKind.KEYWORD_IS, NodeKind.IS_EXPRESSION, 50),
    AND(ConstantKind.AND, TokenKind.KEYWORD_AND, NodeKind.LOGICAL_EXPRESSION, 40),
    OR(ConstantKind.OR, TokenKind.KEYWORD_OR, NodeKind.LOGICAL_EXPRESSION, 30),
    NULL_COALESCING(ConstantKind.NULL_COALESCING, TokenKind.NULL_COALESCING_OPERATOR, NodeKind.NULL_COALESCING_EXPRESSION, 20);

    private static final Map<TokenKind, BinOpOperator> BY_TOKEN_KIND = new EnumMap<>(TokenKind.class);
    private static final Map<ConstantKind, BinOpOperator> BY_CONSTANT_KIND = new EnumMap<>(ConstantKind.class);

    static {
        for (BinOpOperator operator : values()) {
            BY_TOKEN_KIND.put(operator.tokenKind, operator);
            BY_CONSTANT_KIND.put(operator.constantKind, operator);
        }
    }

    private final ConstantKind constantKind;
    private final TokenKind tokenKind;
    private final NodeKind nodeKind;
    private final int precedence;

    BinOpOperator(ConstantKind constantKind, TokenKind tokenKind, NodeKind nodeKind, int precedence) {
        this.constantKind = constantKind;
        this.tokenKind = tokenKind;
        this.nodeKind = nodeKind;
        this.precedence = precedence;
    }

    public ConstantKind constantKind() {
        return constantKind;
    }

    public TokenKind tokenKind() {
        return tokenKind;
    }

    public NodeKind nodeKind() {
        return nodeKind;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * @return the operator a token of this kind starts, or null when it is not a binary operator
     */
    public static BinOpOperator fromTokenKind(TokenKind tokenKind) {
        return tokenKind == null ? null : BY_TOKEN_KIND.get(tokenKind);
    }

    public static BinOpOperator fromConstantKind(ConstantKind constantKind) {
        return BY_CONSTANT_KIND.get(constantKind);
    }

    /**
     * Distinct precedences of the operators producing any of the given node kinds, loosest first.
     */
    public static List<Integer> precedencesOf(NodeKind... nodeKinds) {
        TreeSet<Integer> precedences = new TreeSet<>();
        for (BinOpOperator operator : values()) {
            for (NodeKind nodeKind : nodeKinds) {
                if (operator.nodeKind == nodeKind) {
                    precedences.add(operator.precedence);
                }
            }
        }
        return new ArrayList<>(precedences);
    }
}
