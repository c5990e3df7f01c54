package com.mqparser.engine;

import com.mqparser.ast.BinOpExpression;
import com.mqparser.ast.BinOpOperator;
import com.mqparser.ast.Constant;
import com.mqparser.ast.Node;
import com.mqparser.ast.NodeKind;
import com.mqparser.ast.TokenRange;
import com.mqparser.error.InvariantException;
import com.mqparser.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parser that reads binary expressions as a flat operator run and groups it by precedence
 * afterwards, instead of descending one production per precedence level.
 * <p>
 * The produced tree, token ranges and error positions are the same as {@link NaiveParser}'s.
 * Everything that is not a binary expression is inherited unchanged.
 */
public class CombinatorialParser extends NaiveParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(CombinatorialParser.class);

    public CombinatorialParser(ParseState state) {
        super(state);
    }

    @Override
    protected Node readNullCoalescing() {
        return readBinOpExpression(NodeKind.NULL_COALESCING_EXPRESSION);
    }

    @Override
    protected Node readLogical() {
        return readBinOpExpression(NodeKind.LOGICAL_EXPRESSION);
    }

    @Override
    protected Node readEquality() {
        return readBinOpExpression(NodeKind.EQUALITY_EXPRESSION);
    }

    @Override
    protected Node readRelational() {
        return readBinOpExpression(NodeKind.RELATIONAL_EXPRESSION);
    }

    @Override
    protected Node readArithmetic() {
        return readBinOpExpression(NodeKind.ARITHMETIC_EXPRESSION);
    }

    @Override
    protected Node readMetadata() {
        return readBinOpExpression(NodeKind.METADATA_EXPRESSION);
    }

    /**
     * Dispatches on the current token alone. Anything that is not an obvious primary expression
     * start goes through the regular unary production.
     */
    @Override
    protected Node readUnary() {
        state.checkCancellation();
        TokenKind kind = state.currentTokenKind();
        if (kind == null) {
            return super.readUnary();
        }
        if (HASH_KEYWORD_EXPRESSIONS.contains(kind)) {
            return readRecursiveSuffixes(readKeyword());
        }
        return switch (kind) {
            case HEX_LITERAL, KEYWORD_FALSE, KEYWORD_TRUE, NUMERIC_LITERAL, NULL_LITERAL, TEXT_LITERAL ->
                readRecursiveSuffixes(readLiteralExpression());
            case AT_SIGN, IDENTIFIER -> readRecursiveSuffixes(readIdentifierExpression());
            case LEFT_PARENTHESIS -> readRecursiveSuffixes(readParenthesizedExpression());
            case LEFT_BRACKET -> readRecursiveSuffixes(readBracketDisambiguation(PRIMARY_BRACKET_VARIANTS));
            case LEFT_BRACE -> readRecursiveSuffixes(readListExpression());
            case ELLIPSIS -> readRecursiveSuffixes(readNotImplementedExpression());
            case KEYWORD_TYPE -> readTypeExpression();
            default -> super.readUnary();
        };
    }

    /**
     * Reads {@code unary (operator operand)*} under a placeholder context, then groups the run.
     * The placeholder is unwrapped once the run is combined.
     */
    private Node readBinOpExpression(NodeKind entryKind) {
        state.checkCancellation();
        int placeholderId = state.startContext(entryKind);
        OperatorRun run = new OperatorRun(readUnary());

        BinOpOperator operator = BinOpOperator.fromTokenKind(state.currentTokenKind());
        while (operator != null) {
            // The operator and operand are read under a throwaway context, then detached for combining
            int throwawayId = state.startContext(operator.nodeKind());
            Constant operatorConstant = readTokenKindAsConstant(operator.tokenKind(), operator.constantKind());
            Node operand = readOperand(operator);
            state.registry().detach(operatorConstant.id());
            state.registry().detach(operand.id());
            state.deleteContext(throwawayId);
            run.add(operator, operatorConstant, operand);

            BinOpOperator next = BinOpOperator.fromTokenKind(state.currentTokenKind());
            if (next == null || endsRun(operator, next)) {
                break;
            }
            operator = next;
        }

        return combine(placeholderId, run);
    }

    private Node readOperand(BinOpOperator operator) {
        return switch (operator) {
            case AS, IS -> readNullablePrimitiveType();
            case NULL_COALESCING -> readLogical();
            default -> readUnary();
        };
    }

    /**
     * Whether {@code next} must be left for an enclosing production, matching where the
     * precedence-level productions stop reading.
     */
    private static boolean endsRun(BinOpOperator operator, BinOpOperator next) {
        return switch (operator) {
            // The right operand already took every following ??
            case NULL_COALESCING -> true;
            // A type operand cannot be the left side of a tighter operator
            case AS, IS -> next.precedence() > operator.precedence();
            // Only one meta per metadata expression
            case META -> next == BinOpOperator.META;
            default -> false;
        };
    }

    /**
     * Groups the run tightest operator first, left to right among equals, and returns the single
     * remaining operand. Nodes are reparented into the binary expressions as they are built.
     */
    Node combine(int placeholderId, OperatorRun run) {
        NodeRegistry registry = state.registry();

        int operatorCount = run.operators().size();
        LOGGER.debug("Combining {} operators: {}", operatorCount, run.operators());
        List<Integer> order = new ArrayList<>(operatorCount);
        for (int i = 0; i < operatorCount; i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer>comparingInt(i -> -run.operators().get(i).precedence())
            .thenComparingInt(i -> i));
        int[] leftIndexes = order.stream().mapToInt(Integer::intValue).toArray();

        for (int i = 0; i < leftIndexes.length; i++) {
            int index = leftIndexes[i];
            BinOpOperator operator = run.operators().get(index);
            Constant operatorConstant = run.operatorConstants().get(index);
            Node left = run.operands().get(index);
            Node right = run.operands().get(index + 1);
            NodeKind kind = operator.nodeKind();

            state.setCurrentContextId(placeholderId);
            int binOpId = state.startContextAt(kind, left.tokenRange().tokenIndexStart(), placeholderId);

            BinOpValidator validator = BinOpValidator.forOperator(operator);
            if (!validator.acceptsLeft(left)) {
                LOGGER.debug("Left operand {} rejected by {}, re-reading it", left.kind(), validator);
                state.setTokenIndex(left.tokenRange().tokenIndexStart());
                readFallback(validator.leftFallback());
                throw new InvariantException("Left operand " + left.kind() + " of " + operator
                    + " was rejected but re-reading it succeeded");
            }
            if (!validator.acceptsRight(right)) {
                LOGGER.debug("Right operand {} rejected by {}, re-reading it", right.kind(), validator);
                state.setTokenIndex(operatorConstant.tokenRange().tokenIndexEnd() + 1);
                readFallback(validator.rightFallback());
                throw new InvariantException("Right operand " + right.kind() + " of " + operator
                    + " was rejected but re-reading it succeeded");
            }

            registry.reparent(left.id(), binOpId);
            registry.reparent(operatorConstant.id(), binOpId);
            registry.reparent(right.id(), binOpId);

            state.setTokenIndex(right.tokenRange().tokenIndexEnd() + 1);
            TokenRange tokenRange = new TokenRange(
                left.tokenRange().tokenIndexStart(),
                right.tokenRange().tokenIndexEnd(),
                left.tokenRange().positionStart(),
                right.tokenRange().positionEnd());
            BinOpExpression combined = state.endContext(new BinOpExpression(binOpId, kind, tokenRange, left,
                operatorConstant, right));

            run.splice(index, combined);
            for (int j = i + 1; j < leftIndexes.length; j++) {
                if (leftIndexes[j] > index) {
                    leftIndexes[j]--;
                }
            }
        }

        if (!run.isConsistent() || run.operands().size() != 1) {
            throw new InvariantException("Operator run did not reduce to a single operand: "
                + run.operands().size() + " operands, " + run.operators().size() + " operators");
        }

        state.setCurrentContextId(placeholderId);
        state.deleteContext(placeholderId);
        return run.operands().get(0);
    }

    private Node readFallback(BinOpValidator.Fallback fallback) {
        return switch (fallback) {
            case READ_UNARY -> super.readUnary();
            case READ_METADATA -> super.readMetadata();
            case READ_EQUALITY -> super.readEquality();
            case READ_NULLABLE_PRIMITIVE_TYPE -> readNullablePrimitiveType();
            case READ_LOGICAL -> super.readLogical();
            case READ_IS -> readIs();
        };
    }
}
