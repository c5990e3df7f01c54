package com.mqparser.engine;

import com.mqparser.ast.BinOpExpression;
import com.mqparser.ast.BinOpOperator;
import com.mqparser.ast.Constant;
import com.mqparser.ast.ConstantKind;
import com.mqparser.ast.LiteralExpression;
import com.mqparser.ast.LiteralKind;
import com.mqparser.ast.Node;
import com.mqparser.ast.NodeKind;
import com.mqparser.ast.TokenRange;
import com.mqparser.lexer.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorRunTest {

    private static TokenRange range(int index) {
        return new TokenRange(index, index, Position.START, Position.START);
    }

    private static LiteralExpression literal(int id, int index) {
        return new LiteralExpression(id, range(index), String.valueOf(id), LiteralKind.NUMERIC);
    }

    @Test
    void testAddKeepsOneMoreOperandThanOperators() {
        OperatorRun run = new OperatorRun(literal(1, 0));
        assertTrue(run.isConsistent());
        assertTrue(run.operators().isEmpty());

        run.add(BinOpOperator.ADDITION, new Constant(2, range(1), ConstantKind.ADDITION), literal(3, 2));
        run.add(BinOpOperator.MULTIPLICATION, new Constant(4, range(3), ConstantKind.MULTIPLICATION), literal(5, 4));

        assertTrue(run.isConsistent());
        assertEquals(3, run.operands().size());
        assertEquals(List.of(BinOpOperator.ADDITION, BinOpOperator.MULTIPLICATION), run.operators());
        assertEquals(2, run.operatorConstants().size());
    }

    @Test
    void testSplice() {
        OperatorRun run = new OperatorRun(literal(1, 0));
        Constant plus = new Constant(2, range(1), ConstantKind.ADDITION);
        Constant times = new Constant(4, range(3), ConstantKind.MULTIPLICATION);
        run.add(BinOpOperator.ADDITION, plus, literal(3, 2));
        run.add(BinOpOperator.MULTIPLICATION, times, literal(5, 4));

        Node combined = new BinOpExpression(6, NodeKind.ARITHMETIC_EXPRESSION,
            new TokenRange(2, 4, Position.START, Position.START), run.operands().get(1), times, run.operands().get(2));
        run.splice(1, combined);

        assertTrue(run.isConsistent());
        assertEquals(List.of(BinOpOperator.ADDITION), run.operators());
        assertEquals(List.of(plus), run.operatorConstants());
        assertSame(combined, run.operands().get(1));
    }

    @Test
    void testViewsAreReadOnly() {
        OperatorRun run = new OperatorRun(literal(1, 0));
        assertThrows(UnsupportedOperationException.class, () -> run.operands().clear());
        assertThrows(UnsupportedOperationException.class, () -> run.operators().add(BinOpOperator.AND));
    }
}
