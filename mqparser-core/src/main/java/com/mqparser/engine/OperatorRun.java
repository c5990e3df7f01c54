package com.mqparser.engine;

import com.mqparser.ast.BinOpOperator;
import com.mqparser.ast.Constant;
import com.mqparser.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A flat {@code operand (operator operand)*} sequence collected before precedence is applied.
 * There is always exactly one more operand than there are operators.
 */
final class OperatorRun {

    private final List<Node> operands = new ArrayList<>();
    private final List<BinOpOperator> operators = new ArrayList<>();
    private final List<Constant> operatorConstants = new ArrayList<>();

    OperatorRun(Node first) {
        operands.add(first);
    }

    void add(BinOpOperator operator, Constant operatorConstant, Node operand) {
        operators.add(operator);
        operatorConstants.add(operatorConstant);
        operands.add(operand);
    }

    /**
     * Replaces {@code operand[index] operator[index] operand[index + 1]} with a single combined operand.
     */
    void splice(int index, Node combined) {
        operands.set(index, combined);
        operands.remove(index + 1);
        operators.remove(index);
        operatorConstants.remove(index);
    }

    List<Node> operands() {
        return Collections.unmodifiableList(operands);
    }

    List<BinOpOperator> operators() {
        return Collections.unmodifiableList(operators);
    }

    List<Constant> operatorConstants() {
        return Collections.unmodifiableList(operatorConstants);
    }

    boolean isConsistent() {
        return operands.size() == operators.size() + 1 && operators.size() == operatorConstants.size();
    }
}
