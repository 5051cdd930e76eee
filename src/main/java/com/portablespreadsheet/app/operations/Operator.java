package com.portablespreadsheet.app.operations;

import java.util.Optional;

/**
 * Binary and unary operators a cell can apply. Each operator knows its key
 * in the grammar tables and how to compute its value.
 */
public enum Operator {
    ADD("add", 2),
    SUBTRACT("subtract", 2),
    MULTIPLY("multiply", 2),
    DIVIDE("divide", 2),
    MODULO("modulo", 2),
    POWER("power", 2),
    EQUAL_TO("equalTo", 2),
    NOT_EQUAL_TO("notEqualTo", 2),
    GREATER_THAN("greaterThan", 2),
    GREATER_THAN_OR_EQUAL_TO("greaterThanOrEqualTo", 2),
    LESS_THAN("lessThan", 2),
    LESS_THAN_OR_EQUAL_TO("lessThanOrEqualTo", 2),
    LOGICAL_CONJUNCTION("logicalConjunction", 2),
    LOGICAL_DISJUNCTION("logicalDisjunction", 2),
    CONCATENATE("concatenate", 2),
    LOGARITHM("logarithm", 1),
    EXPONENTIAL("exponential", 1),
    CEIL("ceil", 1),
    FLOOR("floor", 1),
    ROUND("round", 1),
    ABS("abs", 1),
    SQRT("sqrt", 1),
    SIGNUM("signum", 1),
    LOGICAL_NEGATION("logicalNegation", 1),
    BRACKETS("brackets", 1);

    private final String grammarKey;
    private final int arity;

    Operator(String grammarKey, int arity) {
        this.grammarKey = grammarKey;
        this.arity = arity;
    }

    public String getGrammarKey() {
        return grammarKey;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    public static Optional<Operator> fromGrammarKey(String key) {
        for (Operator operator : values()) {
            if (operator.grammarKey.equals(key)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    public Object evaluate(Object left, Object right) {
        switch (this) {
            case ADD:
                return CellValues.add(left, right);
            case SUBTRACT:
                return CellValues.subtract(left, right);
            case MULTIPLY:
                return CellValues.multiply(left, right);
            case DIVIDE:
                return CellValues.divide(left, right);
            case MODULO:
                return CellValues.modulo(left, right);
            case POWER:
                return CellValues.power(left, right);
            case EQUAL_TO:
                return CellValues.equalTo(left, right);
            case NOT_EQUAL_TO:
                return CellValues.notEqualTo(left, right);
            case GREATER_THAN:
                return CellValues.greaterThan(left, right);
            case GREATER_THAN_OR_EQUAL_TO:
                return CellValues.greaterThanOrEqualTo(left, right);
            case LESS_THAN:
                return CellValues.lessThan(left, right);
            case LESS_THAN_OR_EQUAL_TO:
                return CellValues.lessThanOrEqualTo(left, right);
            case LOGICAL_CONJUNCTION:
                return CellValues.logicalConjunction(left, right);
            case LOGICAL_DISJUNCTION:
                return CellValues.logicalDisjunction(left, right);
            case CONCATENATE:
                return CellValues.concatenate(left, right);
            default:
                throw new IllegalStateException(name() + " is not a binary operator");
        }
    }

    public Object evaluate(Object operand) {
        switch (this) {
            case LOGARITHM:
                return CellValues.logarithm(operand);
            case EXPONENTIAL:
                return CellValues.exponential(operand);
            case CEIL:
                return CellValues.ceil(operand);
            case FLOOR:
                return CellValues.floor(operand);
            case ROUND:
                return CellValues.round(operand);
            case ABS:
                return CellValues.abs(operand);
            case SQRT:
                return CellValues.sqrt(operand);
            case SIGNUM:
                return CellValues.signum(operand);
            case LOGICAL_NEGATION:
                return CellValues.logicalNegation(operand);
            case BRACKETS:
                return operand;
            default:
                throw new IllegalStateException(name() + " is not a unary operator");
        }
    }
}
