package com.ndf.cnl.model;

import java.util.List;
import java.util.function.Predicate;

/**
 * Trigger condition inside a transition's prior state, e.g. {@code Spark|Flame}.
 * Operands are evaluated for existence/activation, not for boolean values.
 */
public record LogicalOperatorNode(Operator operator, List<StateRef> operands) implements StateEntry {

    public LogicalOperatorNode {
        if (operands == null || operands.size() < 2)
            throw new IllegalArgumentException("Logical operator needs at least two operands");
        operands = List.copyOf(operands);
    }

    @Override
    public List<StateRef> refs() {
        return operands;
    }

    @Override
    public boolean isSatisfied(Predicate<StateRef> active) {
        return switch (operator) {
            case AND -> operands.stream().allMatch(active);
            case OR -> operands.stream().anyMatch(active);
        };
    }

    public enum Operator {
        AND('&'),
        OR('|');

        private final char symbol;

        Operator(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }
    }
}
