package com.ndf.cnl.io;

import com.ndf.cnl.model.LogicalOperatorNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A transition state line, e.g.
 * {@code priorState: Hydrogen:basic, Oxygen:basic, Spark|Flame}.
 */
public record StateRecord(Phase phase, List<Term> terms) implements Statement {

    public StateRecord {
        terms = List.copyOf(terms);
    }

    @Override
    public String toCnl() {
        return phase.keyword() + ": " + terms.stream().map(Term::toCnl).collect(Collectors.joining(", "));
    }

    public enum Phase {
        PRIOR("priorState"),
        POST("postState");

        private final String keyword;

        Phase(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    /**
     * One comma-separated entry. A single operand has no operator.
     */
    public record Term(LogicalOperatorNode.Operator operator, List<Operand> operands) {

        public Term {
            operands = List.copyOf(operands);
        }

        public String toCnl() {
            String sep = operator == null ? "" : String.valueOf(operator.symbol());
            return operands.stream().map(Operand::toCnl).collect(Collectors.joining(sep));
        }
    }

    /** {@code Name} or {@code Name:morph}. */
    public record Operand(NodeName node, String morph) {

        public String toCnl() {
            return morph == null ? node.toCnl() : node.toCnl() + ":" + morph;
        }
    }
}
