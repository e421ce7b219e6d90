package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * An infix operation.
 *
 * @param id The canonical node id.
 * @param span The span of the operator.
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryExpr(NodeId id, SourceSpan span, Operator operator, ExprNode left, ExprNode right) implements ExprNode {

    /**
     * Infix operators of the subset.
     */
    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), REM("%"),
        BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"), SHL("<<"), SHR(">>"),
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
        AND("&&"), OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        /**
         * @return The operator as written in the source.
         */
        public String symbol() {
            return symbol;
        }

        /**
         * @return {@code true} for operators producing an integer.
         */
        public boolean isArithmetic() {
            return ordinal() <= SHR.ordinal();
        }

        /**
         * @return {@code true} for comparison operators.
         */
        public boolean isComparison() {
            return ordinal() >= EQ.ordinal() && ordinal() <= GE.ordinal();
        }

        /**
         * @return {@code true} for {@code &&} and {@code ||}.
         */
        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
