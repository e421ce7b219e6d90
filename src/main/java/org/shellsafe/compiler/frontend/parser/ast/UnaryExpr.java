package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A prefix operation.
 *
 * @param id The canonical node id.
 * @param span The span of the operator.
 * @param operator The operator.
 * @param operand The operand.
 */
public record UnaryExpr(NodeId id, SourceSpan span, Operator operator, ExprNode operand) implements ExprNode {

    /**
     * Prefix operators.
     */
    public enum Operator {
        /** Logical negation. */
        NOT,
        /** Arithmetic negation. */
        NEGATE
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
