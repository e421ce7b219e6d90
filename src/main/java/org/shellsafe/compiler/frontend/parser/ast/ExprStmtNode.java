package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * An expression evaluated for its effect.
 *
 * @param id The canonical node id.
 * @param span The span of the expression.
 * @param expression The expression.
 */
public record ExprStmtNode(NodeId id, SourceSpan span, ExprNode expression) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
