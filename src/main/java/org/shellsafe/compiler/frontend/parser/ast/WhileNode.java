package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A {@code while} loop.
 *
 * @param id The canonical node id.
 * @param span The span of the {@code while} keyword.
 * @param condition The loop condition.
 * @param body The loop body.
 */
public record WhileNode(NodeId id, SourceSpan span, ExprNode condition, BlockNode body) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
