package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A {@code for} loop over a range or over the elements of a {@code vec!} binding.
 *
 * @param id The canonical node id.
 * @param span The span of the {@code for} keyword.
 * @param variable The loop variable.
 * @param iterable A {@link RangeExpr}, a variable bound to {@code vec!}, or a {@code vec!} literal.
 * @param body The loop body.
 */
public record ForNode(NodeId id, SourceSpan span, String variable, ExprNode iterable, BlockNode body) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(iterable, body);
    }
}
