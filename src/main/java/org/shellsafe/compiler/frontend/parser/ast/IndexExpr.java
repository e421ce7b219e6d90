package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * {@code target[index]}; the index must be an integer literal, the target a {@code vec!} binding.
 *
 * @param id The canonical node id.
 * @param span The span of the opening bracket.
 * @param target The indexed expression.
 * @param index The index expression.
 */
public record IndexExpr(NodeId id, SourceSpan span, ExprNode target, ExprNode index) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, index);
    }
}
