package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * {@code vec![a, b, c]}.
 *
 * @param id The canonical node id.
 * @param span The span of the macro name.
 * @param elements The elements in order.
 */
public record VecMacroExpr(NodeId id, SourceSpan span, List<ExprNode> elements) implements ExprNode {

    public VecMacroExpr {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
