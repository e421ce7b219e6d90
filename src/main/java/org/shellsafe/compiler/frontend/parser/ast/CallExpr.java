package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A call of a user function or of an allow-listed stdlib function.
 *
 * @param id The canonical node id.
 * @param span The span of the callee name.
 * @param callee The called name.
 * @param arguments The arguments in order.
 */
public record CallExpr(NodeId id, SourceSpan span, String callee, List<ExprNode> arguments) implements ExprNode {

    public CallExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
