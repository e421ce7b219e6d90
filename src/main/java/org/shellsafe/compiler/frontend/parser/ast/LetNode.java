package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A {@code let} binding.
 *
 * @param id The canonical node id.
 * @param span The span of the bound name.
 * @param name The bound name.
 * @param mutable Whether the binding was declared {@code mut}.
 * @param declaredType The annotated type, or {@code null} when inferred.
 * @param initializer The initial value.
 */
public record LetNode(NodeId id, SourceSpan span, String name, boolean mutable, SourceType declaredType,
                      ExprNode initializer) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer);
    }
}
