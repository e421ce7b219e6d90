package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A {@code return} statement, or the tail expression of a function body.
 *
 * @param id The canonical node id.
 * @param span The span of the keyword or tail expression.
 * @param value The returned value, or {@code null} for a bare {@code return}.
 */
public record ReturnNode(NodeId id, SourceSpan span, ExprNode value) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
