package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * {@code start..end} or {@code start..=end}; only valid as a {@code for} iterable.
 *
 * @param id The canonical node id.
 * @param span The span of the range operator.
 * @param start The first value.
 * @param end The upper bound.
 * @param inclusive {@code true} for {@code ..=}.
 */
public record RangeExpr(NodeId id, SourceSpan span, ExprNode start, ExprNode end, boolean inclusive) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(start, end);
    }
}
