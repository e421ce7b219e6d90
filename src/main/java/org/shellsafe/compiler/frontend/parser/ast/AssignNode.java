package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * Assignment to an existing binding. Compound assignments ({@code a += b}) arrive here already
 * desugared into {@code a = a + b}.
 *
 * @param id The canonical node id.
 * @param span The span of the target name.
 * @param target The assigned name.
 * @param value The new value.
 */
public record AssignNode(NodeId id, SourceSpan span, String target, ExprNode value) implements StmtNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
