package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;

/**
 * A braced statement sequence. Blocks open a new variable scope.
 *
 * @param id The canonical node id.
 * @param span The span of the opening brace.
 * @param statements The statements in source order.
 */
public record BlockNode(NodeId id, SourceSpan span, List<StmtNode> statements) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
