package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code if} statement. An {@code else if} chain is represented as an else block whose only
 * statement is another {@link IfNode}.
 *
 * @param id The canonical node id.
 * @param span The span of the {@code if} keyword.
 * @param condition The condition.
 * @param thenBlock The block taken when the condition holds.
 * @param elseBlock The else block, or {@code null}.
 */
public record IfNode(NodeId id, SourceSpan span, ExprNode condition, BlockNode thenBlock, BlockNode elseBlock)
        implements StmtNode {

    /**
     * @return The nested {@code if} when the else block is an {@code else if}, otherwise {@code null}.
     */
    public IfNode elseIf() {
        if (elseBlock != null && elseBlock.statements().size() == 1 && elseBlock.statements().get(0) instanceof IfNode nested) {
            return nested;
        }
        return null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBlock);
        if (elseBlock != null) children.add(elseBlock);
        return children;
    }
}
