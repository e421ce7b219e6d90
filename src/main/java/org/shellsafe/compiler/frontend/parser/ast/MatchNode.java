package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code match} statement.
 *
 * @param id The canonical node id.
 * @param span The span of the {@code match} keyword.
 * @param scrutinee The matched value.
 * @param arms The arms in source order.
 */
public record MatchNode(NodeId id, SourceSpan span, ExprNode scrutinee, List<MatchArmNode> arms) implements StmtNode {

    public MatchNode {
        arms = List.copyOf(arms);
    }

    /**
     * @return {@code true} if any arm uses a range pattern.
     */
    public boolean hasRangePatterns() {
        return arms.stream().flatMap(a -> a.patterns().stream()).anyMatch(RangePatternNode.class::isInstance);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(scrutinee);
        children.addAll(arms);
        return children;
    }
}
