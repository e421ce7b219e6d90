package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * One arm of a {@code match}: alternative patterns and the arm body.
 *
 * @param id The canonical node id.
 * @param span The span of the first pattern.
 * @param patterns The alternatives ({@code 1 | 2 => ...}).
 * @param body The arm body; expression arms are wrapped into a single-statement block.
 */
public record MatchArmNode(NodeId id, SourceSpan span, List<PatternNode> patterns, BlockNode body) implements AstNode {

    public MatchArmNode {
        patterns = List.copyOf(patterns);
    }

    /**
     * @return {@code true} if one of the alternatives is {@code _}.
     */
    public boolean isCatchAll() {
        return patterns.stream().anyMatch(WildcardPatternNode.class::isInstance);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(patterns);
        children.add(body);
        return children;
    }
}
