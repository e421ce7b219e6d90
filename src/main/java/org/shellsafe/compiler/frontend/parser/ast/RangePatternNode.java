package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * An integer range pattern such as {@code 1..=5}.
 *
 * @param id The canonical node id.
 * @param span The span of the pattern.
 * @param low The lower bound, inclusive.
 * @param high The upper bound.
 * @param inclusive Whether {@code high} itself matches.
 */
public record RangePatternNode(NodeId id, SourceSpan span, long low, long high, boolean inclusive) implements PatternNode {

    /**
     * @return The largest matching value.
     */
    public long inclusiveHigh() {
        return inclusive ? high : high - 1;
    }
}
