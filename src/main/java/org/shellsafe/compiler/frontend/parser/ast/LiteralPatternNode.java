package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * A literal {@code match} pattern.
 *
 * @param id The canonical node id.
 * @param span The span of the literal.
 * @param value A {@link Long}, {@link String} or {@link Boolean}.
 */
public record LiteralPatternNode(NodeId id, SourceSpan span, Object value) implements PatternNode {
}
