package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * The catch-all pattern {@code _}.
 *
 * @param id The canonical node id.
 * @param span The span of the underscore.
 */
public record WildcardPatternNode(NodeId id, SourceSpan span) implements PatternNode {
}
