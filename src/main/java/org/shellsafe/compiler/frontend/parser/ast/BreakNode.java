package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * A {@code break} statement.
 *
 * @param id The canonical node id.
 * @param span The span of the keyword.
 */
public record BreakNode(NodeId id, SourceSpan span) implements StmtNode {
}
