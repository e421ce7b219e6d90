package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * A {@code continue} statement.
 *
 * @param id The canonical node id.
 * @param span The span of the keyword.
 */
public record ContinueNode(NodeId id, SourceSpan span) implements StmtNode {
}
