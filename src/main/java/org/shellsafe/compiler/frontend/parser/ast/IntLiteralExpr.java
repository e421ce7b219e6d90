package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * An integer literal.
 *
 * @param id The canonical node id.
 * @param span The span of the literal.
 * @param value The value.
 */
public record IntLiteralExpr(NodeId id, SourceSpan span, long value) implements ExprNode {
}
