package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * {@code true} or {@code false}.
 *
 * @param id The canonical node id.
 * @param span The span of the literal.
 * @param value The value.
 */
public record BoolLiteralExpr(NodeId id, SourceSpan span, boolean value) implements ExprNode {
}
