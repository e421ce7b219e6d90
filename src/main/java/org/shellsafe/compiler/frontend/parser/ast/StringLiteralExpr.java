package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * A string literal with escapes already resolved.
 *
 * @param id The canonical node id.
 * @param span The span of the literal.
 * @param value The unescaped text.
 */
public record StringLiteralExpr(NodeId id, SourceSpan span, String value) implements ExprNode {
}
