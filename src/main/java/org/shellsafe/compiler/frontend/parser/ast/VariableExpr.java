package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * A reference to a variable or parameter.
 *
 * @param id The canonical node id.
 * @param span The span of the name.
 * @param name The referenced name.
 */
public record VariableExpr(NodeId id, SourceSpan span, String name) implements ExprNode {
}
