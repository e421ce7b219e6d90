package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

/**
 * A typed function parameter.
 *
 * @param id The canonical node id.
 * @param span The span of the parameter name.
 * @param name The parameter name.
 * @param mutable Whether the parameter was declared {@code mut}.
 * @param type The parameter type.
 */
public record ParameterNode(NodeId id, SourceSpan span, String name, boolean mutable, SourceType type) implements AstNode {
}
