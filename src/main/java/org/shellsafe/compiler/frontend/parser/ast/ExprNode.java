package org.shellsafe.compiler.frontend.parser.ast;

/**
 * Marker for expression nodes.
 */
public interface ExprNode extends AstNode {
}
