package org.shellsafe.compiler.frontend.parser.ast;

/**
 * Marker for statement nodes.
 */
public interface StmtNode extends AstNode {
}
