package org.shellsafe.compiler.frontend.parser.ast;

/**
 * Marker for {@code match} arm patterns.
 */
public interface PatternNode extends AstNode {
}
