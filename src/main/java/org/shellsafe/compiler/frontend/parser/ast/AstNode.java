package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every accepted node carries a canonical id and the span it was parsed from.
 */
public interface AstNode {

    /**
     * @return The canonical id, unique within one parsed program.
     */
    NodeId id();

    /**
     * @return The source span of the node.
     */
    SourceSpan span();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic tree walk without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
