package org.shellsafe.compiler.frontend.parser.ast;

/**
 * Canonical id of an AST node. Ids are assigned sequentially in parse order,
 * so the same source always yields the same ids.
 *
 * @param value The sequence number, starting at 0.
 */
public record NodeId(int value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
