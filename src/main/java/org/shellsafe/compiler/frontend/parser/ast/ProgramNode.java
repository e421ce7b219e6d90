package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * The root of the AST: the ordered functions of one compilation unit.
 *
 * @param id The canonical node id.
 * @param span The span of the whole unit.
 * @param functions The functions in source order.
 */
public record ProgramNode(NodeId id, SourceSpan span, List<FunctionNode> functions) implements AstNode {

    public ProgramNode {
        functions = List.copyOf(functions);
    }

    /**
     * Looks up a function by name.
     * @param name The function name.
     * @return The first function with that name, if present.
     */
    public Optional<FunctionNode> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(functions);
    }
}
