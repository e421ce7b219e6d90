package org.shellsafe.compiler.frontend.parser.ast;

import org.shellsafe.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * A function definition.
 *
 * @param id The canonical node id.
 * @param span The span of the function name.
 * @param name The function name as written.
 * @param parameters The typed parameters in declaration order.
 * @param returnType The declared return type, {@link SourceType#UNIT} when omitted.
 * @param body The function body.
 */
public record FunctionNode(NodeId id, SourceSpan span, String name, List<ParameterNode> parameters,
                           SourceType returnType, BlockNode body) implements AstNode {

    public FunctionNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.add(body);
        return children;
    }
}
