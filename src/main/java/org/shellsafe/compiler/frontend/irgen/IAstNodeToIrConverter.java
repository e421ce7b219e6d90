package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.frontend.parser.ast.AstNode;

/**
 * Lowers one kind of statement or item node. Converters keep no state: the generated statements
 * go to {@link IrGenContext#emit}, and names are resolved through the context's scopes.
 *
 * @param <T> The node type this converter lowers.
 */
@FunctionalInterface
public interface IAstNodeToIrConverter<T extends AstNode> {

	/**
	 * Lowers a node.
	 *
	 * @param node The node.
	 * @param ctx  The lowering state of the current function.
	 * @throws LoweringException if the node cannot be expressed safely in the shell.
	 */
	void convert(T node, IrGenContext ctx);
}
