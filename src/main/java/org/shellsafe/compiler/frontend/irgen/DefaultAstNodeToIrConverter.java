package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;

/**
 * Default/fallback converter used when no specific converter is registered.
 * Every node the frontend accepts must have a converter, so reaching this one is an internal error.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

	@Override
	public void convert(AstNode node, IrGenContext ctx) {
		throw new LoweringException(CompilerErrorCode.MISSING_LOWERING_RULE,
				"No lowering rule for node type " + node.getClass().getSimpleName() + ".", node.span());
	}
}
