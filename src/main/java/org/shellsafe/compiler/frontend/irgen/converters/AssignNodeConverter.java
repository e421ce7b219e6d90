package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.irgen.ExpressionLowering;
import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.LocalVariable;
import org.shellsafe.compiler.frontend.irgen.LoweringException;
import org.shellsafe.compiler.frontend.irgen.TypedValue;
import org.shellsafe.compiler.frontend.parser.ast.AssignNode;

/**
 * Converts {@link AssignNode}. Compound assignments arrive already desugared by the parser.
 */
public final class AssignNodeConverter implements IAstNodeToIrConverter<AssignNode> {

	@Override
	public void convert(AssignNode node, IrGenContext ctx) {
		LocalVariable variable = ctx.lookup(node.target(), node);
		if (variable.isVector()) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"The vector '" + node.target() + "' cannot be reassigned.", node.span());
		}
		TypedValue value = ctx.expressions().lower(node.value());
		if (value.type() != variable.type()) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"Cannot assign " + ExpressionLowering.describe(value.type()) + " to '" + node.target() + "', which holds "
							+ ExpressionLowering.describe(variable.type()) + ".", node.span());
		}
		ctx.emit(LetNodeConverter.store(variable.scriptName(), value, ctx.expressions()));
	}
}
