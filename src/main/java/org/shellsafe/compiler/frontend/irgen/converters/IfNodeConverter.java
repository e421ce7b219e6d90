package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.parser.ast.IfNode;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.Optional;

/**
 * Converts {@link IfNode}. An {@code else if} whose condition needs no statements of its own
 * stays a nested {@link ShellIr.If} directly in the else branch, which the emitter renders as {@code elif}.
 */
public final class IfNodeConverter implements IAstNodeToIrConverter<IfNode> {

	@Override
	public void convert(IfNode node, IrGenContext ctx) {
		IrGenContext.Captured<ShellValue> condition = ctx.capture(() -> ctx.expressions().condition(node.condition()));
		condition.statements().forEach(ctx::emit);

		ShellIr thenBranch = ctx.lowerBlock(node.thenBlock());
		Optional<ShellIr> elseBranch = Optional.empty();
		if (node.elseBlock() != null) {
			ShellIr lowered = ctx.lowerBlock(node.elseBlock());
			if (lowered instanceof ShellIr.Sequence sequence && sequence.statements().size() == 1
					&& sequence.statements().get(0) instanceof ShellIr.If nested) {
				lowered = nested;
			}
			elseBranch = Optional.of(lowered);
		}
		ctx.emit(new ShellIr.If(condition.result(), thenBranch, elseBranch));
	}
}
