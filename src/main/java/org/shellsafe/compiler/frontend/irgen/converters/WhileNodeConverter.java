package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.parser.ast.WhileNode;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts {@link WhileNode}. A condition that needs statements before it can be tested is
 * re-evaluated at the top of every iteration of an endless loop that breaks when it fails.
 */
public final class WhileNodeConverter implements IAstNodeToIrConverter<WhileNode> {

	@Override
	public void convert(WhileNode node, IrGenContext ctx) {
		IrGenContext.Captured<ShellValue> condition = ctx.capture(() -> ctx.expressions().condition(node.condition()));
		ShellIr body = ctx.lowerBlock(node.body());
		if (condition.statements().isEmpty()) {
			ctx.emit(new ShellIr.While(condition.result(), body));
			return;
		}
		List<ShellIr> loop = new ArrayList<>(condition.statements());
		loop.add(new ShellIr.If(new ShellValue.LogicalNot(condition.result()), new ShellIr.Break(), Optional.empty()));
		loop.add(body);
		ctx.emit(new ShellIr.While(ShellValue.Bool.TRUE, new ShellIr.Sequence(loop)));
	}
}
