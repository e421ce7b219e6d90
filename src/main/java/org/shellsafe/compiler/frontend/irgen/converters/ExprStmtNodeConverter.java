package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.frontend.irgen.ExpressionLowering;
import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.TypedValue;
import org.shellsafe.compiler.frontend.parser.ast.ExprStmtNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.ir.CommandPolicy;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.List;
import java.util.Optional;

/**
 * Converts {@link ExprStmtNode}. Unit expressions emit their effect while being lowered. A value
 * that is discarded is still evaluated: a command substitution is assigned to a temporary so that
 * a failing command stops the script, anything else is passed to {@code :}.
 */
public final class ExprStmtNodeConverter implements IAstNodeToIrConverter<ExprStmtNode> {

	@Override
	public void convert(ExprStmtNode node, IrGenContext ctx) {
		TypedValue value = ctx.expressions().lower(node.expression());
		if (value.is(SourceType.UNIT)) {
			return;
		}
		ShellValue v = value.value();
		if (ExpressionLowering.isConditionShaped(v)) {
			ctx.emit(new ShellIr.If(v, new ShellIr.Noop(), Optional.empty()));
		} else if (v instanceof ShellValue.CommandSubst) {
			ctx.emit(new ShellIr.Assign(ctx.newTemporary(), v));
		} else {
			ctx.emit(new ShellIr.Call(CommandPolicy.DISCARD, List.of(v)));
		}
	}
}
