package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.irgen.ExpressionLowering;
import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.LoweringException;
import org.shellsafe.compiler.frontend.irgen.TypedValue;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.ReturnNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.StmtNode;
import org.shellsafe.compiler.ir.ShellIr;

import java.util.List;

/**
 * Converts {@link ReturnNode}. A function with a result prints it on standard output, where the
 * caller's command substitution collects it. The final statement of a body needs no {@code return}.
 */
public final class ReturnNodeConverter implements IAstNodeToIrConverter<ReturnNode> {

	@Override
	public void convert(ReturnNode node, IrGenContext ctx) {
		FunctionNode function = ctx.currentFunction();
		if (ctx.inValueFunction()) {
			if (node.value() == null) {
				throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
						"'" + function.name() + "' must return " + ExpressionLowering.describe(function.returnType()) + ".",
						node.span());
			}
			TypedValue value = ctx.expressions().lower(node.value());
			checkType(function, value, node);
			ctx.emit(new ShellIr.Echo(ctx.expressions().asWord(value, node.value()), false, true));
		} else if (node.value() != null) {
			TypedValue value = ctx.expressions().lower(node.value());
			checkType(function, value, node);
		}
		if (!isLastStatement(function, node)) {
			ctx.emit(new ShellIr.Return());
		}
	}

	private static void checkType(FunctionNode function, TypedValue value, ReturnNode node) {
		if (value.type() != function.returnType()) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"'" + function.name() + "' returns " + ExpressionLowering.describe(function.returnType())
							+ " but this value is " + ExpressionLowering.describe(value.type()) + ".", node.span());
		}
	}

	private static boolean isLastStatement(FunctionNode function, ReturnNode node) {
		List<StmtNode> statements = function.body().statements();
		return !statements.isEmpty() && statements.get(statements.size() - 1) == node;
	}
}
