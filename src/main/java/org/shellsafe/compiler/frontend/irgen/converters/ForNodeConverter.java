package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.irgen.ExpressionLowering;
import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.LocalVariable;
import org.shellsafe.compiler.frontend.irgen.LoweringException;
import org.shellsafe.compiler.frontend.irgen.TypedValue;
import org.shellsafe.compiler.frontend.parser.ast.ExprNode;
import org.shellsafe.compiler.frontend.parser.ast.ForNode;
import org.shellsafe.compiler.frontend.parser.ast.IntLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.RangeExpr;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.VariableExpr;
import org.shellsafe.compiler.frontend.parser.ast.VecMacroExpr;
import org.shellsafe.compiler.ir.ArithmeticOp;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@link ForNode}. Ranges are normalized to an inclusive upper bound: {@code a..b} iterates
 * up to {@code b - 1} (folded when {@code b} is a literal), {@code a..=b} up to {@code b}.
 * Iteration over a vector becomes a {@link ShellIr.ForEach} over its element variables.
 */
public final class ForNodeConverter implements IAstNodeToIrConverter<ForNode> {

	@Override
	public void convert(ForNode node, IrGenContext ctx) {
		ExpressionLowering expressions = ctx.expressions();
		if (node.iterable() instanceof RangeExpr range) {
			ShellValue first = expressions.integer(range.start());
			ShellValue last = upperBound(range, expressions);
			ctx.pushScope();
			try {
				LocalVariable variable = ctx.declare(node.variable(), SourceType.INTEGER);
				ctx.emit(new ShellIr.For(variable.scriptName(), first, last, ctx.lowerBlock(node.body())));
			} finally {
				ctx.popScope();
			}
			return;
		}

		List<ShellValue> items = new ArrayList<>();
		SourceType elementType;
		if (node.iterable() instanceof VariableExpr) {
			LocalVariable vector = expressions.vector(node.iterable());
			vector.elements().forEach(element -> items.add(new ShellValue.VariableRef(element)));
			elementType = vector.elementType();
		} else if (node.iterable() instanceof VecMacroExpr vec) {
			elementType = null;
			for (ExprNode element : vec.elements()) {
				TypedValue value = expressions.lower(element);
				if (elementType != null && elementType != value.type()) {
					throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
							"All elements of vec! must have the same type.", element.span());
				}
				elementType = value.type();
				items.add(expressions.asWord(value, element));
			}
			if (elementType == null) elementType = SourceType.STRING;
		} else {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"A for loop iterates over a range or a vec! binding.", node.iterable().span());
		}

		ctx.pushScope();
		try {
			LocalVariable variable = ctx.declare(node.variable(), elementType);
			ctx.emit(new ShellIr.ForEach(variable.scriptName(), items, ctx.lowerBlock(node.body())));
		} finally {
			ctx.popScope();
		}
	}

	private static ShellValue upperBound(RangeExpr range, ExpressionLowering expressions) {
		if (range.inclusive()) {
			return expressions.integer(range.end());
		}
		if (range.end() instanceof IntLiteralExpr literal) {
			return ShellValue.Literal.of(literal.value() - 1);
		}
		return new ShellValue.Arithmetic(ArithmeticOp.SUB, expressions.integer(range.end()), ShellValue.Literal.of(1));
	}
}
