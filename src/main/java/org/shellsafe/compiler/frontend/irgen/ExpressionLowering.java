package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.parser.ast.BinaryExpr;
import org.shellsafe.compiler.frontend.parser.ast.BoolLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.CallExpr;
import org.shellsafe.compiler.frontend.parser.ast.ExprNode;
import org.shellsafe.compiler.frontend.parser.ast.FormatMacroExpr;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.IndexExpr;
import org.shellsafe.compiler.frontend.parser.ast.IntLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.ParameterNode;
import org.shellsafe.compiler.frontend.parser.ast.RangeExpr;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.StringLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.UnaryExpr;
import org.shellsafe.compiler.frontend.parser.ast.VariableExpr;
import org.shellsafe.compiler.frontend.parser.ast.VecMacroExpr;
import org.shellsafe.compiler.frontend.semantics.StdlibFunction;
import org.shellsafe.compiler.ir.ArithmeticOp;
import org.shellsafe.compiler.ir.ComparisonOp;
import org.shellsafe.compiler.ir.IdentifierMangler;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers expressions to typed {@link ShellValue}s. Side effects an expression needs before its
 * value can be used (calls of unit functions, materialized booleans) are emitted into the
 * current block of the {@link IrGenContext}.
 * <p>
 * Booleans have two shapes. As a condition they are {@code test} expressions or command statuses;
 * as a value (in a variable, an argument or on stdout) they are the words {@code true} and
 * {@code false}. {@link #asCondition} and {@link #asWord} convert between the two.
 */
public final class ExpressionLowering {

	private static final ShellValue NO_VALUE = new ShellValue.Literal("");

	private final IrGenContext ctx;
	private final StdlibLowering stdlib;

	ExpressionLowering(IrGenContext ctx) {
		this.ctx = ctx;
		this.stdlib = new StdlibLowering(ctx, this);
	}

	/**
	 * Lowers an expression.
	 * @param expr The expression.
	 * @return The value and its kind; {@link SourceType#UNIT} for expressions evaluated only for effect.
	 */
	public TypedValue lower(ExprNode expr) {
		if (expr instanceof IntLiteralExpr literal) {
			return new TypedValue(ShellValue.Literal.of(literal.value()), SourceType.INTEGER);
		}
		if (expr instanceof StringLiteralExpr literal) {
			return new TypedValue(new ShellValue.Literal(literal.value()), SourceType.STRING);
		}
		if (expr instanceof BoolLiteralExpr literal) {
			return new TypedValue(ShellValue.Bool.of(literal.value()), SourceType.BOOLEAN);
		}
		if (expr instanceof VariableExpr variable) {
			LocalVariable local = ctx.lookup(variable.name(), variable);
			if (local.isVector()) {
				throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
						"The vector '" + variable.name() + "' cannot be used as a single value.", variable.span(),
						"index it with a literal, or use array_join");
			}
			return new TypedValue(new ShellValue.VariableRef(local.scriptName()), local.type());
		}
		if (expr instanceof UnaryExpr unary) {
			return lowerUnary(unary);
		}
		if (expr instanceof BinaryExpr binary) {
			return lowerBinary(binary);
		}
		if (expr instanceof CallExpr call) {
			return lowerCall(call);
		}
		if (expr instanceof FormatMacroExpr format) {
			return lowerFormat(format);
		}
		if (expr instanceof IndexExpr index) {
			return lowerIndex(index);
		}
		if (expr instanceof VecMacroExpr || expr instanceof RangeExpr) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"This expression is only allowed as a let initializer or a for iterable.", expr.span());
		}
		throw new LoweringException(CompilerErrorCode.MISSING_LOWERING_RULE,
				"No lowering rule for expression " + expr.getClass().getSimpleName() + ".", expr.span());
	}

	/**
	 * Lowers an expression that must produce a value usable as a shell word.
	 */
	public ShellValue word(ExprNode expr) {
		return asWord(lower(expr), expr);
	}

	/**
	 * Lowers an expression that must produce an integer.
	 */
	public ShellValue integer(ExprNode expr) {
		return asInteger(lower(expr), expr);
	}

	/**
	 * Lowers an expression that must produce a boolean, in condition shape.
	 */
	public ShellValue condition(ExprNode expr) {
		return asCondition(lower(expr), expr);
	}

	/**
	 * Converts a lowered value to a single shell word. Condition-shaped booleans are materialized
	 * into a temporary holding {@code true} or {@code false}.
	 */
	public ShellValue asWord(TypedValue value, ExprNode origin) {
		requireValue(value, origin);
		if (value.is(SourceType.BOOLEAN) && isConditionShaped(value.value())) {
			String temporary = ctx.newTemporary();
			ctx.emit(assignBoolean(temporary, value.value()));
			return new ShellValue.VariableRef(temporary);
		}
		return value.value();
	}

	/**
	 * Converts a lowered value to an arithmetic operand.
	 */
	public ShellValue asInteger(TypedValue value, ExprNode origin) {
		requireValue(value, origin);
		if (value.is(SourceType.STRING)) {
			throw new LoweringException(CompilerErrorCode.NON_NUMERIC_OPERAND,
					"A string value cannot be used in arithmetic.", origin.span(),
					"use an integer value; to join text use format!(\"{}{}\", a, b)");
		}
		if (!value.is(SourceType.INTEGER)) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"Expected an integer but found " + describe(value.type()) + ".", origin.span());
		}
		return value.value();
	}

	/**
	 * Converts a lowered boolean to condition shape. A boolean held as a word is compared with
	 * {@code true}.
	 */
	public ShellValue asCondition(TypedValue value, ExprNode origin) {
		requireValue(value, origin);
		if (!value.is(SourceType.BOOLEAN)) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"Expected a bool condition but found " + describe(value.type()) + ".", origin.span());
		}
		ShellValue v = value.value();
		if (v instanceof ShellValue.Bool || isConditionShaped(v)) {
			return v;
		}
		return new ShellValue.Comparison(ComparisonOp.EQ, v, ShellValue.Bool.TRUE, false);
	}

	/**
	 * Builds the statement storing a boolean into a variable as a word.
	 * @param target The script name of the variable.
	 * @param value The boolean, in either shape.
	 */
	public ShellIr assignBoolean(String target, ShellValue value) {
		if (!isConditionShaped(value)) {
			return new ShellIr.Assign(target, value);
		}
		return new ShellIr.If(value, new ShellIr.Assign(target, ShellValue.Bool.TRUE),
				Optional.of(new ShellIr.Assign(target, ShellValue.Bool.FALSE)));
	}

	/**
	 * @return {@code true} if the value is a test expression or command status rather than a word.
	 */
	public static boolean isConditionShaped(ShellValue value) {
		return value instanceof ShellValue.Comparison || value instanceof ShellValue.LogicalAnd
				|| value instanceof ShellValue.LogicalOr || value instanceof ShellValue.LogicalNot
				|| value instanceof ShellValue.Predicate;
	}

	private TypedValue lowerUnary(UnaryExpr unary) {
		if (unary.operator() == UnaryExpr.Operator.NOT) {
			ShellValue operand = condition(unary.operand());
			if (operand instanceof ShellValue.Bool bool) {
				return new TypedValue(ShellValue.Bool.of(!bool.value()), SourceType.BOOLEAN);
			}
			return new TypedValue(new ShellValue.LogicalNot(operand), SourceType.BOOLEAN);
		}
		if (unary.operand() instanceof IntLiteralExpr literal) {
			return new TypedValue(ShellValue.Literal.of(-literal.value()), SourceType.INTEGER);
		}
		ShellValue operand = integer(unary.operand());
		return new TypedValue(new ShellValue.Arithmetic(ArithmeticOp.SUB, ShellValue.Literal.of(0), operand),
				SourceType.INTEGER);
	}

	private TypedValue lowerBinary(BinaryExpr binary) {
		BinaryExpr.Operator operator = binary.operator();
		if (operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR) {
			return lowerLogical(binary);
		}
		TypedValue left = lower(binary.left());
		TypedValue right = lower(binary.right());
		if (operator.isArithmetic()) {
			return lowerArithmetic(binary, left, right);
		}
		return lowerComparison(binary, left, right);
	}

	private TypedValue lowerArithmetic(BinaryExpr binary, TypedValue left, TypedValue right) {
		if (binary.operator() == BinaryExpr.Operator.ADD && left.is(SourceType.STRING) && right.is(SourceType.STRING)) {
			throw new LoweringException(CompilerErrorCode.NON_NUMERIC_OPERAND,
					"Strings cannot be joined with '+'.", binary.span(), "use format!(\"{}{}\", a, b)");
		}
		ShellValue lhs = asInteger(left, binary.left());
		ShellValue rhs = asInteger(right, binary.right());
		ArithmeticOp op = ArithmeticOp.valueOf(binary.operator().name());
		if ((op == ArithmeticOp.DIV || op == ArithmeticOp.REM) && rhs instanceof ShellValue.Literal literal
				&& "0".equals(literal.text())) {
			throw new LoweringException(CompilerErrorCode.DIVISION_BY_ZERO,
					"Division by zero.", binary.span(), "divide by a non-zero value");
		}
		return new TypedValue(new ShellValue.Arithmetic(op, lhs, rhs), SourceType.INTEGER);
	}

	private TypedValue lowerComparison(BinaryExpr binary, TypedValue left, TypedValue right) {
		ComparisonOp op = ComparisonOp.valueOf(binary.operator().name());
		requireValue(left, binary.left());
		requireValue(right, binary.right());
		if (left.type() != right.type()) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"Cannot compare " + describe(left.type()) + " with " + describe(right.type()) + ".", binary.span());
		}
		if (left.is(SourceType.INTEGER)) {
			return new TypedValue(new ShellValue.Comparison(op, left.value(), right.value(), true), SourceType.BOOLEAN);
		}
		if (op.stringOperator() == null) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"Only integers can be ordered with '" + binary.operator().symbol() + "'.", binary.span(),
					"compare with == or !=");
		}
		ShellValue lhs = asWord(left, binary.left());
		ShellValue rhs = asWord(right, binary.right());
		return new TypedValue(new ShellValue.Comparison(op, lhs, rhs, false), SourceType.BOOLEAN);
	}

	/**
	 * Lowers {@code &&} and {@code ||}. When the right operand needs statements of its own, they
	 * must only run if the left operand does not decide the result, so the whole expression is
	 * materialized through an {@code if}.
	 */
	private TypedValue lowerLogical(BinaryExpr binary) {
		boolean and = binary.operator() == BinaryExpr.Operator.AND;
		ShellValue lhs = condition(binary.left());
		IrGenContext.Captured<ShellValue> rhs = ctx.capture(() -> condition(binary.right()));
		if (rhs.statements().isEmpty()) {
			ShellValue combined = and ? new ShellValue.LogicalAnd(lhs, rhs.result()) : new ShellValue.LogicalOr(lhs, rhs.result());
			return new TypedValue(combined, SourceType.BOOLEAN);
		}
		String temporary = ctx.newTemporary();
		List<ShellIr> evaluateRight = new ArrayList<>(rhs.statements());
		evaluateRight.add(assignBoolean(temporary, rhs.result()));
		ShellIr decided = new ShellIr.Assign(temporary, ShellValue.Bool.of(!and));
		ShellIr statement = and
				? new ShellIr.If(lhs, ShellIr.Sequence.of(evaluateRight), Optional.of(decided))
				: new ShellIr.If(lhs, decided, Optional.of(ShellIr.Sequence.of(evaluateRight)));
		ctx.emit(statement);
		return new TypedValue(new ShellValue.VariableRef(temporary), SourceType.BOOLEAN);
	}

	private TypedValue lowerCall(CallExpr call) {
		FunctionNode callee = ctx.userFunction(call.callee());
		if (callee == null) {
			StdlibFunction function = StdlibFunction.lookup(call.callee())
					.orElseThrow(() -> new LoweringException(CompilerErrorCode.MISSING_LOWERING_RULE,
							"Unknown function '" + call.callee() + "' reached lowering.", call.span()));
			return stdlib.lower(function, call);
		}
		List<ShellValue> arguments = new ArrayList<>();
		for (int i = 0; i < call.arguments().size(); i++) {
			ExprNode argument = call.arguments().get(i);
			ParameterNode parameter = callee.parameters().get(i);
			TypedValue value = lower(argument);
			if (value.type() != parameter.type()) {
				throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
						"Argument '" + parameter.name() + "' of '" + callee.name() + "' expects " + describe(parameter.type())
								+ " but got " + describe(value.type()) + ".", argument.span());
			}
			arguments.add(asWord(value, argument));
		}
		ShellIr.Call invocation = new ShellIr.Call(IdentifierMangler.function(callee.name()), arguments);
		if (callee.returnType() == SourceType.UNIT) {
			ctx.emit(invocation);
			return new TypedValue(NO_VALUE, SourceType.UNIT);
		}
		return new TypedValue(new ShellValue.CommandSubst(invocation), callee.returnType());
	}

	private TypedValue lowerFormat(FormatMacroExpr format) {
		List<ShellValue> parts = new ArrayList<>();
		for (int i = 0; i < format.pieces().size(); i++) {
			String piece = format.pieces().get(i);
			if (!piece.isEmpty()) {
				parts.add(new ShellValue.Literal(piece));
			}
			if (i < format.arguments().size()) {
				parts.add(word(format.arguments().get(i)));
			}
		}
		ShellValue text = new ShellValue.Concat(parts);
		if (format.kind() == FormatMacroExpr.Kind.FORMAT) {
			return new TypedValue(text, SourceType.STRING);
		}
		boolean stderr = format.kind() == FormatMacroExpr.Kind.EPRINTLN || format.kind() == FormatMacroExpr.Kind.EPRINT
				|| ctx.inValueFunction();
		boolean newline = format.kind() != FormatMacroExpr.Kind.PRINT && format.kind() != FormatMacroExpr.Kind.EPRINT;
		ctx.emit(new ShellIr.Echo(text, stderr, newline));
		return new TypedValue(NO_VALUE, SourceType.UNIT);
	}

	private TypedValue lowerIndex(IndexExpr index) {
		LocalVariable vector = vector(index.target());
		if (!(index.index() instanceof IntLiteralExpr position)) {
			throw new LoweringException(CompilerErrorCode.LITERAL_REQUIRED,
					"Vector indices must be integer literals.", index.index().span());
		}
		if (position.value() < 0 || position.value() >= vector.elements().size()) {
			throw new LoweringException(CompilerErrorCode.INDEX_OUT_OF_BOUNDS,
					"Index " + position.value() + " is out of bounds for a vector of " + vector.elements().size()
							+ " elements.", index.index().span());
		}
		String element = vector.elements().get((int) position.value());
		return new TypedValue(new ShellValue.VariableRef(element), vector.elementType());
	}

	/**
	 * Resolves an expression that must name a {@code vec!} binding.
	 */
	public LocalVariable vector(ExprNode expr) {
		if (expr instanceof VariableExpr variable) {
			LocalVariable local = ctx.lookup(variable.name(), variable);
			if (local.isVector()) {
				return local;
			}
		}
		throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
				"Expected a variable bound to vec!.", expr.span());
	}

	private static void requireValue(TypedValue value, ExprNode origin) {
		if (value.is(SourceType.UNIT)) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"This expression produces no value.", origin.span());
		}
	}

	public static String describe(SourceType type) {
		return switch (type) {
			case INTEGER -> "an integer";
			case STRING -> "a string";
			case BOOLEAN -> "a bool";
			case VECTOR -> "a vector";
			case UNIT -> "no value";
		};
	}
}
