package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.ir.ArithmeticOp;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellIrRewriter;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Evaluates constant subexpressions: integer arithmetic and comparisons of literals, negation
 * and short-circuit operators with a constant left operand, and concatenations of literal parts.
 * Arithmetic that the shell would reject or that overflows a signed 64-bit value is left alone.
 */
public final class ConstantFoldingRule implements IOptimizationRule {

	private static final Pattern INTEGER = Pattern.compile("^-?[0-9]+$");

	@Override
	public String name() {
		return "constant-folding";
	}

	@Override
	public boolean isEnabled(CompilerConfig config) {
		return config.enableConstantFolding();
	}

	@Override
	public IrProgram apply(IrProgram program, CompilerConfig config) {
		Folder folder = new Folder();
		List<ShellIr.FunctionDef> functions = new ArrayList<>();
		for (ShellIr.FunctionDef function : program.functions()) {
			functions.add((ShellIr.FunctionDef) folder.rewrite(function));
		}
		return program.withFunctions(functions);
	}

	/**
	 * Folds a single value; exposed for the other rules and for tests.
	 */
	public static ShellValue fold(ShellValue value) {
		return new Folder().rewrite(value);
	}

	static OptionalLong evaluate(ArithmeticOp op, long lhs, long rhs) {
		try {
			switch (op) {
				case ADD: return OptionalLong.of(Math.addExact(lhs, rhs));
				case SUB: return OptionalLong.of(Math.subtractExact(lhs, rhs));
				case MUL: return OptionalLong.of(Math.multiplyExact(lhs, rhs));
				case DIV:
					if (rhs == 0 || lhs == Long.MIN_VALUE && rhs == -1) return OptionalLong.empty();
					return OptionalLong.of(lhs / rhs);
				case REM:
					if (rhs == 0 || lhs == Long.MIN_VALUE && rhs == -1) return OptionalLong.empty();
					return OptionalLong.of(lhs % rhs);
				case BIT_AND: return OptionalLong.of(lhs & rhs);
				case BIT_OR: return OptionalLong.of(lhs | rhs);
				case BIT_XOR: return OptionalLong.of(lhs ^ rhs);
				case SHL:
					if (rhs < 0 || rhs > 62) return OptionalLong.empty();
					return OptionalLong.of(Math.multiplyExact(lhs, 1L << rhs));
				case SHR:
					if (rhs < 0 || rhs > 63) return OptionalLong.empty();
					return OptionalLong.of(lhs >> rhs);
				default:
					return OptionalLong.empty();
			}
		} catch (ArithmeticException overflow) {
			return OptionalLong.empty();
		}
	}

	private static OptionalLong integerValue(ShellValue value) {
		if (value instanceof ShellValue.Literal literal && INTEGER.matcher(literal.text()).matches()) {
			try {
				return OptionalLong.of(Long.parseLong(literal.text()));
			} catch (NumberFormatException tooLarge) {
				return OptionalLong.empty();
			}
		}
		return OptionalLong.empty();
	}

	/**
	 * @return The text of a constant word, or {@code null}.
	 */
	private static String constantText(ShellValue value) {
		if (value instanceof ShellValue.Literal literal) return literal.text();
		if (value instanceof ShellValue.Bool bool) return Boolean.toString(bool.value());
		return null;
	}

	private static final class Folder extends ShellIrRewriter {

		@Override
		public ShellValue visitArithmetic(ShellValue.Arithmetic value) {
			ShellValue lhs = rewrite(value.lhs());
			ShellValue rhs = rewrite(value.rhs());
			OptionalLong left = integerValue(lhs);
			OptionalLong right = integerValue(rhs);
			if (left.isPresent() && right.isPresent()) {
				OptionalLong result = evaluate(value.op(), left.getAsLong(), right.getAsLong());
				if (result.isPresent()) {
					return ShellValue.Literal.of(result.getAsLong());
				}
			}
			return new ShellValue.Arithmetic(value.op(), lhs, rhs);
		}

		@Override
		public ShellValue visitComparison(ShellValue.Comparison value) {
			ShellValue lhs = rewrite(value.lhs());
			ShellValue rhs = rewrite(value.rhs());
			if (value.numeric()) {
				OptionalLong left = integerValue(lhs);
				OptionalLong right = integerValue(rhs);
				if (left.isPresent() && right.isPresent()) {
					return ShellValue.Bool.of(value.op().evaluate(left.getAsLong(), right.getAsLong()));
				}
			} else {
				String left = constantText(lhs);
				String right = constantText(rhs);
				if (left != null && right != null) {
					boolean equal = left.equals(right);
					switch (value.op()) {
						case EQ: return ShellValue.Bool.of(equal);
						case NE: return ShellValue.Bool.of(!equal);
						default: break;
					}
				}
			}
			return new ShellValue.Comparison(value.op(), lhs, rhs, value.numeric());
		}

		@Override
		public ShellValue visitLogicalNot(ShellValue.LogicalNot value) {
			ShellValue operand = rewrite(value.operand());
			if (operand instanceof ShellValue.Bool bool) {
				return ShellValue.Bool.of(!bool.value());
			}
			return new ShellValue.LogicalNot(operand);
		}

		@Override
		public ShellValue visitLogicalAnd(ShellValue.LogicalAnd value) {
			ShellValue lhs = rewrite(value.lhs());
			ShellValue rhs = rewrite(value.rhs());
			if (lhs instanceof ShellValue.Bool bool) {
				return bool.value() ? rhs : ShellValue.Bool.FALSE;
			}
			return new ShellValue.LogicalAnd(lhs, rhs);
		}

		@Override
		public ShellValue visitLogicalOr(ShellValue.LogicalOr value) {
			ShellValue lhs = rewrite(value.lhs());
			ShellValue rhs = rewrite(value.rhs());
			if (lhs instanceof ShellValue.Bool bool) {
				return bool.value() ? ShellValue.Bool.TRUE : rhs;
			}
			return new ShellValue.LogicalOr(lhs, rhs);
		}

		@Override
		public ShellValue visitConcat(ShellValue.Concat value) {
			List<ShellValue> parts = new ArrayList<>();
			StringBuilder pending = null;
			for (ShellValue part : value.parts()) {
				ShellValue folded = rewrite(part);
				List<ShellValue> pieces = folded instanceof ShellValue.Concat nested ? nested.parts() : List.of(folded);
				for (ShellValue piece : pieces) {
					String text = constantText(piece);
					if (text != null) {
						if (pending == null) pending = new StringBuilder();
						pending.append(text);
					} else {
						if (pending != null) {
							parts.add(new ShellValue.Literal(pending.toString()));
							pending = null;
						}
						parts.add(piece);
					}
				}
			}
			if (pending != null) {
				parts.add(new ShellValue.Literal(pending.toString()));
			}
			if (parts.isEmpty()) {
				return new ShellValue.Literal("");
			}
			if (parts.size() == 1 && !(parts.get(0) instanceof ShellValue.Arithmetic)) {
				return parts.get(0);
			}
			return new ShellValue.Concat(parts);
		}
	}
}
