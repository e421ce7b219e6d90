package org.shellsafe.compiler.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Values of the shell IR. The variant set is closed; every consumer implements
 * {@link Visitor}, so a new variant is a compile error in every stage until it is handled.
 */
public sealed interface ShellValue permits ShellValue.Literal, ShellValue.VariableRef, ShellValue.Concat,
		ShellValue.CommandSubst, ShellValue.EnvVar, ShellValue.Arithmetic, ShellValue.Bool, ShellValue.Comparison,
		ShellValue.LogicalAnd, ShellValue.LogicalOr, ShellValue.LogicalNot, ShellValue.Predicate, ShellValue.Arg,
		ShellValue.ArgCount {

	/** Names of environment variables and shell variables. */
	Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

	<R> R accept(Visitor<R> visitor);

	/**
	 * Visitor over every value variant.
	 * @param <R> The result type.
	 */
	interface Visitor<R> {
		R visitLiteral(Literal value);
		R visitVariableRef(VariableRef value);
		R visitConcat(Concat value);
		R visitCommandSubst(CommandSubst value);
		R visitEnvVar(EnvVar value);
		R visitArithmetic(Arithmetic value);
		R visitBool(Bool value);
		R visitComparison(Comparison value);
		R visitLogicalAnd(LogicalAnd value);
		R visitLogicalOr(LogicalOr value);
		R visitLogicalNot(LogicalNot value);
		R visitPredicate(Predicate value);
		R visitArg(Arg value);
		R visitArgCount(ArgCount value);
	}

	/**
	 * A compile-time constant string.
	 * @param text The unescaped text.
	 */
	record Literal(String text) implements ShellValue {
		public Literal {
			Objects.requireNonNull(text, "text");
		}

		/**
		 * @return A literal holding the decimal form of {@code value}.
		 */
		public static Literal of(long value) {
			return new Literal(Long.toString(value));
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLiteral(this);
		}
	}

	/**
	 * A reference to a (mangled) shell variable.
	 * @param name The variable name as it appears in the script.
	 */
	record VariableRef(String name) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitVariableRef(this);
		}
	}

	/**
	 * Several values rendered as one word.
	 * @param parts The parts in order.
	 */
	record Concat(List<ShellValue> parts) implements ShellValue {
		public Concat {
			parts = List.copyOf(parts);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitConcat(this);
		}
	}

	/**
	 * The standard output of a statement, as by {@code $(...)}.
	 * @param inner The statement to run.
	 */
	record CommandSubst(ShellIr inner) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCommandSubst(this);
		}
	}

	/**
	 * An environment variable with an optional fallback. The name is checked on construction;
	 * an invalid name can never reach the emitter.
	 * @param name The variable name.
	 * @param defaultValue The value used when the variable is unset or empty.
	 */
	record EnvVar(String name, Optional<ShellValue> defaultValue) implements ShellValue {
		public EnvVar {
			Objects.requireNonNull(defaultValue, "defaultValue");
			if (name == null || !NAME_PATTERN.matcher(name).matches()) {
				throw new IllegalArgumentException("Invalid environment variable name: " + name);
			}
		}

		public EnvVar(String name) {
			this(name, Optional.empty());
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEnvVar(this);
		}
	}

	/**
	 * An arithmetic expansion. Any integer-producing value is a legal operand, including
	 * command substitutions and nested arithmetic.
	 */
	record Arithmetic(ArithmeticOp op, ShellValue lhs, ShellValue rhs) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArithmetic(this);
		}
	}

	/**
	 * A boolean constant. As a word it renders as {@code true} or {@code false}.
	 */
	record Bool(boolean value) implements ShellValue {
		public static final Bool TRUE = new Bool(true);
		public static final Bool FALSE = new Bool(false);

		public static Bool of(boolean value) {
			return value ? TRUE : FALSE;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBool(this);
		}
	}

	/**
	 * A {@code test} comparison.
	 * @param numeric {@code true} for integer comparison ({@code -eq} etc.), {@code false} for strings.
	 */
	record Comparison(ComparisonOp op, ShellValue lhs, ShellValue rhs, boolean numeric) implements ShellValue {
		public Comparison {
			if (!numeric && op.stringOperator() == null) {
				throw new IllegalArgumentException("Strings cannot be compared with " + op);
			}
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitComparison(this);
		}
	}

	record LogicalAnd(ShellValue lhs, ShellValue rhs) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLogicalAnd(this);
		}
	}

	record LogicalOr(ShellValue lhs, ShellValue rhs) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLogicalOr(this);
		}
	}

	record LogicalNot(ShellValue operand) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLogicalNot(this);
		}
	}

	/**
	 * The exit status of a command used as a condition.
	 * @param call The command.
	 */
	record Predicate(ShellIr.Call call) implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPredicate(this);
		}
	}

	/**
	 * A positional parameter of the script.
	 * @param position The position, starting at 1.
	 */
	record Arg(int position) implements ShellValue {
		public Arg {
			if (position < 1) {
				throw new IllegalArgumentException("Argument positions start at 1: " + position);
			}
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArg(this);
		}
	}

	/**
	 * The number of positional parameters.
	 */
	record ArgCount() implements ShellValue {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArgCount(this);
		}
	}
}
