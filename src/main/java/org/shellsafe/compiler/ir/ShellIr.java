package org.shellsafe.compiler.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statements of the shell IR. Like {@link ShellValue}, the variant set is closed and every
 * consumer implements {@link Visitor}. All variants are immutable; rewrites build new values.
 */
public sealed interface ShellIr permits ShellIr.Assign, ShellIr.Echo, ShellIr.If, ShellIr.Case, ShellIr.For,
		ShellIr.ForEach, ShellIr.While, ShellIr.FunctionDef, ShellIr.Call, ShellIr.Sequence, ShellIr.Return,
		ShellIr.Break, ShellIr.Continue, ShellIr.Exit, ShellIr.Noop {

	<R> R accept(Visitor<R> visitor);

	/**
	 * Visitor over every statement variant.
	 * @param <R> The result type.
	 */
	interface Visitor<R> {
		R visitAssign(Assign ir);
		R visitEcho(Echo ir);
		R visitIf(If ir);
		R visitCase(Case ir);
		R visitFor(For ir);
		R visitForEach(ForEach ir);
		R visitWhile(While ir);
		R visitFunctionDef(FunctionDef ir);
		R visitCall(Call ir);
		R visitSequence(Sequence ir);
		R visitReturn(Return ir);
		R visitBreak(Break ir);
		R visitContinue(Continue ir);
		R visitExit(Exit ir);
		R visitNoop(Noop ir);
	}

	/**
	 * {@code name=value}.
	 */
	record Assign(String name, ShellValue value) implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAssign(this);
		}
	}

	/**
	 * Prints a value.
	 * @param stderr Print to standard error instead of standard output.
	 * @param newline Terminate the output with a newline.
	 */
	record Echo(ShellValue value, boolean stderr, boolean newline) implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEcho(this);
		}
	}

	/**
	 * A conditional. An else branch that is itself an {@code If} renders as {@code elif}.
	 */
	record If(ShellValue condition, ShellIr thenBranch, Optional<ShellIr> elseBranch) implements ShellIr {
		public If {
			Objects.requireNonNull(elseBranch, "elseBranch");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIf(this);
		}
	}

	/**
	 * One arm of a {@link Case}.
	 * @param patterns Literal values matched exactly; empty together with {@code catchAll}.
	 * @param catchAll Whether the arm matches everything.
	 * @param body The statements of the arm.
	 */
	record CaseArm(List<String> patterns, boolean catchAll, ShellIr body) {
		public CaseArm {
			patterns = List.copyOf(patterns);
		}
	}

	/**
	 * {@code case value in ... esac}.
	 */
	record Case(ShellValue scrutinee, List<CaseArm> arms) implements ShellIr {
		public Case {
			arms = List.copyOf(arms);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCase(this);
		}
	}

	/**
	 * Iteration over an inclusive integer range, rendered with {@code seq}.
	 * @param last The last value, inclusive.
	 */
	record For(String variable, ShellValue first, ShellValue last, ShellIr body) implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFor(this);
		}
	}

	/**
	 * Iteration over a fixed list of words.
	 */
	record ForEach(String variable, List<ShellValue> items, ShellIr body) implements ShellIr {
		public ForEach {
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitForEach(this);
		}
	}

	record While(ShellValue condition, ShellIr body) implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWhile(this);
		}
	}

	/**
	 * A shell function. Parameters are bound from the positional parameters at entry.
	 * @param returnsValue Whether the function prints its result for use in {@code $(...)}.
	 */
	record FunctionDef(String name, List<String> parameters, ShellIr body, boolean returnsValue) implements ShellIr {
		public FunctionDef {
			parameters = List.copyOf(parameters);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunctionDef(this);
		}
	}

	/**
	 * A command: a user function, a runtime helper or an external program.
	 * @param program The command word; always a plain, safe word.
	 * @param arguments The arguments, each rendered as one word.
	 */
	record Call(String program, List<ShellValue> arguments) implements ShellIr {
		public Call {
			arguments = List.copyOf(arguments);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCall(this);
		}
	}

	record Sequence(List<ShellIr> statements) implements ShellIr {
		public Sequence {
			statements = List.copyOf(statements);
		}

		public static ShellIr of(List<ShellIr> statements) {
			return statements.size() == 1 ? statements.get(0) : new Sequence(statements);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSequence(this);
		}
	}

	/**
	 * Leaves the current function with status 0. A result is printed by a preceding {@link Echo}.
	 */
	record Return() implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitReturn(this);
		}
	}

	record Break() implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBreak(this);
		}
	}

	record Continue() implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitContinue(this);
		}
	}

	/**
	 * Terminates the script.
	 * @param code The exit status.
	 */
	record Exit(ShellValue code) implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExit(this);
		}
	}

	record Noop() implements ShellIr {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNoop(this);
		}
	}
}
