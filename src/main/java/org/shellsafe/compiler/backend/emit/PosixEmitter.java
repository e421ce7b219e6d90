package org.shellsafe.compiler.backend.emit;

import org.shellsafe.compiler.ir.ComparisonOp;
import org.shellsafe.compiler.ir.IdentifierMangler;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.RuntimeHelper;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase: renders an {@link IrProgram} as POSIX sh text.
 * <p>
 * Rendering depends on nothing but the program and the version string: collections are walked
 * in their list order, so the same program always yields byte-identical text. All values go
 * through {@link ShellQuoter}.
 */
public final class PosixEmitter {

	public static final String SHEBANG = "#!/bin/sh";

	private static final String INDENT = "    ";
	private static final String ENTRY_POINT = IdentifierMangler.function("main");

	private final String version;

	/**
	 * @param version The compiler version written into the provenance header.
	 */
	public PosixEmitter(String version) {
		this.version = version;
	}

	/**
	 * Emits a complete script.
	 * @param program The validated program.
	 * @return The script text, ending with a newline.
	 * @throws EmissionException if the program contains a shape without a rendering.
	 */
	public String emit(IrProgram program) {
		StringBuilder out = new StringBuilder();
		header(out, program);

		for (RuntimeHelper helper : program.helpers()) {
			out.append(helper.functionName()).append("() (\n");
			for (String line : helper.body()) {
				out.append(INDENT).append(line).append('\n');
			}
			out.append(")\n\n");
		}

		ShellIr.FunctionDef main = null;
		for (ShellIr.FunctionDef function : program.functions()) {
			if (function.name().equals(ENTRY_POINT)) {
				main = function;
			} else {
				function(out, function);
			}
		}
		if (main == null) {
			throw new EmissionException("The program has no main function.");
		}
		function(out, main);
		out.append(ENTRY_POINT).append(" \"$@\"\n");
		return out.toString();
	}

	private void header(StringBuilder out, IrProgram program) {
		out.append(SHEBANG).append('\n');
		out.append("# Generated by shellsafe ").append(version).append(" from ").append(oneLine(program.sourceName())).append('\n');
		out.append("# Source: sha256:").append(program.sourceDigest()).append('\n');
		out.append("# Do not edit: regenerate from the source instead.\n");
		out.append("set -euf\n");
		out.append("IFS=\"$(printf ' \\t\\n_')\"; IFS=\"${IFS%_}\"\n");
		out.append("export LC_ALL=C\n\n");
	}

	private static String oneLine(String text) {
		return text.replaceAll("[\\p{Cntrl}]", "?");
	}

	private void function(StringBuilder out, ShellIr.FunctionDef function) {
		out.append(function.name()).append("() {\n");
		Writer writer = new Writer(0);
		writer.block(function.body());
		out.append(writer.text());
		out.append("}\n\n");
	}

	/**
	 * Renders a statement for use inside {@code $(...)}.
	 */
	String inline(ShellIr ir) {
		Writer writer = new Writer(0);
		ir.accept(writer);
		String text = writer.text();
		return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
	}

	/**
	 * Renders statements line by line at an indentation level.
	 */
	private final class Writer implements ShellIr.Visitor<Void> {
		private final StringBuilder out = new StringBuilder();
		private final ShellQuoter quoter = new ShellQuoter(PosixEmitter.this::inline);
		private final ConditionRenderer conditions = new ConditionRenderer(quoter);
		private int level;

		Writer(int level) {
			this.level = level;
		}

		String text() {
			return out.toString();
		}

		private void line(String text) {
			for (int i = 0; i < level; i++) {
				out.append(INDENT);
			}
			out.append(text).append('\n');
		}

		/**
		 * Writes a nested body one level deeper; an empty body becomes {@code :}.
		 */
		void block(ShellIr body) {
			level++;
			int before = out.length();
			body.accept(this);
			if (out.length() == before) {
				line(":");
			}
			level--;
		}

		@Override
		public Void visitAssign(ShellIr.Assign ir) {
			line(ir.name() + "=" + quoter.assignmentValue(ir.value()));
			return null;
		}

		@Override
		public Void visitEcho(ShellIr.Echo ir) {
			String format = ir.newline() ? "'%s\\n'" : "'%s'";
			line("printf " + format + " " + quoter.word(ir.value()) + (ir.stderr() ? " >&2" : ""));
			return null;
		}

		@Override
		public Void visitIf(ShellIr.If ir) {
			line("if " + conditions.render(ir.condition()) + "; then");
			block(ir.thenBranch());
			ShellIr rest = ir.elseBranch().orElse(null);
			while (rest instanceof ShellIr.If elif) {
				line("elif " + conditions.render(elif.condition()) + "; then");
				block(elif.thenBranch());
				rest = elif.elseBranch().orElse(null);
			}
			if (rest != null) {
				line("else");
				block(rest);
			}
			line("fi");
			return null;
		}

		@Override
		public Void visitCase(ShellIr.Case ir) {
			line("case " + quoter.word(ir.scrutinee()) + " in");
			level++;
			for (ShellIr.CaseArm arm : ir.arms()) {
				List<String> patterns = new ArrayList<>();
				for (String pattern : arm.patterns()) {
					patterns.add(ShellQuoter.singleQuote(pattern));
				}
				line((arm.catchAll() ? "*" : String.join("|", patterns)) + ")");
				block(arm.body());
				level++;
				line(";;");
				level--;
			}
			level--;
			line("esac");
			return null;
		}

		@Override
		public Void visitFor(ShellIr.For ir) {
			line("for " + ir.variable() + " in $(seq " + quoter.word(ir.first()) + " " + quoter.word(ir.last()) + "); do");
			block(ir.body());
			line("done");
			return null;
		}

		@Override
		public Void visitForEach(ShellIr.ForEach ir) {
			StringBuilder items = new StringBuilder();
			for (ShellValue item : ir.items()) {
				items.append(' ').append(quoter.word(item));
			}
			line("for " + ir.variable() + " in" + items + "; do");
			block(ir.body());
			line("done");
			return null;
		}

		@Override
		public Void visitWhile(ShellIr.While ir) {
			line("while " + conditions.render(ir.condition()) + "; do");
			block(ir.body());
			line("done");
			return null;
		}

		@Override
		public Void visitFunctionDef(ShellIr.FunctionDef ir) {
			throw new EmissionException("Nested function definition: " + ir.name());
		}

		@Override
		public Void visitCall(ShellIr.Call ir) {
			line(command(ir, quoter));
			return null;
		}

		@Override
		public Void visitSequence(ShellIr.Sequence ir) {
			for (ShellIr statement : ir.statements()) {
				statement.accept(this);
			}
			return null;
		}

		@Override
		public Void visitReturn(ShellIr.Return ir) {
			line("return 0");
			return null;
		}

		@Override
		public Void visitBreak(ShellIr.Break ir) {
			line("break");
			return null;
		}

		@Override
		public Void visitContinue(ShellIr.Continue ir) {
			line("continue");
			return null;
		}

		@Override
		public Void visitExit(ShellIr.Exit ir) {
			line("exit " + quoter.word(ir.code()));
			return null;
		}

		@Override
		public Void visitNoop(ShellIr.Noop ir) {
			line(":");
			return null;
		}
	}

	static String command(ShellIr.Call call, ShellQuoter quoter) {
		StringBuilder text = new StringBuilder(call.program());
		for (ShellValue argument : call.arguments()) {
			text.append(' ').append(quoter.word(argument));
		}
		return text.toString();
	}

	/**
	 * Renders condition-shaped values as command lists for {@code if} and {@code while}.
	 * {@code &&} and {@code ||} have equal precedence in the shell, so a nested list is grouped
	 * with braces unless it is the left operand of the same operator.
	 */
	private static final class ConditionRenderer implements ShellValue.Visitor<String> {
		private final ShellQuoter quoter;

		ConditionRenderer(ShellQuoter quoter) {
			this.quoter = quoter;
		}

		String render(ShellValue condition) {
			return condition.accept(this);
		}

		private String group(ShellValue operand) {
			return "{ " + operand.accept(this) + "; }";
		}

		private String wordTest(ShellValue value) {
			return "[ " + quoter.word(value) + " = true ]";
		}

		@Override
		public String visitLiteral(ShellValue.Literal value) {
			return wordTest(value);
		}

		@Override
		public String visitVariableRef(ShellValue.VariableRef value) {
			return wordTest(value);
		}

		@Override
		public String visitConcat(ShellValue.Concat value) {
			return wordTest(value);
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) {
			return wordTest(value);
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) {
			return wordTest(value);
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) {
			throw new EmissionException("An integer cannot be used as a condition: " + value);
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return value.value() ? "true" : "false";
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) {
			ComparisonOp op = value.op();
			String operator = value.numeric() ? op.numericOperator() : op.stringOperator();
			return "[ " + quoter.word(value.lhs()) + " " + operator + " " + quoter.word(value.rhs()) + " ]";
		}

		@Override
		public String visitLogicalAnd(ShellValue.LogicalAnd value) {
			return left(value.lhs(), true) + " && " + right(value.rhs());
		}

		@Override
		public String visitLogicalOr(ShellValue.LogicalOr value) {
			return left(value.lhs(), false) + " || " + right(value.rhs());
		}

		private String left(ShellValue operand, boolean and) {
			boolean sameOperator = and ? operand instanceof ShellValue.LogicalAnd : operand instanceof ShellValue.LogicalOr;
			boolean list = operand instanceof ShellValue.LogicalAnd || operand instanceof ShellValue.LogicalOr;
			return list && !sameOperator ? group(operand) : operand.accept(this);
		}

		private String right(ShellValue operand) {
			boolean list = operand instanceof ShellValue.LogicalAnd || operand instanceof ShellValue.LogicalOr;
			return list ? group(operand) : operand.accept(this);
		}

		@Override
		public String visitLogicalNot(ShellValue.LogicalNot value) {
			ShellValue operand = value.operand();
			boolean compound = operand instanceof ShellValue.LogicalAnd || operand instanceof ShellValue.LogicalOr
					|| operand instanceof ShellValue.LogicalNot;
			return "! " + (compound ? group(operand) : operand.accept(this));
		}

		@Override
		public String visitPredicate(ShellValue.Predicate value) {
			return command(value.call(), quoter);
		}

		@Override
		public String visitArg(ShellValue.Arg value) {
			return wordTest(value);
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			throw new EmissionException("An integer cannot be used as a condition: " + value);
		}
	}
}
