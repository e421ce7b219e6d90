package org.shellsafe.compiler.backend.emit;

import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * The single escape routine of the emitter. Every value that reaches the script text is rendered
 * here, in one of three contexts: a shell word, the inside of a double-quoted word, or an operand
 * of arithmetic expansion.
 * <ul>
 *     <li>Constant literals made of safe characters are emitted bare, anything else in single quotes.</li>
 *     <li>Variables, parameters and substitutions are always braced and double-quoted as words.</li>
 *     <li>Arithmetic operands are braced without quotes; only integer literals may appear bare.</li>
 * </ul>
 */
public final class ShellQuoter {

	/** Characters that never need quoting in any word position. */
	private static final Pattern SAFE_LITERAL = Pattern.compile("^[A-Za-z0-9_./:=@%+,-]+$");
	private static final Pattern INTEGER = Pattern.compile("^-?[0-9]+$");

	private final Function<ShellIr, String> commandRenderer;
	private final WordRenderer words = new WordRenderer();
	private final DoubleQuotedRenderer inQuotes = new DoubleQuotedRenderer(false);
	private final DoubleQuotedRenderer inDefault = new DoubleQuotedRenderer(true);
	private final ArithmeticRenderer arithmetic = new ArithmeticRenderer();

	/**
	 * @param commandRenderer Renders the statement inside a command substitution.
	 */
	public ShellQuoter(Function<ShellIr, String> commandRenderer) {
		this.commandRenderer = commandRenderer;
	}

	/**
	 * Quotes constant text as one word.
	 * @param text The text.
	 * @return The bare text if it is safe, otherwise the single-quoted text.
	 */
	public static String quoteLiteral(String text) {
		if (SAFE_LITERAL.matcher(text).matches()) {
			return text;
		}
		return singleQuote(text);
	}

	/**
	 * Single-quotes text unconditionally; an embedded {@code '} becomes {@code '\''}.
	 */
	public static String singleQuote(String text) {
		return "'" + text.replace("'", "'\\''") + "'";
	}

	/**
	 * Renders a value as exactly one shell word.
	 */
	public String word(ShellValue value) {
		return value.accept(words);
	}

	/**
	 * Renders the right-hand side of an assignment. Arithmetic needs no quotes there.
	 */
	public String assignmentValue(ShellValue value) {
		if (value instanceof ShellValue.Arithmetic) {
			return "$(( " + value.accept(arithmetic) + " ))";
		}
		return word(value);
	}

	/**
	 * Renders an arithmetic expression without the surrounding {@code $(( ))}.
	 */
	public String arithmetic(ShellValue value) {
		return value.accept(arithmetic);
	}

	private static String escapeDoubleQuoted(String text, boolean inBraces) {
		StringBuilder out = new StringBuilder(text.length() + 8);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\\' || c == '$' || c == '`' || c == '"' || inBraces && c == '}') {
				out.append('\\');
			}
			out.append(c);
		}
		return out.toString();
	}

	private EmissionException notAWord(ShellValue value) {
		return new EmissionException("A condition cannot be rendered as a word: " + value);
	}

	private String substitution(ShellIr inner) {
		return "$(" + commandRenderer.apply(inner) + ")";
	}

	private final class WordRenderer implements ShellValue.Visitor<String> {
		@Override
		public String visitLiteral(ShellValue.Literal value) {
			return quoteLiteral(value.text());
		}

		@Override
		public String visitVariableRef(ShellValue.VariableRef value) {
			return "\"${" + value.name() + "}\"";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) {
			if (value.parts().isEmpty()) {
				return "''";
			}
			return "\"" + value.accept(inQuotes) + "\"";
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) {
			return "\"" + substitution(value.inner()) + "\"";
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) {
			return "\"" + value.accept(inQuotes) + "\"";
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) {
			return "\"$(( " + value.accept(arithmetic) + " ))\"";
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return Boolean.toString(value.value());
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) {
			throw notAWord(value);
		}

		@Override
		public String visitLogicalAnd(ShellValue.LogicalAnd value) {
			throw notAWord(value);
		}

		@Override
		public String visitLogicalOr(ShellValue.LogicalOr value) {
			throw notAWord(value);
		}

		@Override
		public String visitLogicalNot(ShellValue.LogicalNot value) {
			throw notAWord(value);
		}

		@Override
		public String visitPredicate(ShellValue.Predicate value) {
			throw notAWord(value);
		}

		@Override
		public String visitArg(ShellValue.Arg value) {
			return "\"${" + value.position() + "}\"";
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			return "\"${#}\"";
		}
	}

	/**
	 * Renders the text between the double quotes of a word. Inside the default of
	 * {@code ${NAME:-...}} a closing brace must be escaped too, and a single quote is produced by
	 * {@code printf}, because bash reads {@code '} there as a quote even within double quotes.
	 */
	private final class DoubleQuotedRenderer implements ShellValue.Visitor<String> {
		private final boolean inBraces;

		DoubleQuotedRenderer(boolean inBraces) {
			this.inBraces = inBraces;
		}

		@Override
		public String visitLiteral(ShellValue.Literal value) {
			if (inBraces && value.text().indexOf('\'') >= 0) {
				return "$(printf '%s' " + singleQuote(value.text()) + ")";
			}
			return escapeDoubleQuoted(value.text(), inBraces);
		}

		@Override
		public String visitVariableRef(ShellValue.VariableRef value) {
			return "${" + value.name() + "}";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) {
			StringBuilder out = new StringBuilder();
			for (ShellValue part : value.parts()) {
				out.append(part.accept(this));
			}
			return out.toString();
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) {
			return substitution(value.inner());
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) {
			if (value.defaultValue().isEmpty()) {
				return "${" + value.name() + "}";
			}
			return "${" + value.name() + ":-" + value.defaultValue().get().accept(inDefault) + "}";
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) {
			return "$(( " + value.accept(arithmetic) + " ))";
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return Boolean.toString(value.value());
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) {
			throw notAWord(value);
		}

		@Override
		public String visitLogicalAnd(ShellValue.LogicalAnd value) {
			throw notAWord(value);
		}

		@Override
		public String visitLogicalOr(ShellValue.LogicalOr value) {
			throw notAWord(value);
		}

		@Override
		public String visitLogicalNot(ShellValue.LogicalNot value) {
			throw notAWord(value);
		}

		@Override
		public String visitPredicate(ShellValue.Predicate value) {
			throw notAWord(value);
		}

		@Override
		public String visitArg(ShellValue.Arg value) {
			return "${" + value.position() + "}";
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			return "${#}";
		}
	}

	/**
	 * Renders arithmetic operands. Operands are expanded without quotes because dash rejects
	 * quoted operands; only values that are integers by construction are accepted.
	 */
	private final class ArithmeticRenderer implements ShellValue.Visitor<String> {

		private String operand(ShellValue value) {
			if (value instanceof ShellValue.Arithmetic) {
				return "(" + value.accept(this) + ")";
			}
			return value.accept(this);
		}

		private EmissionException notAnInteger(ShellValue value) {
			return new EmissionException("Not an integer operand: " + value);
		}

		@Override
		public String visitLiteral(ShellValue.Literal value) {
			if (!INTEGER.matcher(value.text()).matches()) {
				throw notAnInteger(value);
			}
			return value.text().startsWith("-") ? "(" + value.text() + ")" : value.text();
		}

		@Override
		public String visitVariableRef(ShellValue.VariableRef value) {
			return "${" + value.name() + "}";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) {
			return substitution(value.inner());
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) {
			return operand(value.lhs()) + " " + value.op().symbol() + " " + operand(value.rhs());
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitLogicalAnd(ShellValue.LogicalAnd value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitLogicalOr(ShellValue.LogicalOr value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitLogicalNot(ShellValue.LogicalNot value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitPredicate(ShellValue.Predicate value) {
			throw notAnInteger(value);
		}

		@Override
		public String visitArg(ShellValue.Arg value) {
			return "${" + value.position() + "}";
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			return "${#}";
		}
	}
}
