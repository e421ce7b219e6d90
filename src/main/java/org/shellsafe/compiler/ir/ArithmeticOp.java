package org.shellsafe.compiler.ir;

/**
 * Operators of POSIX arithmetic expansion used by {@link ShellValue.Arithmetic}.
 */
public enum ArithmeticOp {
	ADD("+"), SUB("-"), MUL("*"), DIV("/"), REM("%"),
	BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"), SHL("<<"), SHR(">>");

	private final String symbol;

	ArithmeticOp(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return The operator as written inside {@code $(( ))}.
	 */
	public String symbol() {
		return symbol;
	}
}
