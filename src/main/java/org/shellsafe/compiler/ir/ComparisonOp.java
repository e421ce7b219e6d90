package org.shellsafe.compiler.ir;

/**
 * Comparison operators and their {@code test} spelling for numeric and string operands.
 * POSIX {@code test} has no string ordering, so only equality has a string form.
 */
public enum ComparisonOp {
	EQ("-eq", "="),
	NE("-ne", "!="),
	LT("-lt", null),
	LE("-le", null),
	GT("-gt", null),
	GE("-ge", null);

	private final String numericOperator;
	private final String stringOperator;

	ComparisonOp(String numericOperator, String stringOperator) {
		this.numericOperator = numericOperator;
		this.stringOperator = stringOperator;
	}

	public String numericOperator() {
		return numericOperator;
	}

	/**
	 * @return The string operator, or {@code null} if {@code test} cannot compare strings this way.
	 */
	public String stringOperator() {
		return stringOperator;
	}

	/**
	 * Evaluates the comparison on two integers.
	 */
	public boolean evaluate(long lhs, long rhs) {
		return switch (this) {
			case EQ -> lhs == rhs;
			case NE -> lhs != rhs;
			case LT -> lhs < rhs;
			case LE -> lhs <= rhs;
			case GT -> lhs > rhs;
			case GE -> lhs >= rhs;
		};
	}
}
