package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.ir.ShellValue;

/**
 * A lowered expression together with the kind of value it produces.
 *
 * @param value The IR value.
 * @param type The value kind; {@link SourceType#UNIT} for expressions that produce nothing.
 */
public record TypedValue(ShellValue value, SourceType type) {

	public boolean is(SourceType expected) {
		return type == expected;
	}
}
