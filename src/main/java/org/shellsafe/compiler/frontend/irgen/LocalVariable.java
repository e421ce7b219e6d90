package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.frontend.parser.ast.SourceType;

import java.util.List;

/**
 * A variable known to the lowering, with its script name and kind. A {@code vec!} binding has
 * kind {@link SourceType#VECTOR} and one script variable per element.
 *
 * @param scriptName The mangled name used in the script.
 * @param type The value kind.
 * @param elements The script names of the elements of a vector, otherwise empty.
 * @param elementType The kind of the elements of a vector, otherwise {@code null}.
 */
public record LocalVariable(String scriptName, SourceType type, List<String> elements, SourceType elementType) {

	public LocalVariable {
		elements = List.copyOf(elements);
	}

	public static LocalVariable scalar(String scriptName, SourceType type) {
		return new LocalVariable(scriptName, type, List.of(), null);
	}

	public boolean isVector() {
		return type == SourceType.VECTOR;
	}
}
