package org.shellsafe.compiler.ir;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The lowered program. Functions keep their source order.
 *
 * @param sourceName The logical name of the source, for the provenance header.
 * @param sourceDigest The hex SHA-256 digest of the source text.
 * @param functions The functions, {@code main} included.
 */
public record IrProgram(String sourceName, String sourceDigest, List<ShellIr.FunctionDef> functions) {

	public IrProgram {
		functions = List.copyOf(functions);
	}

	public Optional<ShellIr.FunctionDef> function(String name) {
		return functions.stream().filter(f -> f.name().equals(name)).findFirst();
	}

	/**
	 * @return A copy with other functions and the same header data.
	 */
	public IrProgram withFunctions(List<ShellIr.FunctionDef> newFunctions) {
		return new IrProgram(sourceName, sourceDigest, newFunctions);
	}

	/**
	 * @return The runtime helpers called anywhere in the program, in name order.
	 */
	public List<RuntimeHelper> helpers() {
		Set<RuntimeHelper> used = EnumSet.noneOf(RuntimeHelper.class);
		ShellIrScanner scanner = new ShellIrScanner() {
			@Override
			public Void visitCall(ShellIr.Call ir) {
				RuntimeHelper.byFunctionName(ir.program()).ifPresent(used::add);
				return super.visitCall(ir);
			}
		};
		functions.forEach(scanner::scan);
		return List.copyOf(used);
	}
}
