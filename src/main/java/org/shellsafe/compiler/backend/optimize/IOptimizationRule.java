package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.ir.IrProgram;

/**
 * Rewriter rule applied to the lowered program before validation and emission.
 * A rule never modifies its input; it returns a fresh program.
 */
public interface IOptimizationRule {

	/**
	 * @return A short name for logs.
	 */
	String name();

	/**
	 * @param config The compiler configuration.
	 * @return {@code true} if the rule should run.
	 */
	boolean isEnabled(CompilerConfig config);

	/**
	 * Applies this rule to the given program.
	 *
	 * @param program The input program.
	 * @param config  The compiler configuration.
	 * @return The rewritten program.
	 */
	IrProgram apply(IrProgram program, CompilerConfig config);
}
