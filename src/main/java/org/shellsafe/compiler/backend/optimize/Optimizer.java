package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.diagnostics.CompilerLogger;
import org.shellsafe.compiler.ir.IrProgram;

/**
 * Phase: applies the enabled rules of an {@link OptimizationRegistry} in registration order.
 */
public final class Optimizer {

	private final OptimizationRegistry registry;

	public Optimizer(OptimizationRegistry registry) {
		this.registry = registry;
	}

	public Optimizer() {
		this(OptimizationRegistry.initializeWithDefaults());
	}

	/**
	 * Optimizes a program.
	 * @param program The lowered program.
	 * @param config The compiler configuration gating the rules.
	 * @return The optimized program; the input itself when no rule is enabled.
	 */
	public IrProgram optimize(IrProgram program, CompilerConfig config) {
		IrProgram current = program;
		for (IOptimizationRule rule : registry.rules()) {
			if (rule.isEnabled(config)) {
				current = rule.apply(current, config);
				CompilerLogger.trace("Optimizer: applied " + rule.name());
			}
		}
		return current;
	}
}
