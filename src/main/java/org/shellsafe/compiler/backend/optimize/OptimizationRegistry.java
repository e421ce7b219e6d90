package org.shellsafe.compiler.backend.optimize;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for optimization rules applied in order.
 */
public final class OptimizationRegistry {

	private final List<IOptimizationRule> rules = new ArrayList<>();

	/**
	 * Registers a new optimization rule.
	 * @param rule The rule to register.
	 */
	public void register(IOptimizationRule rule) { rules.add(rule); }

	/**
	 * @return The list of registered optimization rules.
	 */
	public List<IOptimizationRule> rules() { return rules; }

	/**
	 * Initializes a new registry with the default rules. Inlining runs after folding so that it
	 * measures folded bodies, and dead code elimination runs last to remove functions that
	 * inlining left without callers.
	 * @return A new registry with default rules.
	 */
	public static OptimizationRegistry initializeWithDefaults() {
		OptimizationRegistry reg = new OptimizationRegistry();
		reg.register(new ConstantFoldingRule());
		reg.register(new InliningRule());
		reg.register(new DeadCodeEliminationRule());
		return reg;
	}
}
