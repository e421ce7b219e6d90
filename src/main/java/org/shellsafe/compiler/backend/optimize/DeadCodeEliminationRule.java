package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.ir.IdentifierMangler;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellIrRewriter;
import org.shellsafe.compiler.ir.ShellIrScanner;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes code that can never run: branches of constant conditions, loops whose condition is
 * constantly false, statements after {@code return}, {@code exit}, {@code break} or
 * {@code continue} in the same block, and functions that {@code main} never reaches.
 */
public final class DeadCodeEliminationRule implements IOptimizationRule {

	static final String ENTRY_POINT = IdentifierMangler.function("main");

	@Override
	public String name() {
		return "dead-code-elimination";
	}

	@Override
	public boolean isEnabled(CompilerConfig config) {
		return config.enableDeadCodeElimination();
	}

	@Override
	public IrProgram apply(IrProgram program, CompilerConfig config) {
		Eliminator eliminator = new Eliminator();
		Map<String, ShellIr.FunctionDef> byName = new HashMap<>();
		List<ShellIr.FunctionDef> rewritten = new ArrayList<>();
		for (ShellIr.FunctionDef function : program.functions()) {
			ShellIr.FunctionDef result = (ShellIr.FunctionDef) eliminator.rewrite(function);
			rewritten.add(result);
			byName.put(result.name(), result);
		}
		Set<String> reachable = reachable(byName);
		List<ShellIr.FunctionDef> kept = new ArrayList<>();
		for (ShellIr.FunctionDef function : rewritten) {
			if (reachable.contains(function.name())) {
				kept.add(function);
			}
		}
		return program.withFunctions(kept);
	}

	private static Set<String> reachable(Map<String, ShellIr.FunctionDef> functions) {
		Set<String> reachable = new LinkedHashSet<>();
		Deque<String> work = new ArrayDeque<>();
		work.push(ENTRY_POINT);
		while (!work.isEmpty()) {
			String name = work.pop();
			ShellIr.FunctionDef function = functions.get(name);
			if (function == null || !reachable.add(name)) continue;
			new ShellIrScanner() {
				@Override
				public Void visitCall(ShellIr.Call ir) {
					if (functions.containsKey(ir.program())) {
						work.push(ir.program());
					}
					return super.visitCall(ir);
				}
			}.scan(function.body());
		}
		return reachable;
	}

	private static boolean endsBlock(ShellIr ir) {
		return ir instanceof ShellIr.Return || ir instanceof ShellIr.Exit
				|| ir instanceof ShellIr.Break || ir instanceof ShellIr.Continue;
	}

	private static final class Eliminator extends ShellIrRewriter {

		@Override
		public ShellIr visitIf(ShellIr.If ir) {
			ShellValue condition = rewrite(ir.condition());
			if (condition instanceof ShellValue.Bool bool) {
				if (bool.value()) {
					return rewrite(ir.thenBranch());
				}
				return ir.elseBranch().map(this::rewrite).orElseGet(ShellIr.Noop::new);
			}
			return new ShellIr.If(condition, rewrite(ir.thenBranch()), ir.elseBranch().map(this::rewrite));
		}

		@Override
		public ShellIr visitWhile(ShellIr.While ir) {
			ShellValue condition = rewrite(ir.condition());
			if (condition instanceof ShellValue.Bool bool && !bool.value()) {
				return new ShellIr.Noop();
			}
			return new ShellIr.While(condition, rewrite(ir.body()));
		}

		@Override
		public ShellIr visitSequence(ShellIr.Sequence ir) {
			List<ShellIr> statements = new ArrayList<>();
			for (ShellIr statement : ir.statements()) {
				ShellIr result = rewrite(statement);
				if (result instanceof ShellIr.Noop) continue;
				if (result instanceof ShellIr.Sequence nested) {
					statements.addAll(nested.statements());
				} else {
					statements.add(result);
				}
				if (!statements.isEmpty() && endsBlock(statements.get(statements.size() - 1))) {
					break;
				}
			}
			if (statements.isEmpty()) {
				return new ShellIr.Noop();
			}
			return ShellIr.Sequence.of(statements);
		}
	}
}
