package org.shellsafe.compiler.backend.optimize;

import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.ir.IrMetrics;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellIrRewriter;
import org.shellsafe.compiler.ir.ShellIrScanner;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces statement-level calls of small functions by their bodies. A function qualifies when it
 * returns no value, contains no {@code return} and no loop control outside its own loops. Its body
 * binds the parameters from the positional parameters, so inlining substitutes the call arguments
 * for those, which yields the parameter assignments followed by the body.
 * <p>
 * A call is only inlined while the caller's branch count stays at or below the configured threshold.
 */
public final class InliningRule implements IOptimizationRule {

	@Override
	public String name() {
		return "inlining";
	}

	@Override
	public boolean isEnabled(CompilerConfig config) {
		return config.enableInlining();
	}

	@Override
	public IrProgram apply(IrProgram program, CompilerConfig config) {
		Map<String, ShellIr.FunctionDef> candidates = new HashMap<>();
		for (ShellIr.FunctionDef function : program.functions()) {
			if (!function.name().equals(DeadCodeEliminationRule.ENTRY_POINT) && isInlinable(function)) {
				candidates.put(function.name(), function);
			}
		}
		if (candidates.isEmpty()) {
			return program;
		}
		List<ShellIr.FunctionDef> functions = new ArrayList<>();
		for (ShellIr.FunctionDef function : program.functions()) {
			Inliner inliner = new Inliner(candidates, config.inliningBranchThreshold(),
					IrMetrics.of(function.body()).branchCount());
			functions.add(new ShellIr.FunctionDef(function.name(), function.parameters(),
					inliner.rewrite(function.body()), function.returnsValue()));
		}
		return program.withFunctions(functions);
	}

	static boolean isInlinable(ShellIr.FunctionDef function) {
		if (function.returnsValue()) {
			return false;
		}
		boolean[] blocked = {false};
		new ShellIrScanner() {
			private int loops;

			@Override
			public Void visitReturn(ShellIr.Return ir) {
				blocked[0] = true;
				return null;
			}

			@Override
			public Void visitBreak(ShellIr.Break ir) {
				if (loops == 0) blocked[0] = true;
				return null;
			}

			@Override
			public Void visitContinue(ShellIr.Continue ir) {
				if (loops == 0) blocked[0] = true;
				return null;
			}

			@Override
			public Void visitFor(ShellIr.For ir) {
				loops++;
				super.visitFor(ir);
				loops--;
				return null;
			}

			@Override
			public Void visitForEach(ShellIr.ForEach ir) {
				loops++;
				super.visitForEach(ir);
				loops--;
				return null;
			}

			@Override
			public Void visitWhile(ShellIr.While ir) {
				loops++;
				super.visitWhile(ir);
				loops--;
				return null;
			}
		}.scan(function.body());
		return !blocked[0];
	}

	private static final class Inliner extends ShellIrRewriter {
		private final Map<String, ShellIr.FunctionDef> candidates;
		private final int threshold;
		private int branches;

		Inliner(Map<String, ShellIr.FunctionDef> candidates, int threshold, int branches) {
			this.candidates = candidates;
			this.threshold = threshold;
			this.branches = branches;
		}

		@Override
		public ShellIr visitCall(ShellIr.Call ir) {
			ShellIr.FunctionDef callee = candidates.get(ir.program());
			if (callee == null) {
				return super.visitCall(ir);
			}
			int added = IrMetrics.of(callee.body()).branchCount();
			if (branches + added > threshold) {
				return super.visitCall(ir);
			}
			branches += added;
			return new ArgumentBinder(rewriteValues(ir.arguments())).rewrite(callee.body());
		}

		// calls inside values are never statements
		@Override
		public ShellValue visitPredicate(ShellValue.Predicate value) {
			return value;
		}

		@Override
		public ShellValue visitCommandSubst(ShellValue.CommandSubst value) {
			return value;
		}
	}

	private static final class ArgumentBinder extends ShellIrRewriter {
		private final List<ShellValue> arguments;

		ArgumentBinder(List<ShellValue> arguments) {
			this.arguments = arguments;
		}

		@Override
		public ShellValue visitArg(ShellValue.Arg value) {
			if (value.position() <= arguments.size()) {
				return arguments.get(value.position() - 1);
			}
			return value;
		}
	}
}
