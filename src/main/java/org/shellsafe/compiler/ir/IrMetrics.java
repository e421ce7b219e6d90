package org.shellsafe.compiler.ir;

/**
 * Size and complexity figures of a lowered program, exposed to reporting layers and used by the
 * inlining rule.
 *
 * @param branchCount The number of decision points: each {@code if}, each {@code case} arm, each loop
 *                    and each {@code &&} / {@code ||}.
 * @param nestingDepth The deepest nesting of compound statements.
 * @param functionCount The number of functions.
 * @param statementCount The number of simple and compound statements, sequences excluded.
 */
public record IrMetrics(int branchCount, int nestingDepth, int functionCount, int statementCount) {

	/**
	 * Measures a whole program.
	 */
	public static IrMetrics of(IrProgram program) {
		Counter counter = new Counter();
		for (ShellIr.FunctionDef function : program.functions()) {
			counter.scan(function.body());
		}
		return new IrMetrics(counter.branches, counter.maxDepth, program.functions().size(), counter.statements);
	}

	/**
	 * Measures a single statement tree.
	 */
	public static IrMetrics of(ShellIr ir) {
		Counter counter = new Counter();
		counter.scan(ir);
		return new IrMetrics(counter.branches, counter.maxDepth, ir instanceof ShellIr.FunctionDef ? 1 : 0, counter.statements);
	}

	private static final class Counter extends ShellIrScanner {
		private int branches;
		private int statements;
		private int depth;
		private int maxDepth;

		private void enter() {
			depth++;
			maxDepth = Math.max(maxDepth, depth);
		}

		@Override
		public Void visitAssign(ShellIr.Assign ir) {
			statements++;
			return super.visitAssign(ir);
		}

		@Override
		public Void visitEcho(ShellIr.Echo ir) {
			statements++;
			return super.visitEcho(ir);
		}

		@Override
		public Void visitCall(ShellIr.Call ir) {
			statements++;
			return super.visitCall(ir);
		}

		@Override
		public Void visitReturn(ShellIr.Return ir) {
			statements++;
			return null;
		}

		@Override
		public Void visitBreak(ShellIr.Break ir) {
			statements++;
			return null;
		}

		@Override
		public Void visitContinue(ShellIr.Continue ir) {
			statements++;
			return null;
		}

		@Override
		public Void visitExit(ShellIr.Exit ir) {
			statements++;
			return super.visitExit(ir);
		}

		@Override
		public Void visitIf(ShellIr.If ir) {
			statements++;
			branches++;
			scan(ir.condition());
			enter();
			scan(ir.thenBranch());
			depth--;
			// an elif chain stays on the same level
			ir.elseBranch().ifPresent(branch -> {
				if (branch instanceof ShellIr.If) {
					statements--;
					scan(branch);
				} else {
					enter();
					scan(branch);
					depth--;
				}
			});
			return null;
		}

		@Override
		public Void visitCase(ShellIr.Case ir) {
			statements++;
			branches += ir.arms().size();
			scan(ir.scrutinee());
			enter();
			for (ShellIr.CaseArm arm : ir.arms()) {
				scan(arm.body());
			}
			depth--;
			return null;
		}

		@Override
		public Void visitFor(ShellIr.For ir) {
			return loop(() -> super.visitFor(ir));
		}

		@Override
		public Void visitForEach(ShellIr.ForEach ir) {
			return loop(() -> super.visitForEach(ir));
		}

		@Override
		public Void visitWhile(ShellIr.While ir) {
			return loop(() -> super.visitWhile(ir));
		}

		private Void loop(Runnable body) {
			statements++;
			branches++;
			enter();
			body.run();
			depth--;
			return null;
		}

		@Override
		public Void visitLogicalAnd(ShellValue.LogicalAnd value) {
			branches++;
			return super.visitLogicalAnd(value);
		}

		@Override
		public Void visitLogicalOr(ShellValue.LogicalOr value) {
			branches++;
			return super.visitLogicalOr(value);
		}
	}
}
