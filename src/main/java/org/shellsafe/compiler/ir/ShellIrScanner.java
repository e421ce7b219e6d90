package org.shellsafe.compiler.ir;

/**
 * A visitor that walks every statement and value reachable from a node. Subclasses override the
 * methods of the variants they care about and call {@code super} to keep descending.
 */
public abstract class ShellIrScanner implements ShellIr.Visitor<Void>, ShellValue.Visitor<Void> {

	public void scan(ShellIr ir) {
		ir.accept(this);
	}

	public void scan(ShellValue value) {
		value.accept(this);
	}

	@Override
	public Void visitAssign(ShellIr.Assign ir) {
		scan(ir.value());
		return null;
	}

	@Override
	public Void visitEcho(ShellIr.Echo ir) {
		scan(ir.value());
		return null;
	}

	@Override
	public Void visitIf(ShellIr.If ir) {
		scan(ir.condition());
		scan(ir.thenBranch());
		ir.elseBranch().ifPresent(this::scan);
		return null;
	}

	@Override
	public Void visitCase(ShellIr.Case ir) {
		scan(ir.scrutinee());
		for (ShellIr.CaseArm arm : ir.arms()) {
			scan(arm.body());
		}
		return null;
	}

	@Override
	public Void visitFor(ShellIr.For ir) {
		scan(ir.first());
		scan(ir.last());
		scan(ir.body());
		return null;
	}

	@Override
	public Void visitForEach(ShellIr.ForEach ir) {
		ir.items().forEach(this::scan);
		scan(ir.body());
		return null;
	}

	@Override
	public Void visitWhile(ShellIr.While ir) {
		scan(ir.condition());
		scan(ir.body());
		return null;
	}

	@Override
	public Void visitFunctionDef(ShellIr.FunctionDef ir) {
		scan(ir.body());
		return null;
	}

	@Override
	public Void visitCall(ShellIr.Call ir) {
		ir.arguments().forEach(this::scan);
		return null;
	}

	@Override
	public Void visitSequence(ShellIr.Sequence ir) {
		ir.statements().forEach(this::scan);
		return null;
	}

	@Override
	public Void visitReturn(ShellIr.Return ir) {
		return null;
	}

	@Override
	public Void visitBreak(ShellIr.Break ir) {
		return null;
	}

	@Override
	public Void visitContinue(ShellIr.Continue ir) {
		return null;
	}

	@Override
	public Void visitExit(ShellIr.Exit ir) {
		scan(ir.code());
		return null;
	}

	@Override
	public Void visitNoop(ShellIr.Noop ir) {
		return null;
	}

	@Override
	public Void visitLiteral(ShellValue.Literal value) {
		return null;
	}

	@Override
	public Void visitVariableRef(ShellValue.VariableRef value) {
		return null;
	}

	@Override
	public Void visitConcat(ShellValue.Concat value) {
		value.parts().forEach(this::scan);
		return null;
	}

	@Override
	public Void visitCommandSubst(ShellValue.CommandSubst value) {
		scan(value.inner());
		return null;
	}

	@Override
	public Void visitEnvVar(ShellValue.EnvVar value) {
		value.defaultValue().ifPresent(this::scan);
		return null;
	}

	@Override
	public Void visitArithmetic(ShellValue.Arithmetic value) {
		scan(value.lhs());
		scan(value.rhs());
		return null;
	}

	@Override
	public Void visitBool(ShellValue.Bool value) {
		return null;
	}

	@Override
	public Void visitComparison(ShellValue.Comparison value) {
		scan(value.lhs());
		scan(value.rhs());
		return null;
	}

	@Override
	public Void visitLogicalAnd(ShellValue.LogicalAnd value) {
		scan(value.lhs());
		scan(value.rhs());
		return null;
	}

	@Override
	public Void visitLogicalOr(ShellValue.LogicalOr value) {
		scan(value.lhs());
		scan(value.rhs());
		return null;
	}

	@Override
	public Void visitLogicalNot(ShellValue.LogicalNot value) {
		scan(value.operand());
		return null;
	}

	@Override
	public Void visitPredicate(ShellValue.Predicate value) {
		scan(value.call());
		return null;
	}

	@Override
	public Void visitArg(ShellValue.Arg value) {
		return null;
	}

	@Override
	public Void visitArgCount(ShellValue.ArgCount value) {
		return null;
	}
}
