package org.shellsafe.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A visitor that rebuilds a tree bottom-up. The default for every variant rebuilds it from its
 * rewritten children, so a subclass only overrides the variants it changes. The input is never
 * modified.
 */
public abstract class ShellIrRewriter implements ShellIr.Visitor<ShellIr>, ShellValue.Visitor<ShellValue> {

	public ShellIr rewrite(ShellIr ir) {
		return ir.accept(this);
	}

	public ShellValue rewrite(ShellValue value) {
		return value.accept(this);
	}

	protected List<ShellIr> rewriteAll(List<ShellIr> statements) {
		List<ShellIr> result = new ArrayList<>(statements.size());
		for (ShellIr statement : statements) {
			result.add(rewrite(statement));
		}
		return result;
	}

	protected List<ShellValue> rewriteValues(List<ShellValue> values) {
		List<ShellValue> result = new ArrayList<>(values.size());
		for (ShellValue value : values) {
			result.add(rewrite(value));
		}
		return result;
	}

	@Override
	public ShellIr visitAssign(ShellIr.Assign ir) {
		return new ShellIr.Assign(ir.name(), rewrite(ir.value()));
	}

	@Override
	public ShellIr visitEcho(ShellIr.Echo ir) {
		return new ShellIr.Echo(rewrite(ir.value()), ir.stderr(), ir.newline());
	}

	@Override
	public ShellIr visitIf(ShellIr.If ir) {
		return new ShellIr.If(rewrite(ir.condition()), rewrite(ir.thenBranch()), ir.elseBranch().map(this::rewrite));
	}

	@Override
	public ShellIr visitCase(ShellIr.Case ir) {
		List<ShellIr.CaseArm> arms = new ArrayList<>();
		for (ShellIr.CaseArm arm : ir.arms()) {
			arms.add(new ShellIr.CaseArm(arm.patterns(), arm.catchAll(), rewrite(arm.body())));
		}
		return new ShellIr.Case(rewrite(ir.scrutinee()), arms);
	}

	@Override
	public ShellIr visitFor(ShellIr.For ir) {
		return new ShellIr.For(ir.variable(), rewrite(ir.first()), rewrite(ir.last()), rewrite(ir.body()));
	}

	@Override
	public ShellIr visitForEach(ShellIr.ForEach ir) {
		return new ShellIr.ForEach(ir.variable(), rewriteValues(ir.items()), rewrite(ir.body()));
	}

	@Override
	public ShellIr visitWhile(ShellIr.While ir) {
		return new ShellIr.While(rewrite(ir.condition()), rewrite(ir.body()));
	}

	@Override
	public ShellIr visitFunctionDef(ShellIr.FunctionDef ir) {
		return new ShellIr.FunctionDef(ir.name(), ir.parameters(), rewrite(ir.body()), ir.returnsValue());
	}

	@Override
	public ShellIr visitCall(ShellIr.Call ir) {
		return new ShellIr.Call(ir.program(), rewriteValues(ir.arguments()));
	}

	@Override
	public ShellIr visitSequence(ShellIr.Sequence ir) {
		return new ShellIr.Sequence(rewriteAll(ir.statements()));
	}

	@Override
	public ShellIr visitReturn(ShellIr.Return ir) {
		return ir;
	}

	@Override
	public ShellIr visitBreak(ShellIr.Break ir) {
		return ir;
	}

	@Override
	public ShellIr visitContinue(ShellIr.Continue ir) {
		return ir;
	}

	@Override
	public ShellIr visitExit(ShellIr.Exit ir) {
		return new ShellIr.Exit(rewrite(ir.code()));
	}

	@Override
	public ShellIr visitNoop(ShellIr.Noop ir) {
		return ir;
	}

	@Override
	public ShellValue visitLiteral(ShellValue.Literal value) {
		return value;
	}

	@Override
	public ShellValue visitVariableRef(ShellValue.VariableRef value) {
		return value;
	}

	@Override
	public ShellValue visitConcat(ShellValue.Concat value) {
		return new ShellValue.Concat(rewriteValues(value.parts()));
	}

	@Override
	public ShellValue visitCommandSubst(ShellValue.CommandSubst value) {
		return new ShellValue.CommandSubst(rewrite(value.inner()));
	}

	@Override
	public ShellValue visitEnvVar(ShellValue.EnvVar value) {
		return new ShellValue.EnvVar(value.name(), value.defaultValue().map(this::rewrite));
	}

	@Override
	public ShellValue visitArithmetic(ShellValue.Arithmetic value) {
		return new ShellValue.Arithmetic(value.op(), rewrite(value.lhs()), rewrite(value.rhs()));
	}

	@Override
	public ShellValue visitBool(ShellValue.Bool value) {
		return value;
	}

	@Override
	public ShellValue visitComparison(ShellValue.Comparison value) {
		return new ShellValue.Comparison(value.op(), rewrite(value.lhs()), rewrite(value.rhs()), value.numeric());
	}

	@Override
	public ShellValue visitLogicalAnd(ShellValue.LogicalAnd value) {
		return new ShellValue.LogicalAnd(rewrite(value.lhs()), rewrite(value.rhs()));
	}

	@Override
	public ShellValue visitLogicalOr(ShellValue.LogicalOr value) {
		return new ShellValue.LogicalOr(rewrite(value.lhs()), rewrite(value.rhs()));
	}

	@Override
	public ShellValue visitLogicalNot(ShellValue.LogicalNot value) {
		return new ShellValue.LogicalNot(rewrite(value.operand()));
	}

	@Override
	public ShellValue visitPredicate(ShellValue.Predicate value) {
		return new ShellValue.Predicate((ShellIr.Call) rewrite(value.call()));
	}

	@Override
	public ShellValue visitArg(ShellValue.Arg value) {
		return value;
	}

	@Override
	public ShellValue visitArgCount(ShellValue.ArgCount value) {
		return value;
	}
}
