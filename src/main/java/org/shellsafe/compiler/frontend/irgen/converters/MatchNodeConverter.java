package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.irgen.ExpressionLowering;
import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.LoweringException;
import org.shellsafe.compiler.frontend.irgen.TypedValue;
import org.shellsafe.compiler.frontend.parser.ast.LiteralPatternNode;
import org.shellsafe.compiler.frontend.parser.ast.MatchArmNode;
import org.shellsafe.compiler.frontend.parser.ast.MatchNode;
import org.shellsafe.compiler.frontend.parser.ast.PatternNode;
import org.shellsafe.compiler.frontend.parser.ast.RangePatternNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.ir.ComparisonOp;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts {@link MatchNode}. Literal and wildcard patterns become a {@code case} statement whose
 * patterns are quoted literals; a match with range patterns becomes an {@code if} chain over
 * integer comparisons. Arms after a catch-all arm can never run and are dropped.
 */
public final class MatchNodeConverter implements IAstNodeToIrConverter<MatchNode> {

	@Override
	public void convert(MatchNode node, IrGenContext ctx) {
		TypedValue scrutinee = ctx.expressions().lower(node.scrutinee());
		for (MatchArmNode arm : node.arms()) {
			for (PatternNode pattern : arm.patterns()) {
				checkPattern(pattern, scrutinee.type());
			}
		}
		if (node.hasRangePatterns()) {
			convertToIfChain(node, scrutinee, ctx);
		} else {
			convertToCase(node, scrutinee, ctx);
		}
	}

	private void convertToCase(MatchNode node, TypedValue scrutinee, IrGenContext ctx) {
		ShellValue word = ctx.expressions().asWord(scrutinee, node.scrutinee());
		List<ShellIr.CaseArm> arms = new ArrayList<>();
		for (MatchArmNode arm : node.arms()) {
			List<String> patterns = new ArrayList<>();
			for (PatternNode pattern : arm.patterns()) {
				if (pattern instanceof LiteralPatternNode literal) {
					patterns.add(String.valueOf(literal.value()));
				}
			}
			arms.add(new ShellIr.CaseArm(arm.isCatchAll() ? List.of() : patterns, arm.isCatchAll(), ctx.lowerBlock(arm.body())));
			if (arm.isCatchAll()) break;
		}
		ctx.emit(new ShellIr.Case(word, arms));
	}

	private void convertToIfChain(MatchNode node, TypedValue scrutinee, IrGenContext ctx) {
		ShellValue value = ctx.expressions().asInteger(scrutinee, node.scrutinee());
		if (!(value instanceof ShellValue.VariableRef) && !(value instanceof ShellValue.Literal)) {
			String temporary = ctx.newTemporary();
			ctx.emit(new ShellIr.Assign(temporary, value));
			value = new ShellValue.VariableRef(temporary);
		}

		List<ShellValue> conditions = new ArrayList<>();
		List<ShellIr> bodies = new ArrayList<>();
		for (MatchArmNode arm : node.arms()) {
			conditions.add(arm.isCatchAll() ? null : armCondition(arm, value));
			bodies.add(ctx.lowerBlock(arm.body()));
			if (arm.isCatchAll()) break;
		}

		Optional<ShellIr> chain = Optional.empty();
		for (int i = bodies.size() - 1; i >= 0; i--) {
			ShellValue condition = conditions.get(i);
			chain = Optional.of(condition == null ? bodies.get(i) : new ShellIr.If(condition, bodies.get(i), chain));
		}
		chain.ifPresent(ctx::emit);
	}

	private static ShellValue armCondition(MatchArmNode arm, ShellValue value) {
		ShellValue condition = null;
		for (PatternNode pattern : arm.patterns()) {
			ShellValue alternative;
			if (pattern instanceof RangePatternNode range) {
				alternative = new ShellValue.LogicalAnd(
						new ShellValue.Comparison(ComparisonOp.GE, value, ShellValue.Literal.of(range.low()), true),
						new ShellValue.Comparison(ComparisonOp.LE, value, ShellValue.Literal.of(range.inclusiveHigh()), true));
			} else {
				LiteralPatternNode literal = (LiteralPatternNode) pattern;
				alternative = new ShellValue.Comparison(ComparisonOp.EQ, value,
						ShellValue.Literal.of((Long) literal.value()), true);
			}
			condition = condition == null ? alternative : new ShellValue.LogicalOr(condition, alternative);
		}
		return condition;
	}

	private static void checkPattern(PatternNode pattern, SourceType scrutineeType) {
		SourceType patternType;
		if (pattern instanceof RangePatternNode) {
			patternType = SourceType.INTEGER;
		} else if (pattern instanceof LiteralPatternNode literal) {
			Object value = literal.value();
			patternType = value instanceof Long ? SourceType.INTEGER
					: value instanceof Boolean ? SourceType.BOOLEAN : SourceType.STRING;
		} else {
			return;
		}
		if (patternType != scrutineeType) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"A pattern of " + ExpressionLowering.describe(patternType) + " cannot match "
							+ ExpressionLowering.describe(scrutineeType) + ".", pattern.span());
		}
	}
}
