package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.irgen.ExpressionLowering;
import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.LocalVariable;
import org.shellsafe.compiler.frontend.irgen.LoweringException;
import org.shellsafe.compiler.frontend.irgen.TypedValue;
import org.shellsafe.compiler.frontend.parser.ast.ExprNode;
import org.shellsafe.compiler.frontend.parser.ast.LetNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.VecMacroExpr;
import org.shellsafe.compiler.ir.ShellIr;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@link LetNode}. The initializer is lowered before the binding is declared, so it can
 * still read a binding of the same name that the new one shadows. A {@code vec!} initializer
 * becomes one assignment per element.
 */
public final class LetNodeConverter implements IAstNodeToIrConverter<LetNode> {

	@Override
	public void convert(LetNode node, IrGenContext ctx) {
		ExpressionLowering expressions = ctx.expressions();
		if (node.initializer() instanceof VecMacroExpr vec) {
			convertVector(node, vec, ctx);
			return;
		}
		TypedValue value = expressions.lower(node.initializer());
		if (value.is(SourceType.UNIT)) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"The initializer of '" + node.name() + "' produces no value.", node.initializer().span());
		}
		if (node.declaredType() != null && node.declaredType() != value.type()) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"'" + node.name() + "' is declared as " + ExpressionLowering.describe(node.declaredType())
							+ " but initialized with " + ExpressionLowering.describe(value.type()) + ".", node.span());
		}
		LocalVariable variable = ctx.declare(node.name(), value.type());
		ctx.emit(store(variable.scriptName(), value, expressions));
	}

	private void convertVector(LetNode node, VecMacroExpr vec, IrGenContext ctx) {
		if (node.declaredType() != null && node.declaredType() != SourceType.VECTOR) {
			throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
					"'" + node.name() + "' is declared as " + ExpressionLowering.describe(node.declaredType())
							+ " but initialized with vec!.", node.span());
		}
		List<TypedValue> elements = new ArrayList<>();
		SourceType elementType = null;
		for (ExprNode element : vec.elements()) {
			TypedValue value = ctx.expressions().lower(element);
			if (value.is(SourceType.UNIT)) {
				throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
						"A vector element must produce a value.", element.span());
			}
			if (elementType != null && elementType != value.type()) {
				throw new LoweringException(CompilerErrorCode.TYPE_MISMATCH,
						"All elements of vec! must have the same type.", element.span());
			}
			elementType = value.type();
			elements.add(value);
		}
		LocalVariable vector = ctx.declareVector(node.name(), elementType == null ? SourceType.STRING : elementType,
				elements.size());
		for (int i = 0; i < elements.size(); i++) {
			ctx.emit(store(vector.elements().get(i), elements.get(i), ctx.expressions()));
		}
	}

	/**
	 * Builds the statement storing a lowered value into a script variable.
	 */
	static ShellIr store(String target, TypedValue value, ExpressionLowering expressions) {
		if (value.is(SourceType.BOOLEAN)) {
			return expressions.assignBoolean(target, value.value());
		}
		return new ShellIr.Assign(target, value.value());
	}
}
