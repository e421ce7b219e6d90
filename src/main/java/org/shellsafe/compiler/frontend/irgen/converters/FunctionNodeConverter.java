package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.irgen.LocalVariable;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.ParameterNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.ir.IdentifierMangler;
import org.shellsafe.compiler.ir.ShellIr;
import org.shellsafe.compiler.ir.ShellValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link FunctionNode} into a {@link ShellIr.FunctionDef}. Parameters are copied from the
 * positional parameters into their mangled variables at function entry.
 */
public final class FunctionNodeConverter implements IAstNodeToIrConverter<FunctionNode> {

	/**
	 * {@inheritDoc}
	 * <p>
	 * This implementation binds the parameters, lowers the body and registers the finished
	 * function with the context.
	 *
	 * @param node The node to convert.
	 * @param ctx  The generation context.
	 */
	@Override
	public void convert(FunctionNode node, IrGenContext ctx) {
		Map<String, LocalVariable> parameters = new LinkedHashMap<>();
		List<String> parameterNames = new ArrayList<>();
		List<ShellIr> body = new ArrayList<>();
		for (int i = 0; i < node.parameters().size(); i++) {
			ParameterNode parameter = node.parameters().get(i);
			String scriptName = IdentifierMangler.variable(node.name(), parameter.name());
			parameters.put(parameter.name(), LocalVariable.scalar(scriptName, parameter.type()));
			parameterNames.add(scriptName);
			body.add(new ShellIr.Assign(scriptName, new ShellValue.Arg(i + 1)));
		}

		ctx.enterFunction(node, parameters);
		body.add(ctx.lowerBlock(node.body()));
		ShellIr.FunctionDef definition = new ShellIr.FunctionDef(IdentifierMangler.function(node.name()),
				parameterNames, ShellIr.Sequence.of(body), node.returnType() != SourceType.UNIT);
		ctx.leaveFunction(definition);
	}
}
