package org.shellsafe.compiler.frontend.irgen.converters;

import org.shellsafe.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellsafe.compiler.frontend.irgen.IrGenContext;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.parser.ast.StmtNode;
import org.shellsafe.compiler.ir.ShellIr;

/**
 * Converts {@code break} and {@code continue}.
 */
public final class LoopControlNodeConverter implements IAstNodeToIrConverter<StmtNode> {

	@Override
	public void convert(StmtNode node, IrGenContext ctx) {
		ctx.emit(node instanceof BreakNode ? new ShellIr.Break() : new ShellIr.Continue());
	}
}
