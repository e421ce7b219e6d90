package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.frontend.irgen.converters.AssignNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.ExprStmtNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.ForNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.FunctionNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.IfNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.LetNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.LoopControlNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.MatchNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.ReturnNodeConverter;
import org.shellsafe.compiler.frontend.irgen.converters.WhileNodeConverter;
import org.shellsafe.compiler.frontend.parser.ast.AssignNode;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.parser.ast.ContinueNode;
import org.shellsafe.compiler.frontend.parser.ast.ExprStmtNode;
import org.shellsafe.compiler.frontend.parser.ast.ForNode;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.IfNode;
import org.shellsafe.compiler.frontend.parser.ast.LetNode;
import org.shellsafe.compiler.frontend.parser.ast.MatchNode;
import org.shellsafe.compiler.frontend.parser.ast.ReturnNode;
import org.shellsafe.compiler.frontend.parser.ast.WhileNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps statement and item node classes to their lowering converters.
 * <p>
 * AST nodes are records, so a lookup checks the concrete class and then the node interfaces it
 * implements ({@code StmtNode}, {@code AstNode}). A node without a converter resolves to the
 * default converter, which fails the compilation.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();
	private final IAstNodeToIrConverter<AstNode> defaultConverter;

	private IrConverterRegistry(IAstNodeToIrConverter<AstNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter, replacing any earlier one for the same node class.
	 *
	 * @param nodeType  The AST node class, concrete or one of the node interfaces.
	 * @param converter The converter lowering nodes of that class.
	 * @param <T>       The node type.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Finds the converter for a node.
	 *
	 * @param node The node to lower.
	 * @return The converter of its class, of the first node interface with one, or the default converter.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
		IAstNodeToIrConverter<?> exact = byClass.get(node.getClass());
		if (exact != null) {
			return (IAstNodeToIrConverter<AstNode>) exact;
		}
		Deque<Class<?>> pending = new ArrayDeque<>(List.of(node.getClass().getInterfaces()));
		while (!pending.isEmpty()) {
			Class<?> type = pending.poll();
			IAstNodeToIrConverter<?> found = byClass.get(type);
			if (found != null) {
				return (IAstNodeToIrConverter<AstNode>) found;
			}
			pending.addAll(List.of(type.getInterfaces()));
		}
		return defaultConverter;
	}

	/**
	 * Creates an empty registry.
	 *
	 * @param defaultConverter The converter for nodes without a registered converter.
	 * @return A new registry.
	 */
	public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> defaultConverter) {
		return new IrConverterRegistry(defaultConverter);
	}

	/**
	 * Creates the registry with a converter for every statement and item the parser produces.
	 *
	 * @return The registry used by {@link IrGenerator}.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
		LoopControlNodeConverter loopControl = new LoopControlNodeConverter();
		reg.register(FunctionNode.class, new FunctionNodeConverter());
		reg.register(LetNode.class, new LetNodeConverter());
		reg.register(AssignNode.class, new AssignNodeConverter());
		reg.register(IfNode.class, new IfNodeConverter());
		reg.register(MatchNode.class, new MatchNodeConverter());
		reg.register(ForNode.class, new ForNodeConverter());
		reg.register(WhileNode.class, new WhileNodeConverter());
		reg.register(ExprStmtNode.class, new ExprStmtNodeConverter());
		reg.register(ReturnNode.class, new ReturnNodeConverter());
		reg.register(BreakNode.class, loopControl::convert);
		reg.register(ContinueNode.class, loopControl::convert);
		return reg;
	}
}
