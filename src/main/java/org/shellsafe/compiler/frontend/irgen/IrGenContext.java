package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.BlockNode;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.StmtNode;
import org.shellsafe.compiler.ir.IdentifierMangler;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.ir.ShellIr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Mutable context passed to converters during IR generation.
 * Collects emitted statements per block, tracks the variables in scope with their kinds and
 * hands out temporaries. A context is used for exactly one program.
 */
public final class IrGenContext {

	/**
	 * Statements emitted while producing a value.
	 * @param statements The statements that must run before the value is used.
	 * @param result The produced value.
	 * @param <T> The result type.
	 */
	public record Captured<T>(List<ShellIr> statements, T result) {}

	private final String sourceName;
	private final String sourceDigest;
	private final ProgramNode program;
	private final IrConverterRegistry registry;
	private final ExpressionLowering expressions;
	private final List<ShellIr.FunctionDef> functions = new ArrayList<>();
	private final Deque<List<ShellIr>> blocks = new ArrayDeque<>();
	private final Deque<Map<String, LocalVariable>> scopes = new ArrayDeque<>();
	private FunctionNode currentFunction;
	private int temporaries;
	private int shadows;

	/**
	 * Constructs a new IR generation context.
	 * @param sourceName The logical name of the source.
	 * @param sourceDigest The hex SHA-256 digest of the source text.
	 * @param program The program being lowered, for function signatures.
	 * @param registry The registry for resolving AST node converters.
	 */
	public IrGenContext(String sourceName, String sourceDigest, ProgramNode program, IrConverterRegistry registry) {
		this.sourceName = sourceName;
		this.sourceDigest = sourceDigest;
		this.program = program;
		this.registry = registry;
		this.expressions = new ExpressionLowering(this);
	}

	/**
	 * Emits a statement into the innermost open block.
	 * @param ir The statement.
	 */
	public void emit(ShellIr ir) {
		if (blocks.isEmpty()) {
			throw new IllegalStateException("No open block for " + ir);
		}
		blocks.peek().add(ir);
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 */
	public void convert(AstNode node) {
		registry.resolve(node).convert(node, this);
	}

	/**
	 * Lowers a block in a new variable scope.
	 * @param block The block.
	 * @return The lowered statements.
	 */
	public ShellIr lowerBlock(BlockNode block) {
		return lowerBlock(block, Map.of());
	}

	/**
	 * Lowers a block in a new variable scope that starts with the given bindings.
	 * @param block The block.
	 * @param bindings Variables introduced by the enclosing construct, e.g. a loop variable.
	 * @return The lowered statements.
	 */
	public ShellIr lowerBlock(BlockNode block, Map<String, LocalVariable> bindings) {
		pushScope();
		scopes.peek().putAll(bindings);
		try {
			return new ShellIr.Sequence(capture(() -> {
				for (StmtNode statement : block.statements()) {
					convert(statement);
				}
				return null;
			}).statements());
		} finally {
			popScope();
		}
	}

	/**
	 * Opens a variable scope, e.g. for a loop variable that lives around the loop body.
	 */
	public void pushScope() {
		scopes.push(new HashMap<>());
	}

	public void popScope() {
		scopes.pop();
	}

	/**
	 * Runs a lowering step and collects the statements it emits instead of emitting them.
	 * @param step The step.
	 * @return The emitted statements and the step's result.
	 */
	public <T> Captured<T> capture(Supplier<T> step) {
		blocks.push(new ArrayList<>());
		T result;
		List<ShellIr> statements;
		try {
			result = step.get();
		} finally {
			statements = blocks.pop();
		}
		return new Captured<>(List.copyOf(statements), result);
	}

	/**
	 * Starts lowering a function.
	 * @param function The function.
	 * @param parameters The parameters, bound in the function scope.
	 */
	public void enterFunction(FunctionNode function, Map<String, LocalVariable> parameters) {
		this.currentFunction = function;
		this.temporaries = 0;
		this.shadows = 0;
		scopes.push(new HashMap<>(parameters));
	}

	/**
	 * Finishes the current function.
	 * @param definition The lowered function.
	 */
	public void leaveFunction(ShellIr.FunctionDef definition) {
		scopes.pop();
		functions.add(definition);
		currentFunction = null;
	}

	public FunctionNode currentFunction() {
		return currentFunction;
	}

	/**
	 * @return {@code true} if the current function returns its value on standard output.
	 */
	public boolean inValueFunction() {
		return currentFunction != null && currentFunction.returnType() != SourceType.UNIT;
	}

	/**
	 * @return The script name of a variable of the current function.
	 */
	public String scriptName(String sourceName) {
		return IdentifierMangler.variable(currentFunction.name(), sourceName);
	}

	/**
	 * Declares a scalar variable in the innermost scope. A name that is still bound in an
	 * enclosing scope gets a fresh script name, so the inner binding cannot clobber the outer one.
	 * @return The declared variable.
	 */
	public LocalVariable declare(String name, SourceType type) {
		LocalVariable variable = LocalVariable.scalar(freshScriptName(name), type);
		scopes.peek().put(name, variable);
		return variable;
	}

	private String freshScriptName(String name) {
		LocalVariable current = scopes.peek().get(name);
		if (current != null && !current.isVector()) {
			return current.scriptName();
		}
		for (Map<String, LocalVariable> scope : scopes) {
			if (scope != scopes.peek() && scope.containsKey(name)) {
				shadows++;
				return IdentifierMangler.shadow(scriptName(name), shadows);
			}
		}
		return scriptName(name);
	}

	/**
	 * Declares a {@code vec!} binding with one script variable per element, named
	 * {@code <name>__<index>}. Mangled user names never end in {@code __} and a digit.
	 * @return The declared variable.
	 */
	public LocalVariable declareVector(String name, SourceType elementType, int size) {
		String base = freshScriptName(name);
		List<String> elements = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			elements.add(base + "__" + i);
		}
		LocalVariable variable = new LocalVariable(base, SourceType.VECTOR, elements, elementType);
		scopes.peek().put(name, variable);
		return variable;
	}

	/**
	 * Resolves a variable from the innermost scope outwards.
	 * @param name The source-level name.
	 * @param node The referencing node, for the error span.
	 * @return The variable.
	 */
	public LocalVariable lookup(String name, AstNode node) {
		for (Map<String, LocalVariable> scope : scopes) {
			LocalVariable variable = scope.get(name);
			if (variable != null) return variable;
		}
		throw new LoweringException(CompilerErrorCode.MISSING_LOWERING_RULE,
				"Variable '" + name + "' is not in scope during lowering.", node.span());
	}

	/**
	 * @return A fresh script variable for an intermediate value of the current function.
	 */
	public String newTemporary() {
		temporaries++;
		return IdentifierMangler.temporary(currentFunction.name(), temporaries);
	}

	/**
	 * @return The user function with the given name, or {@code null}.
	 */
	public FunctionNode userFunction(String name) {
		return program.function(name).orElse(null);
	}

	public ExpressionLowering expressions() {
		return expressions;
	}

	/**
	 * Builds the final {@link IrProgram} from the lowered functions.
	 * @return The constructed program.
	 */
	public IrProgram build() {
		return new IrProgram(sourceName, sourceDigest, functions);
	}
}
