package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.shellsafe.compiler.ir.IrProgram;

/**
 * Phase: Generates IR from a validated AST by delegating to converters
 * resolved via the {@link IrConverterRegistry}.
 * <p>
 * Lowering is pure: the same AST always yields an equal {@link IrProgram}. It is fail-fast and
 * throws {@link LoweringException} at the first problem.
 */
public final class IrGenerator {

	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a prepared registry.
	 *
	 * @param registry The converter registry.
	 */
	public IrGenerator(IrConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Creates a new IR generator with the built-in converters.
	 */
	public IrGenerator() {
		this(IrConverterRegistry.initializeWithDefaults());
	}

	/**
	 * Generates the IR program by dispatching each function to its converter.
	 *
	 * @param program      The semantically validated program.
	 * @param sourceName   The logical source name for the provenance header.
	 * @param sourceDigest The hex SHA-256 digest of the source text.
	 * @return The generated IR program.
	 * @throws LoweringException if a value cannot be lowered safely.
	 */
	public IrProgram generate(ProgramNode program, String sourceName, String sourceDigest) {
		IrGenContext ctx = new IrGenContext(sourceName, sourceDigest, program, registry);
		for (FunctionNode function : program.functions()) {
			ctx.convert(function);
		}
		return ctx.build();
	}
}
