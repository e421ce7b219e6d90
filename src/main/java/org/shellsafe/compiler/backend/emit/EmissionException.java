package org.shellsafe.compiler.backend.emit;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.diagnostics.Diagnostic;

/**
 * Thrown when the emitter meets an IR shape it has no rendering for. Lowering and the IR
 * validator never produce such shapes, so this is always an internal error.
 */
public class EmissionException extends RuntimeException {

	private final transient Diagnostic diagnostic;

	public EmissionException(String message) {
		super(message);
		this.diagnostic = Diagnostic.error(CompilerErrorCode.MISSING_EMISSION_RULE, message, SourceSpan.UNKNOWN);
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}
}
