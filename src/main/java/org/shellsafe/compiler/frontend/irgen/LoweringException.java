package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.diagnostics.Diagnostic;

/**
 * Ends lowering at the first problem. Lowering only runs on programs that passed the frontend, so
 * every failure here is either a value the frontend cannot judge (an environment variable name, an
 * operand kind) or a missing lowering rule.
 */
public class LoweringException extends RuntimeException {

	private final transient Diagnostic diagnostic;

	public LoweringException(Diagnostic diagnostic) {
		super(diagnostic.toString());
		this.diagnostic = diagnostic;
	}

	public LoweringException(CompilerErrorCode code, String message, SourceSpan span) {
		this(Diagnostic.error(code, message, span));
	}

	public LoweringException(CompilerErrorCode code, String message, SourceSpan span, String fixIt) {
		this(Diagnostic.error(code, message, span, fixIt));
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}
}
