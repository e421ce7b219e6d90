package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.diagnostics.Diagnostic;

/**
 * Thrown by the safety checks before and after emission. The compiler facade turns it into a
 * {@link org.shellsafe.compiler.api.CompilationException}; no output is written.
 */
public class ValidationException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    public ValidationException(CompilerErrorCode code, String message) {
        this(code, message, SourceSpan.UNKNOWN, null);
    }

    public ValidationException(CompilerErrorCode code, String message, SourceSpan span, Throwable cause) {
        super(message, cause);
        this.diagnostic = Diagnostic.error(code, message, span);
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }
}
