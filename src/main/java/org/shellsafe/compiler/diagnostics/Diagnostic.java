package org.shellsafe.compiler.diagnostics;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.ErrorKind;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.internal.i18n.Messages;

import java.util.Optional;

/**
 * Represents a single diagnostic message (error, warning, note)
 * that occurs during the compilation process.
 *
 * @param severity The severity of the diagnostic.
 * @param code The stable error code.
 * @param message The diagnostic message, specific to this occurrence.
 * @param span The source position the diagnostic refers to.
 * @param fixIt A suggested fix, or {@code null} if there is none.
 */
public record Diagnostic(
        Severity severity,
        CompilerErrorCode code,
        String message,
        SourceSpan span,
        String fixIt
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Severity {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation unless strict mode is on. */
        WARNING,
        /** Additional information attached to a run. */
        NOTE
    }

    public Diagnostic {
        if (span == null) {
            span = SourceSpan.UNKNOWN;
        }
    }

    /**
     * Creates an error diagnostic without fix-it.
     * @param code The error code.
     * @param message The message.
     * @param span The source position.
     * @return The diagnostic.
     */
    public static Diagnostic error(CompilerErrorCode code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, null);
    }

    /**
     * Creates an error diagnostic with a suggested fix.
     * @param code The error code.
     * @param message The message.
     * @param span The source position.
     * @param fixIt The suggested fix.
     * @return The diagnostic.
     */
    public static Diagnostic error(CompilerErrorCode code, String message, SourceSpan span, String fixIt) {
        return new Diagnostic(Severity.ERROR, code, message, span, fixIt);
    }

    /**
     * @return The kind of the error code.
     */
    public ErrorKind kind() {
        return code.kind();
    }

    /**
     * @return The suggested fix, if any.
     */
    public Optional<String> suggestedFix() {
        return Optional.ofNullable(fixIt);
    }

    /**
     * @return The plain-language explanation of this diagnostic's code.
     */
    public String explanation() {
        return Messages.explanation(code);
    }

    @Override
    public String toString() {
        String text = String.format("[%s %s] %s: %s", severity, code.id(), span, message);
        return fixIt == null ? text : text + " (help: " + fixIt + ")";
    }
}
