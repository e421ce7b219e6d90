package org.shellsafe.compiler.diagnostics;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * The number of errors kept per run is bounded; once the bound is reached a single
 * {@link CompilerErrorCode#TOO_MANY_ERRORS} note is recorded and further errors are dropped.
 */
public class DiagnosticsEngine {

    /** Error bound used when none is configured. */
    public static final int DEFAULT_MAX_ERRORS = 20;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final int maxErrors;
    private int errorCount = 0;
    private boolean limitReached = false;

    /**
     * Creates an engine with the default error bound.
     */
    public DiagnosticsEngine() {
        this(DEFAULT_MAX_ERRORS);
    }

    /**
     * Creates an engine with an explicit error bound.
     * @param maxErrors The maximum number of errors to collect, at least 1.
     */
    public DiagnosticsEngine(int maxErrors) {
        this.maxErrors = Math.max(1, maxErrors);
    }

    /**
     * Records a diagnostic.
     *
     * @param diagnostic The diagnostic to record.
     * @return {@code true} if it was recorded, {@code false} if the error bound dropped it.
     */
    public boolean report(Diagnostic diagnostic) {
        if (diagnostic.severity() == Diagnostic.Severity.ERROR) {
            if (errorCount >= maxErrors) {
                if (!limitReached) {
                    limitReached = true;
                    diagnostics.add(new Diagnostic(Diagnostic.Severity.NOTE, CompilerErrorCode.TOO_MANY_ERRORS,
                            "too many errors; stopped after " + maxErrors, diagnostic.span(), null));
                }
                return false;
            }
            errorCount++;
        }
        diagnostics.add(diagnostic);
        return true;
    }

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param span    The position of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceSpan span) {
        report(Diagnostic.error(code, message, span));
    }

    /**
     * Reports an error with a suggested fix.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param span    The position of the error.
     * @param fixIt   The suggested fix.
     */
    public void reportError(CompilerErrorCode code, String message, SourceSpan span, String fixIt) {
        report(Diagnostic.error(code, message, span, fixIt));
    }

    /**
     * Reports a warning.
     *
     * @param code    The warning code.
     * @param message The warning message.
     * @param span    The position of the warning.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceSpan span) {
        report(new Diagnostic(Diagnostic.Severity.WARNING, code, message, span, null));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return errorCount > 0;
    }

    /**
     * @return {@code true} if at least one warning exists.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.WARNING);
    }

    /**
     * @return {@code true} once the error bound has dropped a diagnostic.
     */
    public boolean limitReached() {
        return limitReached;
    }

    /**
     * @return The first recorded error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.ERROR).findFirst();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
