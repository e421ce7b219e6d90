package org.shellsafe.compiler.api;

import org.shellsafe.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An exception that is thrown when one or more fatal diagnostics occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler. The full
 * diagnostics list (including warnings and notes collected before the failure) is available
 * through {@link #diagnostics()}.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;
    private final ErrorKind kind;

    /**
     * Constructs a new compilation exception from the collected diagnostics.
     * @param diagnostics All diagnostics of the failed run; must contain at least one error.
     */
    public CompilationException(List<Diagnostic> diagnostics) {
        this(diagnostics, null);
    }

    /**
     * Constructs a new compilation exception from the collected diagnostics and a cause.
     * @param diagnostics All diagnostics of the failed run.
     * @param cause The internal exception that ended the run, or {@code null}.
     */
    public CompilationException(List<Diagnostic> diagnostics, Throwable cause) {
        super(render(diagnostics), cause);
        this.diagnostics = List.copyOf(diagnostics);
        this.kind = diagnostics.stream()
                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                .map(Diagnostic::kind)
                .findFirst()
                .orElse(ErrorKind.VALIDATION_FAILURE);
    }

    /**
     * @return All diagnostics of the failed run, in report order.
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * @return The kind of the first fatal diagnostic.
     */
    public ErrorKind kind() {
        return kind;
    }

    private static String render(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
