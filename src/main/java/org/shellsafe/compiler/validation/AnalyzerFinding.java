package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerConfig.AnalyzerConfig.Severity;

/**
 * One finding reported by the external shell analyzer.
 *
 * @param line The 1-based line in the generated script.
 * @param column The 1-based column.
 * @param severity The normalized severity.
 * @param code The analyzer's rule code, e.g. {@code SC2086}; empty if it printed none.
 * @param message The analyzer's message.
 */
public record AnalyzerFinding(int line, int column, Severity severity, String code, String message) {

    @Override
    public String toString() {
        return line + ":" + column + ": " + severity.name().toLowerCase(java.util.Locale.ROOT) + ": " + message
                + (code.isEmpty() ? "" : " [" + code + "]");
    }
}
