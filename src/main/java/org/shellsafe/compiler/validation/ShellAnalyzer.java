package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerConfig.AnalyzerConfig.Severity;
import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A static analyzer for generated shell scripts.
 */
public interface ShellAnalyzer {

    /**
     * Analyzes a script.
     * @param script The script text.
     * @return All findings, in the order the analyzer reported them.
     * @throws ValidationException with {@link CompilerErrorCode#ANALYZER_FAILED} if the analyzer
     *         cannot be started, times out or fails.
     */
    List<AnalyzerFinding> analyze(String script);

    /**
     * Analyzes a script and rejects it if a finding reaches the threshold.
     * @param script The script text.
     * @param threshold The lowest severity that fails the compilation.
     * @return The findings below the threshold.
     * @throws ValidationException with {@link CompilerErrorCode#ANALYZER_FINDINGS} on a blocking finding.
     */
    default List<AnalyzerFinding> verify(String script, Severity threshold) {
        List<AnalyzerFinding> findings = analyze(script);
        List<AnalyzerFinding> blocking = findings.stream()
                .filter(f -> f.severity().compareTo(threshold) >= 0)
                .collect(Collectors.toList());
        if (!blocking.isEmpty()) {
            AnalyzerFinding first = blocking.get(0);
            throw new ValidationException(CompilerErrorCode.ANALYZER_FINDINGS,
                    "The shell analyzer reported " + blocking.size() + " finding(s); first: " + first + ".",
                    new SourceSpan(PosixScriptChecker.OUTPUT_NAME, first.line(), Math.max(1, first.column()), 1), null);
        }
        return findings;
    }
}
