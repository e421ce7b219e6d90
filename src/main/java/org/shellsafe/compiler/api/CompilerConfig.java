package org.shellsafe.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Immutable compiler options. Instances are read-only and may be shared between threads.
 *
 * @param strictMode Reject on the first warning as well as on errors.
 * @param enableDeadCodeElimination Run the dead code elimination rule.
 * @param enableConstantFolding Run the constant folding rule.
 * @param enableInlining Run the inlining rule.
 * @param inliningBranchThreshold Maximum branch count a caller may reach through inlining.
 * @param maxDiagnostics Maximum number of errors the frontend collects before it stops.
 * @param verifyDeterminism Compile twice and compare digests before accepting the output.
 * @param analyzer Settings of the external static shell analyzer.
 */
public record CompilerConfig(
        boolean strictMode,
        boolean enableDeadCodeElimination,
        boolean enableConstantFolding,
        boolean enableInlining,
        int inliningBranchThreshold,
        int maxDiagnostics,
        boolean verifyDeterminism,
        AnalyzerConfig analyzer
) {
    /** Path of the compiler subtree in the HOCON configuration. */
    public static final String CONFIG_PATH = "shellsafe.compiler";

    /**
     * Settings of the external static shell analyzer.
     *
     * @param enabled Whether the analyzer runs at all.
     * @param command The command line, the script is passed on stdin.
     * @param timeout The hard limit for one analyzer run.
     * @param severityThreshold Findings at or above this severity fail the compilation.
     */
    public record AnalyzerConfig(boolean enabled, List<String> command, Duration timeout, Severity severityThreshold) {

        public AnalyzerConfig {
            command = List.copyOf(command);
        }

        /**
         * Finding severities, ordered from least to most severe.
         */
        public enum Severity {
            STYLE, INFO, WARNING, ERROR;

            /**
             * Parses a severity name as printed by the analyzer ("note" counts as INFO).
             * @param text The severity text.
             * @return The matching severity.
             * @throws IllegalArgumentException if the text is not a known severity.
             */
            public static Severity parse(String text) {
                String normalized = text.trim().toUpperCase(Locale.ROOT);
                if ("NOTE".equals(normalized)) {
                    return INFO;
                }
                return Severity.valueOf(normalized);
            }
        }

        /**
         * @return A disabled analyzer configuration.
         */
        public static AnalyzerConfig disabled() {
            return new AnalyzerConfig(false, List.of("shellcheck", "--shell=sh", "--format=gcc", "-"), Duration.ofSeconds(10), Severity.WARNING);
        }
    }

    /**
     * Loads the defaults from {@code reference.conf} on the classpath.
     * @return The default configuration.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Maps the {@code shellsafe.compiler} subtree of an application configuration onto a record.
     * @param config The resolved application configuration.
     * @return The compiler configuration.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerConfig fromConfig(Config config) {
        Config c = config.getConfig(CONFIG_PATH);
        Config a = c.getConfig("analyzer");
        AnalyzerConfig analyzer = new AnalyzerConfig(
                a.getBoolean("enabled"),
                a.getStringList("command"),
                a.getDuration("timeout"),
                AnalyzerConfig.Severity.parse(a.getString("severity-threshold")));
        return new CompilerConfig(
                c.getBoolean("strict-mode"),
                c.getBoolean("enable-dead-code-elimination"),
                c.getBoolean("enable-constant-folding"),
                c.getBoolean("enable-inlining"),
                c.getInt("inlining-branch-threshold"),
                c.getInt("max-diagnostics"),
                c.getBoolean("verify-determinism"),
                analyzer);
    }

    /**
     * @param strict The new strict-mode flag.
     * @return A copy with strict mode changed.
     */
    public CompilerConfig withStrictMode(boolean strict) {
        return new CompilerConfig(strict, enableDeadCodeElimination, enableConstantFolding, enableInlining,
                inliningBranchThreshold, maxDiagnostics, verifyDeterminism, analyzer);
    }

    /**
     * @param enabled Whether constant folding, inlining and dead code elimination run.
     * @return A copy with all optimization rules switched together.
     */
    public CompilerConfig withOptimizations(boolean enabled) {
        return new CompilerConfig(strictMode, enabled, enabled, enabled,
                inliningBranchThreshold, maxDiagnostics, verifyDeterminism, analyzer);
    }

    /**
     * @param analyzerConfig The new analyzer settings.
     * @return A copy with the analyzer settings replaced.
     */
    public CompilerConfig withAnalyzer(AnalyzerConfig analyzerConfig) {
        return new CompilerConfig(strictMode, enableDeadCodeElimination, enableConstantFolding, enableInlining,
                inliningBranchThreshold, maxDiagnostics, verifyDeterminism, analyzerConfig);
    }
}
