package org.shellsafe.compiler;

import org.shellsafe.compiler.api.CompilationException;
import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.api.CompilerConfig.AnalyzerConfig.Severity;
import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.ErrorKind;
import org.shellsafe.compiler.api.ScriptArtifact;
import org.shellsafe.compiler.diagnostics.CompilerLogger;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import org.shellsafe.compiler.validation.DeterminismCheck;
import org.shellsafe.compiler.validation.ShellAnalyzer;
import org.shellsafe.compiler.validation.ValidationException;
import org.shellsafe.junit.extensions.logging.ExpectLog;
import org.shellsafe.junit.extensions.logging.LogLevel;
import org.shellsafe.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests for {@link ShellCompiler}: source text in, script artifact or compilation
 * failure out. The scripts are only inspected here; {@link ScriptExecutionTest} runs them.
 */
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
public class ShellCompilerTest {

    @Mock
    private ShellAnalyzer analyzer;

    private static final String FOR_LOOP = String.join("\n",
            "fn main() {",
            "    for i in 0..5 {",
            "        println!(\"{}\", i);",
            "    }",
            "}");

    /**
     * Verifies the environment lookup scenario: the variable is read into a quoted assignment, the
     * unused binding is reported as a warning and the digest matches the text.
     */
    @Test
    @Tag("unit")
    void testEnvironmentLookup() throws Exception {
        // Arrange
        ShellCompiler compiler = new ShellCompiler();

        // Act
        ScriptArtifact artifact = compiler.compile("fn main() { let home = env(\"HOME\"); }", "home.rs");

        // Assert
        assertThat(artifact.text()).startsWith("#!/bin/sh\n");
        assertThat(artifact.text()).contains("    home=\"${HOME}\"\n");
        assertThat(artifact.text()).endsWith("main \"$@\"\n");
        assertThat(artifact.sha256()).isEqualTo(DeterminismCheck.digest(artifact.text()));
        assertThat(artifact.sourceName()).isEqualTo("home.rs");
        assertThat(artifact.diagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNUSED_VARIABLE);
    }

    /**
     * Verifies that a counting loop over an exclusive range becomes a seq loop with the folded bound.
     */
    @Test
    @Tag("unit")
    void testForLoopOverRange() throws Exception {
        // Act
        ScriptArtifact artifact = new ShellCompiler().compile(FOR_LOOP, "loop.rs");

        // Assert
        assertThat(artifact.text()).contains("for i in $(seq 0 4); do\n");
        assertThat(artifact.text()).contains("printf '%s\\n' \"${i}\"\n");
        assertThat(artifact.diagnostics()).isEmpty();
        assertThat(artifact.metrics().functionCount()).isEqualTo(1);
        assertThat(artifact.metrics().nestingDepth()).isGreaterThanOrEqualTo(1);
    }

    /**
     * Verifies that an injection attempt in an environment variable name is rejected during lowering
     * with the offending name in the message.
     */
    @Test
    @Tag("unit")
    void testInjectionInEnvironmentNameIsRejected() {
        // Arrange
        String source = "fn main() { let x = env(\"'; rm -rf /; #\"); println!(\"{}\", x); }";

        // Act
        CompilationException e = catchThrowableOfType(() -> new ShellCompiler().compile(source, "evil.rs"),
                CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.kind()).isEqualTo(ErrorKind.LOWERING_ERROR);
        Diagnostic error = e.diagnostics().get(e.diagnostics().size() - 1);
        assertThat(error.code()).isEqualTo(CompilerErrorCode.INVALID_ENV_VAR_NAME);
        assertThat(error.message()).contains("'; rm -rf /; #");
        assertThat(error.suggestedFix()).isPresent();
    }

    /**
     * Verifies that strict mode turns the first warning into a fatal diagnostic.
     */
    @Test
    @Tag("unit")
    void testStrictModeRejectsWarnings() {
        // Arrange
        ShellCompiler compiler = new ShellCompiler(CompilerConfig.defaults().withStrictMode(true));

        // Act
        CompilationException e = catchThrowableOfType(
                () -> compiler.compile("fn main() { let home = env(\"HOME\"); }", "home.rs"),
                CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNUSED_VARIABLE, CompilerErrorCode.STRICT_MODE_WARNING);
        assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILURE);
    }

    /**
     * Verifies that the frontend reports every error of a run instead of stopping at the first.
     */
    @Test
    @Tag("unit")
    void testFrontendErrorsAreAggregated() {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> new ShellCompiler().compile("fn main() {\n    foo();\n    bar();\n}", "calls.rs"),
                CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.kind()).isEqualTo(ErrorKind.SEMANTIC_ERROR);
        assertThat(e.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNKNOWN_FUNCTION, CompilerErrorCode.UNKNOWN_FUNCTION);
        assertThat(e.diagnostics()).extracting(d -> d.span().line()).containsExactly(2, 3);
        assertThat(e.getMessage()).contains("foo").contains("bar");
    }

    /**
     * Verifies that no parameter expansion in the script is left unbraced.
     */
    @Test
    @Tag("unit")
    void testNoBareParameterExpansion() throws Exception {
        // Arrange
        String source = String.join("\n",
                "fn add(a: u32, b: u32) -> u32 {",
                "    return a + b;",
                "}",
                "fn main() {",
                "    let prefix = env_var_or(\"PREFIX\", \"/usr/local\");",
                "    let mut total = 0;",
                "    for i in 0..arg_count() {",
                "        total = add(total, i * 2);",
                "    }",
                "    let label = format!(\"{}/bin {}\", prefix, total);",
                "    println!(\"{}\", string_to_upper(label));",
                "}");

        // Act
        ScriptArtifact artifact = new ShellCompiler().compile(source, "quoting.rs");

        // Assert
        assertThat(artifact.text()).contains("\"${PREFIX:-/usr/local}\"");
        assertThat(artifact.text()).doesNotContainPattern("\\$[A-Za-z_]");
    }

    /**
     * Verifies that a function with a return value is called through a command substitution.
     */
    @Test
    @Tag("unit")
    void testValueFunction() throws Exception {
        // Arrange
        String source = String.join("\n",
                "fn double(n: u32) -> u32 {",
                "    return n * 2;",
                "}",
                "fn main() {",
                "    let x = double(21);",
                "    println!(\"{}\", x);",
                "}");

        // Act
        ScriptArtifact artifact = new ShellCompiler().compile(source, "double.rs");

        // Assert
        assertThat(artifact.text()).contains("double() {\n");
        assertThat(artifact.text()).contains("    double__n=\"${1}\"\n");
        assertThat(artifact.text()).contains("    x=\"$(double 21)\"\n");
        assertThat(artifact.metrics().functionCount()).isEqualTo(2);
    }

    /**
     * Verifies that compiling the same source twice, also from several threads, gives identical text.
     */
    @Test
    @Tag("unit")
    void testOutputIsDeterministicAcrossThreads() throws Exception {
        // Arrange
        ShellCompiler compiler = new ShellCompiler();
        String expected = compiler.compile(FOR_LOOP, "loop.rs").text();
        ExecutorService pool = Executors.newFixedThreadPool(4);

        // Act
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                results.add(pool.submit(() -> compiler.compile(FOR_LOOP, "loop.rs").text()));
            }
            for (Future<String> result : results) {
                // Assert
                assertThat(result.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Verifies that the configured analyzer sees the finished script with the configured threshold.
     */
    @Test
    @Tag("unit")
    void testAnalyzerReceivesScript() throws Exception {
        // Arrange
        when(analyzer.verify(anyString(), any())).thenReturn(List.of());
        ShellCompiler compiler = new ShellCompiler(CompilerConfig.defaults(), analyzer);

        // Act
        ScriptArtifact artifact = compiler.compile(FOR_LOOP, "loop.rs");

        // Assert
        verify(analyzer, times(1)).verify(eq(artifact.text()), eq(Severity.WARNING));
    }

    /**
     * Verifies that an analyzer failure fails the compilation and is logged as a warning.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "loop\\.rs: The analyzer did not finish within 300 ms\\.")
    void testAnalyzerFailureIsFatal() {
        // Arrange
        when(analyzer.verify(anyString(), any())).thenThrow(new ValidationException(CompilerErrorCode.ANALYZER_FAILED,
                "The analyzer did not finish within 300 ms."));
        ShellCompiler compiler = new ShellCompiler(CompilerConfig.defaults(), analyzer);
        compiler.setVerbosity(CompilerLogger.INFO);

        // Act
        CompilationException e = catchThrowableOfType(() -> compiler.compile(FOR_LOOP, "loop.rs"),
                CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILURE);
        assertThat(e.diagnostics()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.ANALYZER_FAILED);
        assertThat(e.getCause()).isInstanceOf(ValidationException.class);
    }

    /**
     * Verifies that the file-based entry point reports a missing file as an I/O error.
     */
    @Test
    @Tag("unit")
    void testCompileMissingFile() {
        // Act
        IOException thrown = catchThrowableOfType(
                () -> new ShellCompiler().compile(Path.of("does-not-exist.rs")), IOException.class);

        // Assert
        assertThat(thrown).isInstanceOf(NoSuchFileException.class);
    }
}
