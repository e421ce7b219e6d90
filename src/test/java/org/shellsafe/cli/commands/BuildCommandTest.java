package org.shellsafe.cli.commands;

import org.shellsafe.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@code build} subcommand through the same command line the executable uses.
 */
public class BuildCommandTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path source(String name, String text) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Verifies that a valid source is written to the requested path and the path is printed.
     */
    @Test
    @Tag("unit")
    void testBuildWritesScript() throws Exception {
        // Arrange
        Path src = source("hello.rs", "fn main() {\n    println!(\"hello\");\n}\n");
        Path target = dir.resolve("bin/hello");

        // Act
        int exitCode = execute("build", src.toString(), "-o", target.toString());

        // Assert
        assertThat(exitCode).as(err.toString()).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(target).exists();
        assertThat(Files.readString(target)).startsWith("#!/bin/sh\n").contains("printf '%s\\n' hello");
        assertThat(out.toString().trim()).isEqualTo(target.toAbsolutePath().toString());
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that warnings are printed to stderr while the script is still written.
     */
    @Test
    @Tag("unit")
    void testWarningsArePrinted() throws Exception {
        // Arrange
        Path src = source("warn.rs", "fn main() {\n    let unused = 1;\n}\n");

        // Act
        int exitCode = execute("build", src.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(dir.resolve("warn.sh")).exists();
        assertThat(err.toString()).contains(":2:").contains("warning[W0001]");
    }

    /**
     * Verifies that a rejected source exits with the compilation failure code and writes nothing.
     */
    @Test
    @Tag("unit")
    void testCompilationFailure() throws Exception {
        // Arrange
        Path src = source("bad.rs", "fn main() {\n    frobnicate();\n}\n");

        // Act
        int exitCode = execute("build", src.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_FAILED);
        assertThat(err.toString()).contains("error[S0004]");
        assertThat(dir.resolve("bad.sh")).doesNotExist();
    }

    /**
     * Verifies that --strict turns a warning into a failure.
     */
    @Test
    @Tag("unit")
    void testStrictOption() throws Exception {
        // Arrange
        Path src = source("warn.rs", "fn main() {\n    let unused = 1;\n}\n");

        // Act
        int exitCode = execute("build", "--strict", src.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_FAILED);
        assertThat(err.toString()).contains("error[V0007]");
    }

    /**
     * Verifies the I/O exit code for a missing source and for a missing configuration file.
     */
    @Test
    @Tag("unit")
    void testIoErrors() throws Exception {
        // Arrange
        Path src = source("ok.rs", "fn main() {}\n");

        // Act
        int missingSource = execute("build", dir.resolve("missing.rs").toString());
        int missingConfig = execute("--config", dir.resolve("missing.conf").toString(), "build", src.toString());

        // Assert
        assertThat(missingSource).isEqualTo(CommandLineInterface.EXIT_USAGE_OR_IO);
        assertThat(missingConfig).isEqualTo(CommandLineInterface.EXIT_USAGE_OR_IO);
        assertThat(err.toString()).contains("Cannot read").contains("Cannot load configuration");
    }

    /**
     * Verifies the default script name next to the source.
     */
    @Test
    @Tag("unit")
    void testDefaultOutput() {
        // Act & Assert
        assertThat(BuildCommand.defaultOutput(Path.of("scripts", "deploy.rs"))).isEqualTo(Path.of("scripts", "deploy.sh"));
        assertThat(BuildCommand.defaultOutput(Path.of("tool"))).isEqualTo(Path.of("tool.sh"));
        assertThat(BuildCommand.defaultOutput(Path.of("setup.sh"))).isEqualTo(Path.of("setup.sh.sh"));
    }
}
