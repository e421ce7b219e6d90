package org.shellsafe.cli.commands;

import com.typesafe.config.ConfigException;
import org.shellsafe.cli.CommandLineInterface;
import org.shellsafe.cli.DiagnosticPrinter;
import org.shellsafe.cli.config.LoggingConfigurator;
import org.shellsafe.compiler.ArtifactWriter;
import org.shellsafe.compiler.ShellCompiler;
import org.shellsafe.compiler.api.CompilationException;
import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.api.ScriptArtifact;
import org.shellsafe.compiler.diagnostics.CompilerLogger;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "build",
        mixinStandardHelpOptions = true,
        description = "Compiles a source file and writes the POSIX shell script.")
public class BuildCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "SOURCE", description = "The source file to compile.")
    private Path source;

    @Option(names = {"-o", "--output"}, description = "The script to write (default: SOURCE with extension .sh).")
    private Path output;

    @Option(names = "--strict", description = "Treat every warning as an error.")
    private boolean strict;

    @Option(names = "--no-optimize", description = "Disable constant folding, inlining and dead code elimination.")
    private boolean noOptimize;

    @Option(names = "--analyze", description = "Run the external shell analyzer configured in shellsafe.compiler.analyzer.")
    private boolean analyze;

    @Option(names = {"-v", "--verbose"}, description = "Log the compiler phases.")
    private boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilerConfig config;
        try {
            config = CompilerConfig.fromConfig(parent.getConfig());
        } catch (IOException | ConfigException e) {
            err.println("Cannot load configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE_OR_IO;
        }
        config = applyOptions(config);

        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + source + ": " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE_OR_IO;
        }

        ShellCompiler compiler = new ShellCompiler(config);
        if (verbose) {
            compiler.setVerbosity(CompilerLogger.DEBUG);
            LoggingConfigurator.setLevel("org.shellsafe", "DEBUG");
        }

        ScriptArtifact artifact;
        try {
            artifact = compiler.compile(text, source.toString());
        } catch (CompilationException e) {
            e.diagnostics().forEach(d -> err.println(DiagnosticPrinter.text(d)));
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        }
        for (Diagnostic warning : artifact.diagnostics()) {
            err.println(DiagnosticPrinter.text(warning));
        }

        Path target = output != null ? output : defaultOutput(source);
        try {
            Path written = new ArtifactWriter().write(artifact, target);
            out.println(written);
        } catch (IOException e) {
            err.println("Cannot write " + target + ": " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE_OR_IO;
        }
        return CommandLineInterface.EXIT_OK;
    }

    private CompilerConfig applyOptions(CompilerConfig config) {
        CompilerConfig result = config;
        if (strict) {
            result = result.withStrictMode(true);
        }
        if (noOptimize) {
            result = result.withOptimizations(false);
        }
        if (analyze) {
            CompilerConfig.AnalyzerConfig a = result.analyzer();
            result = result.withAnalyzer(new CompilerConfig.AnalyzerConfig(true, a.command(), a.timeout(), a.severityThreshold()));
        }
        return result;
    }

    /**
     * Replaces the extension of the source file name with {@code .sh}.
     * A source that already ends in {@code .sh} gets a second extension so it is never overwritten.
     */
    static Path defaultOutput(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String scriptName = base + ".sh";
        if (scriptName.equals(name)) {
            scriptName = name + ".sh";
        }
        return source.resolveSibling(scriptName);
    }
}
