package org.shellsafe.cli.commands;

import com.typesafe.config.ConfigException;
import org.shellsafe.cli.CommandLineInterface;
import org.shellsafe.cli.DiagnosticPrinter;
import org.shellsafe.compiler.ShellCompiler;
import org.shellsafe.compiler.api.CompilationException;
import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.api.ICompiler;
import org.shellsafe.compiler.api.ScriptArtifact;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Compiles any number of sources in parallel without writing anything and reports the outcome
 * of each, in the order the sources were given.
 */
@Command(name = "check",
        mixinStandardHelpOptions = true,
        description = "Compiles sources without writing scripts and reports diagnostics.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    /** Report formats. */
    public enum OutputFormat { TEXT, JSON }

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "SOURCE", description = "The source files to check.")
    private List<Path> sources;

    @Option(names = "--format", defaultValue = "TEXT", description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format;

    @Option(names = {"-j", "--jobs"}, description = "Number of parallel compilations (default: number of processors).")
    private int jobs = Runtime.getRuntime().availableProcessors();

    @Option(names = "--strict", description = "Treat every warning as an error.")
    private boolean strict;

    /**
     * The outcome of one source.
     */
    record Outcome(Path source, ScriptArtifact artifact, List<Diagnostic> diagnostics, String ioError) {

        String status() {
            if (ioError != null) return "io-error";
            return artifact != null ? "ok" : "failed";
        }
    }

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
        if (strict) {
            config = config.withStrictMode(true);
        }

        List<Outcome> outcomes;
        try {
            outcomes = compileAll(new ShellCompiler(config), sources, Math.max(1, jobs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return CommandLineInterface.EXIT_USAGE_OR_IO;
        }

        if (format == OutputFormat.JSON) {
            List<DiagnosticPrinter.SourceReport> reports = new ArrayList<>();
            for (Outcome o : outcomes) {
                List<Diagnostic> diagnostics = o.artifact() != null ? o.artifact().diagnostics() : o.diagnostics();
                reports.add(DiagnosticPrinter.report(o.source().toString(), o.status(),
                        o.artifact() != null ? o.artifact().sha256() : null,
                        o.artifact() != null ? o.artifact().metrics() : null, diagnostics));
            }
            out.println(DiagnosticPrinter.json(reports));
        } else {
            for (Outcome o : outcomes) {
                if (o.ioError() != null) {
                    err.println(o.source() + ": " + o.ioError());
                    continue;
                }
                List<Diagnostic> diagnostics = o.artifact() != null ? o.artifact().diagnostics() : o.diagnostics();
                diagnostics.forEach(d -> err.println(DiagnosticPrinter.text(d)));
                out.println(o.source() + ": " + o.status());
            }
        }

        if (outcomes.stream().anyMatch(o -> o.ioError() != null)) {
            return CommandLineInterface.EXIT_USAGE_OR_IO;
        }
        if (outcomes.stream().anyMatch(o -> o.artifact() == null)) {
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        }
        return CommandLineInterface.EXIT_OK;
    }

    /**
     * Compiles all sources on a fixed thread pool.
     * @param compiler A compiler that is safe to share between threads.
     * @param sources The source files.
     * @param threads The pool size.
     * @return One outcome per source, in input order.
     * @throws InterruptedException if interrupted while waiting for the pool.
     */
    static List<Outcome> compileAll(ICompiler compiler, List<Path> sources, int threads) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, sources.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Path source : sources) {
                futures.add(pool.submit(() -> compileOne(compiler, source)));
            }
            List<Outcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("Checking {} failed unexpectedly", sources.get(i), e.getCause());
                    outcomes.add(new Outcome(sources.get(i), null, List.of(), String.valueOf(e.getCause())));
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private static Outcome compileOne(ICompiler compiler, Path source) {
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return new Outcome(source, null, List.of(), "cannot read: " + e.getMessage());
        }
        try {
            return new Outcome(source, compiler.compile(text, source.toString()), List.of(), null);
        } catch (CompilationException e) {
            return new Outcome(source, null, e.diagnostics(), null);
        }
    }
}
