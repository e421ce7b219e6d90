package org.shellsafe.compiler;

import org.shellsafe.compiler.api.CompilationException;
import org.shellsafe.compiler.api.CompilerConfig;
import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.ICompiler;
import org.shellsafe.compiler.api.ScriptArtifact;
import org.shellsafe.compiler.api.ScriptMetrics;
import org.shellsafe.compiler.backend.emit.EmissionException;
import org.shellsafe.compiler.backend.emit.PosixEmitter;
import org.shellsafe.compiler.backend.optimize.Optimizer;
import org.shellsafe.compiler.diagnostics.CompilerLogger;
import org.shellsafe.compiler.diagnostics.Diagnostic;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.irgen.IrGenerator;
import org.shellsafe.compiler.frontend.irgen.LoweringException;
import org.shellsafe.compiler.frontend.lexer.Lexer;
import org.shellsafe.compiler.frontend.lexer.Token;
import org.shellsafe.compiler.frontend.parser.Parser;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.shellsafe.compiler.frontend.semantics.SemanticAnalyzer;
import org.shellsafe.compiler.ir.IrMetrics;
import org.shellsafe.compiler.ir.IrProgram;
import org.shellsafe.compiler.validation.AnalyzerFinding;
import org.shellsafe.compiler.validation.DeterminismCheck;
import org.shellsafe.compiler.validation.IrValidator;
import org.shellsafe.compiler.validation.PosixScriptChecker;
import org.shellsafe.compiler.validation.ProcessShellAnalyzer;
import org.shellsafe.compiler.validation.ShellAnalyzer;
import org.shellsafe.compiler.validation.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the entire compilation pipeline from
 * source text to a script artifact.
 * <p>
 * Instances hold only read-only configuration and may be used from several threads at once; each
 * call builds its own phase objects. The frontend collects diagnostics, every later phase fails
 * fast. All internal failures leave this class as a {@link CompilationException}.
 */
public class ShellCompiler implements ICompiler {

    private final CompilerConfig config;
    private final ShellAnalyzer analyzer;
    private final IrGenerator irGenerator = new IrGenerator();
    private final Optimizer optimizer = new Optimizer();
    private final IrValidator irValidator = new IrValidator();
    private final PosixScriptChecker scriptChecker = new PosixScriptChecker();
    private final PosixEmitter emitter = new PosixEmitter(VERSION);
    private volatile int verbosity = -1;

    /**
     * Creates a compiler with the defaults from {@code reference.conf}.
     */
    public ShellCompiler() {
        this(CompilerConfig.defaults());
    }

    /**
     * Creates a compiler. The external analyzer is a child process if the configuration enables it.
     * @param config The compiler configuration.
     */
    public ShellCompiler(CompilerConfig config) {
        this(config, config.analyzer().enabled() ? new ProcessShellAnalyzer(config.analyzer()) : null);
    }

    /**
     * Creates a compiler with an explicit analyzer.
     * @param config The compiler configuration.
     * @param analyzer The analyzer to run on every script, or {@code null} for none.
     */
    public ShellCompiler(CompilerConfig config, ShellAnalyzer analyzer) {
        this.config = config;
        this.analyzer = analyzer;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    public CompilerConfig config() {
        return config;
    }

    @Override
    public ScriptArtifact compile(String source, String sourceName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        List<Diagnostic> warnings = new ArrayList<>();
        try {
            Compiled first = run(source, sourceName, warnings);

            if (analyzer != null) {
                long start = System.nanoTime();
                List<AnalyzerFinding> findings = analyzer.verify(first.text(), config.analyzer().severityThreshold());
                findings.forEach(f -> CompilerLogger.debug(sourceName + ": analyzer note " + f));
                CompilerLogger.phase("analyzer", sourceName, start);
            }

            if (config.verifyDeterminism()) {
                long start = System.nanoTime();
                Compiled second = run(source, sourceName, new ArrayList<>());
                DeterminismCheck.verify(first.text(), second.text());
                CompilerLogger.phase("determinism check", sourceName, start);
            }

            IrMetrics metrics = IrMetrics.of(first.program());
            return new ScriptArtifact(sourceName, first.text(), DeterminismCheck.digest(first.text()),
                    new ScriptMetrics(metrics.branchCount(), metrics.nestingDepth(), metrics.functionCount(),
                            metrics.statementCount()),
                    warnings);
        } catch (LoweringException e) {
            throw failure(warnings, e.diagnostic(), e);
        } catch (EmissionException e) {
            throw failure(warnings, e.diagnostic(), e);
        } catch (ValidationException e) {
            if (e.diagnostic().code() == CompilerErrorCode.ANALYZER_FAILED) {
                CompilerLogger.warn(sourceName + ": " + e.getMessage());
            }
            throw failure(warnings, e.diagnostic(), e);
        }
    }

    private record Compiled(IrProgram program, String text) {}

    /**
     * Runs every phase except the analyzer and the determinism check.
     */
    private Compiled run(String source, String sourceName, List<Diagnostic> warnings) throws CompilationException {
        ProgramNode ast = frontend(source, sourceName, warnings);

        long start = System.nanoTime();
        IrProgram program = irGenerator.generate(ast, sourceName, DeterminismCheck.digest(source));
        CompilerLogger.phase("lowering", sourceName, start);

        start = System.nanoTime();
        program = optimizer.optimize(program, config);
        CompilerLogger.phase("optimization", sourceName, start);

        start = System.nanoTime();
        irValidator.validate(program);
        CompilerLogger.phase("IR validation", sourceName, start);

        start = System.nanoTime();
        String text = emitter.emit(program);
        CompilerLogger.phase("emission", sourceName, start);

        start = System.nanoTime();
        scriptChecker.check(text);
        CompilerLogger.phase("text validation", sourceName, start);
        return new Compiled(program, text);
    }

    private ProgramNode frontend(String source, String sourceName, List<Diagnostic> warnings) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(config.maxDiagnostics());

        long start = System.nanoTime();
        Lexer lexer = new Lexer(source, diagnostics, sourceName);
        List<Token> tokens = lexer.scanTokens();
        CompilerLogger.phase("lexing", sourceName, start);

        start = System.nanoTime();
        Parser parser = new Parser(tokens, diagnostics);
        ProgramNode ast = parser.parse();
        CompilerLogger.phase("parsing", sourceName, start);
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.getDiagnostics());
        }

        start = System.nanoTime();
        new SemanticAnalyzer(diagnostics).analyze(ast);
        CompilerLogger.phase("semantic analysis", sourceName, start);
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.getDiagnostics());
        }

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.severity() == Diagnostic.Severity.WARNING) {
                if (config.strictMode()) {
                    List<Diagnostic> all = new ArrayList<>(diagnostics.getDiagnostics());
                    all.add(Diagnostic.error(CompilerErrorCode.STRICT_MODE_WARNING,
                            "Strict mode: warning " + diagnostic.code().id() + " is fatal.", diagnostic.span()));
                    throw new CompilationException(all);
                }
                warnings.add(diagnostic);
            }
        }
        return ast;
    }

    private static CompilationException failure(List<Diagnostic> warnings, Diagnostic error, Throwable cause) {
        List<Diagnostic> all = new ArrayList<>(warnings);
        all.add(error);
        return new CompilationException(all, cause);
    }
}
