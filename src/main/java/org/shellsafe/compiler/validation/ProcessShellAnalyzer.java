package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerConfig.AnalyzerConfig;
import org.shellsafe.compiler.api.CompilerConfig.AnalyzerConfig.Severity;
import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs an external analyzer such as ShellCheck as a child process. The script is written to the
 * analyzer's stdin and findings are read from stdout in the gcc format
 * ({@code file:line:column: severity: message [code]}).
 * <p>
 * Exit code 0 means no findings and 1 means findings; anything else, a start failure or a
 * timeout is an analyzer failure. The process is always destroyed when the call returns.
 */
public class ProcessShellAnalyzer implements ShellAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProcessShellAnalyzer.class);

    private static final Pattern GCC_LINE =
            Pattern.compile("^[^:]*:(\\d+):(\\d+): ([A-Za-z]+): (.*?)(?: \\[([A-Za-z0-9]+)\\])?$");

    private final AnalyzerConfig config;

    public ProcessShellAnalyzer(AnalyzerConfig config) {
        if (config.command().isEmpty()) {
            throw new IllegalArgumentException("The analyzer command must not be empty");
        }
        this.config = config;
    }

    @Override
    public List<AnalyzerFinding> analyze(String script) {
        Process process;
        try {
            process = new ProcessBuilder(config.command()).start();
        } catch (IOException e) {
            throw failed("Cannot start '" + config.command().get(0) + "': " + e.getMessage(), e);
        }
        try {
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(script.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.debug("Analyzer closed its input early: {}", e.getMessage());
            }

            long timeoutMillis = config.timeout().toMillis();
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw failed("The analyzer did not finish within " + config.timeout().toMillis() + " ms.", null);
            }
            int exitCode = process.exitValue();
            String output = stdout.get(timeoutMillis, TimeUnit.MILLISECONDS);
            List<AnalyzerFinding> findings = parse(output);
            // exit code 1 means "findings reported"; without any it is a failure like every other code
            if (exitCode != 0 && (exitCode != 1 || findings.isEmpty())) {
                String errors = stderr.get(timeoutMillis, TimeUnit.MILLISECONDS).trim();
                throw failed("The analyzer exited with code " + exitCode + (errors.isEmpty() ? "." : ": " + errors), null);
            }
            log.debug("Analyzer reported {} finding(s)", findings.size());
            return findings;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed("Interrupted while waiting for the analyzer.", e);
        } catch (ExecutionException | TimeoutException e) {
            throw failed("Cannot read the analyzer output: " + e.getMessage(), e);
        } finally {
            process.destroyForcibly();
        }
    }

    /**
     * Parses analyzer output in the gcc format. Lines that do not match are ignored.
     * @param output The analyzer's stdout.
     * @return The findings.
     */
    static List<AnalyzerFinding> parse(String output) {
        List<AnalyzerFinding> findings = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Matcher m = GCC_LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            Severity severity;
            try {
                severity = Severity.parse(m.group(3));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown analyzer severity '{}', treating it as an error", m.group(3));
                severity = Severity.ERROR;
            }
            findings.add(new AnalyzerFinding(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), severity,
                    m.group(5) == null ? "" : m.group(5), m.group(4)));
        }
        return findings;
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ValidationException failed(String message, Throwable cause) {
        return new ValidationException(CompilerErrorCode.ANALYZER_FAILED, message, SourceSpan.UNKNOWN, cause);
    }
}
