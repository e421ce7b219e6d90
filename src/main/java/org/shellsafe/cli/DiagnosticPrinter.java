package org.shellsafe.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.shellsafe.compiler.api.ScriptMetrics;
import org.shellsafe.compiler.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders diagnostics for humans (one line per diagnostic, compiler style) or as JSON for
 * reporting layers.
 */
public final class DiagnosticPrinter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private DiagnosticPrinter() {}

    /**
     * The JSON shape of one diagnostic.
     */
    public record DiagnosticJson(String code, String kind, String severity, String message, String file, int line,
                          int column, String fixIt, String explanation) {

        static DiagnosticJson of(Diagnostic d) {
            return new DiagnosticJson(d.code().id(), d.kind().name(), d.severity().name(), d.message(),
                    d.span().fileName(), d.span().line(), d.span().column(), d.fixIt(), d.explanation());
        }
    }

    /**
     * The JSON shape of the outcome of one source.
     */
    public record SourceReport(String source, String status, String sha256, ScriptMetrics metrics,
                        List<DiagnosticJson> diagnostics) {}

    /**
     * Formats a diagnostic as {@code file:line:column: severity[code]: message}, followed by a
     * help line if it carries a fix-it.
     */
    public static String text(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostic.span()).append(": ")
                .append(diagnostic.severity().name().toLowerCase(Locale.ROOT))
                .append('[').append(diagnostic.code().id()).append("]: ")
                .append(diagnostic.message());
        diagnostic.suggestedFix().ifPresent(fix -> sb.append(System.lineSeparator()).append("  help: ").append(fix));
        return sb.toString();
    }

    public static SourceReport report(String source, String status, String sha256, ScriptMetrics metrics,
                               List<Diagnostic> diagnostics) {
        List<DiagnosticJson> json = new ArrayList<>();
        diagnostics.forEach(d -> json.add(DiagnosticJson.of(d)));
        return new SourceReport(source, status, sha256, metrics, json);
    }

    public static String json(List<SourceReport> reports) {
        return GSON.toJson(reports);
    }
}
