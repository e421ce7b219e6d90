package org.shellsafe.compiler.api;

import org.shellsafe.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The result of a successful compilation. Nothing has been written yet; see
 * {@code ArtifactWriter} for the atomic write.
 *
 * @param sourceName The logical name of the source.
 * @param text The complete script, starting with {@code #!/bin/sh}.
 * @param sha256 The hex SHA-256 digest of {@code text}.
 * @param metrics The metrics of the final IR.
 * @param diagnostics The warnings of the run.
 */
public record ScriptArtifact(String sourceName, String text, String sha256, ScriptMetrics metrics,
                             List<Diagnostic> diagnostics) {

    public ScriptArtifact {
        diagnostics = List.copyOf(diagnostics);
    }
}
