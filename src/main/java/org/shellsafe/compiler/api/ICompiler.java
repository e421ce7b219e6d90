package org.shellsafe.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the shellsafe compiler.
 */
public interface ICompiler {

    /** The compiler version written into the provenance header of every script. */
    String VERSION = "1.0.0";

    /**
     * Compiles the given source code into a POSIX shell script.
     *
     * @param source The complete source text.
     * @param sourceName A logical name for the source, used in diagnostics and the provenance header.
     * @return A {@link ScriptArtifact} containing the script and its metadata.
     * @throws CompilationException if the source is rejected by any phase.
     */
    ScriptArtifact compile(String source, String sourceName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles a source file.
     * @param sourcePath The path to the source file, read as UTF-8.
     * @return A {@link ScriptArtifact} containing the compiled script.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default ScriptArtifact compile(Path sourcePath) throws CompilationException, IOException {
        return compile(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString());
    }
}
