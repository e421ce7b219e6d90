package org.shellsafe.compiler;

import org.shellsafe.compiler.api.ScriptArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Writes a script artifact atomically: the text goes to a temporary file in the target directory
 * which is then moved over the final path. A reader never sees a partial script, and a failed
 * write leaves no file behind.
 */
public final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    /**
     * Writes the artifact.
     * @param artifact The compiled artifact.
     * @param target The final path of the script.
     * @return The absolute path written.
     * @throws IOException if the directory or the file cannot be written.
     */
    public Path write(ScriptArtifact artifact, Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);

        Path temporary = Files.createTempFile(directory, "." + absolute.getFileName() + ".", ".tmp");
        try {
            Files.writeString(temporary, artifact.text(), StandardCharsets.UTF_8);
            makeExecutable(temporary);
            try {
                Files.move(temporary, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing instead", directory);
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
        log.info("Wrote {} (sha256 {})", absolute, artifact.sha256());
        return absolute;
    }

    private static void makeExecutable(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            log.debug("{} does not support POSIX permissions", file.getFileSystem());
        }
    }
}
