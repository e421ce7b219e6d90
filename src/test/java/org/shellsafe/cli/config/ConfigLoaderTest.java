package org.shellsafe.cli.config;

import com.typesafe.config.Config;
import org.shellsafe.compiler.api.CompilerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConfigLoader} and the mapping onto {@link CompilerConfig}.
 */
public class ConfigLoaderTest {

    @TempDir
    Path dir;

    /**
     * Verifies the defaults from reference.conf when no file is present.
     */
    @Test
    @Tag("unit")
    void testDefaults() throws Exception {
        // Act
        CompilerConfig config = CompilerConfig.fromConfig(new ConfigLoader(dir).load(null));

        // Assert
        assertThat(config.strictMode()).isFalse();
        assertThat(config.enableConstantFolding()).isTrue();
        assertThat(config.enableDeadCodeElimination()).isTrue();
        assertThat(config.enableInlining()).isFalse();
        assertThat(config.inliningBranchThreshold()).isEqualTo(10);
        assertThat(config.verifyDeterminism()).isTrue();
        assertThat(config.analyzer().enabled()).isFalse();
        assertThat(config.analyzer().timeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.analyzer().severityThreshold()).isEqualTo(CompilerConfig.AnalyzerConfig.Severity.WARNING);
        assertThat(config).isEqualTo(CompilerConfig.defaults());
    }

    /**
     * Verifies that a shellsafe.conf in the working directory overrides single keys.
     */
    @Test
    @Tag("unit")
    void testLocalFileOverrides() throws Exception {
        // Arrange
        Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE_NAME), String.join("\n",
                "shellsafe.compiler.strict-mode = true",
                "shellsafe.compiler.analyzer {",
                "  command = [\"my-linter\", \"-\"]",
                "  timeout = 2s",
                "  severity-threshold = note",
                "}"));

        // Act
        CompilerConfig config = CompilerConfig.fromConfig(new ConfigLoader(dir).load(null));

        // Assert
        assertThat(config.strictMode()).isTrue();
        assertThat(config.enableConstantFolding()).isTrue();
        assertThat(config.analyzer().command()).isEqualTo(List.of("my-linter", "-"));
        assertThat(config.analyzer().timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.analyzer().severityThreshold()).isEqualTo(CompilerConfig.AnalyzerConfig.Severity.INFO);
    }

    /**
     * Verifies that an explicit file replaces the local one.
     */
    @Test
    @Tag("unit")
    void testExplicitFileWins() throws Exception {
        // Arrange
        Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE_NAME), "shellsafe.compiler.max-diagnostics = 3");
        Path explicit = dir.resolve("other.conf");
        Files.writeString(explicit, "shellsafe.compiler.enable-inlining = true\nlogging.format = DETAILED");

        // Act
        Config config = new ConfigLoader(dir).load(explicit);

        // Assert
        assertThat(CompilerConfig.fromConfig(config).enableInlining()).isTrue();
        assertThat(CompilerConfig.fromConfig(config).maxDiagnostics()).isEqualTo(20);
        assertThat(config.getString("logging.format")).isEqualTo("DETAILED");
    }

    /**
     * Verifies that a named but missing file is an error rather than silently ignored.
     */
    @Test
    @Tag("unit")
    void testMissingExplicitFile() {
        // Act & Assert
        assertThatThrownBy(() -> new ConfigLoader(dir).load(dir.resolve("nope.conf")))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessageContaining("nope.conf");
    }
}
