package org.shellsafe.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Resolves the application configuration.
 * <p>
 * Load order, highest precedence first: system properties, environment variables, the file given
 * with {@code --config} (or {@value #CONFIG_FILE_NAME} in the working directory), and finally
 * {@code reference.conf} from the classpath.
 */
public final class ConfigLoader {

    public static final String CONFIG_FILE_NAME = "shellsafe.conf";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path workingDirectory;

    /**
     * @param workingDirectory The directory searched for {@value #CONFIG_FILE_NAME}.
     */
    public ConfigLoader(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    /**
     * Loads the configuration.
     * @param explicitFile The file named on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws NoSuchFileException if the explicit file does not exist.
     * @throws IOException if the explicit file cannot be read.
     * @throws com.typesafe.config.ConfigException if a file is not valid HOCON.
     */
    public Config load(Path explicitFile) throws IOException {
        Config file = ConfigFactory.empty();
        if (explicitFile != null) {
            if (!Files.isRegularFile(explicitFile)) {
                throw new NoSuchFileException(explicitFile.toAbsolutePath().toString(), null, "configuration file not found");
            }
            if (!Files.isReadable(explicitFile)) {
                throw new IOException("Configuration file is not readable: " + explicitFile.toAbsolutePath());
            }
            log.debug("Using configuration file specified via --config: {}", explicitFile.toAbsolutePath());
            file = ConfigFactory.parseFile(explicitFile.toFile());
        } else {
            Path local = workingDirectory.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(local)) {
                log.debug("Using configuration file found in working directory: {}", local.toAbsolutePath());
                file = ConfigFactory.parseFile(local.toFile());
            } else {
                log.debug("No '{}' found, using defaults from classpath.", CONFIG_FILE_NAME);
            }
        }
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(file)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
