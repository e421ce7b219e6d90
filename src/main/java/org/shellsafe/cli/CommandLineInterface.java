package org.shellsafe.cli;

import com.typesafe.config.Config;
import org.shellsafe.cli.commands.BuildCommand;
import org.shellsafe.cli.commands.CheckCommand;
import org.shellsafe.cli.config.ConfigLoader;
import org.shellsafe.cli.config.LoggingConfigurator;
import org.shellsafe.compiler.api.ICompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "shellsafe",
    mixinStandardHelpOptions = true,
    version = "shellsafe " + ICompiler.VERSION,
    description = "Compiles a safe subset of Rust into POSIX shell scripts.",
    subcommands = {
        BuildCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Successful run. */
    public static final int EXIT_OK = 0;
    /** At least one source was rejected by the compiler. */
    public static final int EXIT_COMPILATION_FAILED = 1;
    /** Usage, configuration or I/O error. */
    public static final int EXIT_USAGE_OR_IO = 2;

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private Path configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * @return A command line with the exit code mapping of this tool.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("shellsafe");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            log.error("Unexpected failure: {}", e.getMessage(), e);
            return EXIT_USAGE_OR_IO;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws IOException if an explicitly named configuration file cannot be read.
     * @throws com.typesafe.config.ConfigException if the configuration is malformed.
     */
    public Config getConfig() throws IOException {
        if (config == null) {
            config = new ConfigLoader(Path.of("")).load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
