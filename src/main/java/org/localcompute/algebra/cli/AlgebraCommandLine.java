package org.localcompute.algebra.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.localcompute.algebra.api.AlgebraEngine;
import org.localcompute.algebra.api.IAlgebraEngine;
import org.localcompute.algebra.cli.commands.CompareCommand;
import org.localcompute.algebra.cli.commands.EvalCommand;
import org.localcompute.algebra.cli.commands.LatexCommand;
import org.localcompute.algebra.cli.commands.MistakesCommand;
import org.localcompute.algebra.cli.commands.PathCommand;
import org.localcompute.algebra.cli.commands.SimplifyCommand;
import org.localcompute.algebra.cli.commands.SuggestCommand;
import org.localcompute.algebra.cli.commands.VerifyCommand;
import org.localcompute.algebra.config.ConfigLoader;
import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "algebra",
    mixinStandardHelpOptions = true,
    version = "algebra-engine 1.0",
    description = "Parses, evaluates, simplifies and verifies algebraic expressions and derivations.",
    subcommands = {
        EvalCommand.class,
        SimplifyCommand.class,
        CompareCommand.class,
        VerifyCommand.class,
        MistakesCommand.class,
        SuggestCommand.class,
        PathCommand.class,
        LatexCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class AlgebraCommandLine implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AlgebraCommandLine.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: algebra.conf in the working directory)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private IAlgebraEngine engine;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new AlgebraCommandLine());
        commandLine.setCommandName("algebra");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging levels.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if {@code --config} names a missing or malformed file.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            if (configFile != null) {
                if (!configFile.isFile()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
                }
                LOG.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
                config = ConfigLoader.load(configFile);
            } else {
                config = ConfigLoader.load();
            }
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }
        LoggingConfigurator.configure(config);
        return config;
    }

    /**
     * @return The engine built from {@link #getConfig()}.
     */
    public IAlgebraEngine getEngine() {
        if (engine == null) {
            try {
                engine = new AlgebraEngine(EngineConfig.fromConfig(getConfig()));
            } catch (IllegalArgumentException | ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Invalid engine configuration: " + e.getMessage(), e, null, null);
            }
        }
        return engine;
    }
}
