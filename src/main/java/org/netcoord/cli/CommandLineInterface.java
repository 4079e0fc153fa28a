package org.netcoord.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.netcoord.cli.commands.RunCommand;
import org.netcoord.cli.config.ConfigLoader;
import org.netcoord.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "netcoord",
    mixinStandardHelpOptions = true,
    version = "netcoord 1.0",
    description = "netcoord - lockstep coordination of control agents over composite network simulators",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to the scenario configuration (default: config/netcoord.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line exactly as {@link #main(String[])} uses it; tests call this too.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("netcoord");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the named configuration file does not exist.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
            Config loaded = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
            applyLogging(loaded);
            config = loaded;
        }
        return config;
    }

    private static void applyLogging(Config config) {
        if (config.hasPath("netcoord.logging.format")) {
            String format = config.getString("netcoord.logging.format");
            System.setProperty("netcoord.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
    }

    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
