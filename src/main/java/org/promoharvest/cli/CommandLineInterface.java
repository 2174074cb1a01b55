package org.promoharvest.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.promoharvest.cli.commands.ImportCommand;
import org.promoharvest.cli.commands.IngestCommand;
import org.promoharvest.cli.commands.MergeCommand;
import org.promoharvest.cli.commands.RepairCommand;
import org.promoharvest.cli.commands.StatusCommand;
import org.promoharvest.cli.config.ConfigLoader;
import org.promoharvest.cli.config.LoggingConfigurator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "promoharvest",
    mixinStandardHelpOptions = true,
    version = "promoharvest 0.1.0",
    description = "Resumable ingestion of promotional-product records",
    subcommands = {
        IngestCommand.class,
        RepairCommand.class,
        MergeCommand.class,
        ImportCommand.class,
        StatusCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Command line with the error handling used by {@link #main(String[])}: failures inside a
     * command print their message to stderr and exit with {@code 1}.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("promoharvest");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + ex.getMessage());
            LoggerFactory.getLogger(CommandLineInterface.class).debug("Command failed", ex);
            return 1;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        try {
            this.config = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    public PipelineFactory createFactory() {
        return new PipelineFactory(getConfig());
    }
}
