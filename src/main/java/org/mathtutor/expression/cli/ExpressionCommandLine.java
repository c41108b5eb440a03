package org.mathtutor.expression.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.mathtutor.expression.ExpressionEngine;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.cli.commands.AnalyzeCommand;
import org.mathtutor.expression.cli.commands.EvaluateCommand;
import org.mathtutor.expression.cli.commands.SimplifyCommand;
import org.mathtutor.expression.cli.commands.TokensCommand;
import org.mathtutor.expression.config.ConfigLoader;
import org.mathtutor.expression.config.EngineOptions;
import org.mathtutor.expression.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "mathtutor-expr",
    mixinStandardHelpOptions = true,
    version = "mathtutor-expr 1.0",
    description = "Tokenizes, evaluates, simplifies and analyzes algebraic expressions.",
    subcommands = {
        TokensCommand.class,
        EvaluateCommand.class,
        SimplifyCommand.class,
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class ExpressionCommandLine implements Callable<Integer> {

    /** Exit code of a command whose input is not an expression. */
    public static final int EXIT_PARSE_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionCommandLine.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private ExpressionEngine engine;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new ExpressionCommandLine());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            final Config config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
            engine = new ExpressionEngine(EngineOptions.fromConfig(config));
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.debug("Invalid configuration", e);
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load configuration: " + e.getMessage());
        }
    }

    /**
     * @return An engine configured from the merged configuration, created on first use.
     */
    public ExpressionEngine getEngine() {
        if (engine == null) {
            initialize();
        }
        return engine;
    }

    /**
     * Prints a parse error with a caret under the offending position.
     * @param err The error writer.
     * @param input The expression that failed to parse.
     * @param e The parse error.
     */
    public static void printParseError(PrintWriter err, String input, ParseException e) {
        err.println("error: " + e.getMessage() + " at position " + e.getPosition());
        err.println("  " + input);
        err.println("  " + " ".repeat(Math.min(e.getPosition(), input.length())) + "^");
    }
}
