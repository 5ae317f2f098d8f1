package com.infragraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.cli.ProvidersCommand;
import com.infragraph.cli.RenderCommand;
import com.infragraph.cli.ValidateCommand;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for InfraGraph.
 *
 * <p>InfraGraph turns the resource graph of an infrastructure-as-code project into an
 * architecture diagram.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Run the pipeline and write diagrams</li>
 *   <li>{@code validate} - Run the pipeline and report hierarchy diagnostics</li>
 *   <li>{@code providers} - List registered cloud providers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * infragraph render graph.json -o ./diagrams -f mermaid -f json
 * infragraph validate graph.json --strict
 * infragraph -v providers
 * }</pre>
 */
@Command(
    name = "infragraph",
    mixinStandardHelpOptions = true,
    version = "InfraGraph 1.0.0-SNAPSHOT",
    description = "Multi-cloud architecture diagrams from infrastructure-as-code resource graphs",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class,
        ProvidersCommand.class
    }
)
public class InfraGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(InfraGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("InfraGraph - Multi-cloud Architecture Diagrams");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'infragraph --help' to see available commands");
        System.out.println("Use 'infragraph <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line, applying the logging options before any subcommand runs.
     *
     * @param cli root command instance
     * @return configured command line
     */
    public static CommandLine commandLine(InfraGraphCLI cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine(new InfraGraphCLI()).execute(args);
        System.exit(exitCode);
    }
}
