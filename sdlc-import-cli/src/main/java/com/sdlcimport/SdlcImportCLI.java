package com.sdlcimport;

import ch.qos.logback.classic.Level;
import com.sdlcimport.cli.AnalyzeCommand;
import com.sdlcimport.cli.ListCommand;
import com.sdlcimport.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SDLC Import.
 *
 * <p>SDLC Import reverse-engineers an existing codebase into architecture decision records,
 * diagrams, a STRIDE threat model and a technical debt report.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Run the import on a source tree</li>
 *   <li>{@code validate} - Check the artifacts of a previous run</li>
 *   <li>{@code list} - List built-in signatures or rules</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Import the current directory
 * sdlc-import analyze
 *
 * # Import without the threat model, accepting a REVIEW verdict
 * sdlc-import -v analyze ../billing --skip-threat-model --yes
 *
 * # List the built-in threat rules
 * sdlc-import list threat-rules
 * }</pre>
 */
@Command(
    name = "sdlc-import",
    mixinStandardHelpOptions = true,
    version = "SDLC Import 1.0.0-SNAPSHOT",
    description = "Reverse-engineers architecture decisions and reports from an existing codebase",
    subcommands = {
        AnalyzeCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class SdlcImportCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SdlcImportCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("SDLC Import - Architecture Decision Import from Source Code");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sdlc-import --help' to see available commands");
        System.out.println("Use 'sdlc-import <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line; global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        SdlcImportCLI app = new SdlcImportCLI();
        CommandLine commandLine = new CommandLine(app);
        commandLine.setExecutionStrategy(parseResult -> {
            app.configureLogging();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
