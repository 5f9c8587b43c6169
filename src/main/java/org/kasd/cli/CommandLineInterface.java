package org.kasd.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.kasd.cli.config.ConfigLoader;
import org.kasd.cli.config.KasdSettings;
import org.kasd.cli.config.LoggingConfigurator;
import org.kasd.compiler.ExecutionResult;
import org.kasd.compiler.Pipeline;
import org.kasd.compiler.RunConfiguration;
import org.kasd.compiler.diagnostics.DiagnosticRenderer;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.diagnostics.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * The command-line entry point. With a source file the file is run once; without one an
 * interactive session is started.
 */
@Command(
    name = "kasd",
    mixinStandardHelpOptions = true,
    version = "KASD Language Interpreter 0.1",
    description = "Runs a KASD source file, or starts an interactive session when no file is given.",
    footer = {
        "",
        "Log Levels:",
        "  0: None",
        "  1: Error (default)",
        "  2: Warning",
        "  3: Info",
        "  4: Debug"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-l", "--log-level"}, paramLabel = "LEVEL", description = "Set log level (0-4, default: 1)")
    Integer logLevel;

    @Option(names = {"-c", "--config"}, description = "Path to a HOCON configuration file (default: kasd.conf)")
    File configFile;

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "The source file to run.")
    File sourceFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Pipeline pipeline = new Pipeline();

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (configFile != null && !configFile.exists()) {
            System.err.println("Configuration file not found: " + configFile.getPath());
            return 1;
        }

        final KasdSettings settings;
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            settings = KasdSettings.from(config);
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            System.err.println("Failed to load configuration: " + e.getMessage());
            return 1;
        }

        final int levelNumber = logLevel != null ? logLevel : settings.logLevel();
        final LogLevel level;
        try {
            level = LogLevel.fromNumber(levelNumber);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            spec.commandLine().usage(System.err);
            return 1;
        }
        LoggingConfigurator.apply(level);

        if (sourceFile != null) {
            return runFile(sourceFile, level, settings);
        }
        return runRepl(level, settings);
    }

    private int runFile(final File file, final LogLevel level, final KasdSettings settings) {
        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Could not read file {}", file, e);
            System.err.println("Could not read file: " + file.getPath());
            return 1;
        }

        final DiagnosticsEngine diagnostics = new DiagnosticsEngine(new DiagnosticRenderer(settings.colorDiagnostics()));
        final ExecutionResult result = pipeline.run(source, RunConfiguration.batch(level), diagnostics);
        if (!result.isSuccess()) {
            diagnostics.print(System.err);
            return 1;
        }
        return 0;
    }

    private int runRepl(final LogLevel level, final KasdSettings settings) {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            final LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            new ReplSession(lineReader, pipeline, settings, level, System.out, System.err).run();
            return 0;
        } catch (IOException e) {
            LOG.error("Failed to open the terminal", e);
            return 1;
        }
    }
}
