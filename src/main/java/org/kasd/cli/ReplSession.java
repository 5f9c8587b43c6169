package org.kasd.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.kasd.cli.config.KasdSettings;
import org.kasd.compiler.Pipeline;
import org.kasd.compiler.RunConfiguration;
import org.kasd.compiler.diagnostics.DiagnosticRenderer;
import org.kasd.compiler.diagnostics.DiagnosticsEngine;
import org.kasd.compiler.diagnostics.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * The interactive loop: reads one line at a time and runs it as its own compilation unit
 * in interactive mode. The session ends on a line reading {@code exit}, at end of input or on Ctrl+C.
 * The diagnostic of a line is printed and cleared before the next line is read.
 */
public class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);
    private static final String EXIT_COMMAND = "exit";

    private final LineReader lineReader;
    private final Pipeline pipeline;
    private final KasdSettings settings;
    private final LogLevel logLevel;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * @param lineReader The source of input lines.
     * @param pipeline The pipeline running each line.
     * @param settings The session settings (banner, prompt, colours).
     * @param logLevel The log level passed to every run.
     * @param out The primary output for the banner and echoed bindings.
     * @param err The diagnostic output.
     */
    public ReplSession(LineReader lineReader, Pipeline pipeline, KasdSettings settings, LogLevel logLevel,
                       PrintStream out, PrintStream err) {
        this.lineReader = lineReader;
        this.pipeline = pipeline;
        this.settings = settings;
        this.logLevel = logLevel;
        this.out = out;
        this.err = err;
    }

    /**
     * Runs the session until the user leaves it.
     * @return The number of lines that failed with a diagnostic.
     */
    public int run() {
        if (settings.showBanner()) {
            out.println("KASD Language Interpreter v0.1");
            out.println("Type 'exit' to quit");
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine(new DiagnosticRenderer(settings.colorDiagnostics()));
        RunConfiguration config = new RunConfiguration(logLevel, true, out);
        int failures = 0;

        while (true) {
            String line;
            try {
                line = lineReader.readLine(settings.prompt());
            } catch (UserInterruptException e) {
                LOG.debug("Interrupted, leaving interactive session.");
                break;
            } catch (EndOfFileException e) {
                LOG.debug("End of input, leaving interactive session.");
                break;
            }
            if (line == null || EXIT_COMMAND.equals(line.strip())) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }

            try {
                if (!pipeline.run(line, config, diagnostics).isSuccess()) {
                    failures++;
                    diagnostics.print(err);
                }
            } finally {
                diagnostics.clear();
            }
        }
        return failures;
    }
}
