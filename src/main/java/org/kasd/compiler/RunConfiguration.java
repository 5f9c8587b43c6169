package org.kasd.compiler;

import org.kasd.compiler.diagnostics.LogLevel;

import java.io.PrintStream;

/**
 * Settings for one run of the {@link Pipeline}.
 *
 * @param logLevel The verbosity; at {@link LogLevel#DEBUG} the analyzed tree is dumped.
 * @param interactive Whether declarations echo their binding to {@code out}.
 * @param out The primary output for echoed bindings.
 */
public record RunConfiguration(LogLevel logLevel, boolean interactive, PrintStream out) {

    /**
     * Non-interactive run writing to {@code System.out}.
     * @param logLevel The verbosity.
     * @return The configuration.
     */
    public static RunConfiguration batch(LogLevel logLevel) {
        return new RunConfiguration(logLevel, false, System.out);
    }

    /**
     * Interactive run writing to {@code System.out}.
     * @param logLevel The verbosity.
     * @return The configuration.
     */
    public static RunConfiguration interactive(LogLevel logLevel) {
        return new RunConfiguration(logLevel, true, System.out);
    }
}
