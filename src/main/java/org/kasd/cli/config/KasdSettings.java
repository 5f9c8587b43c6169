package org.kasd.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.kasd.compiler.diagnostics.LogLevel;

/**
 * Typed view of the {@code kasd} configuration block.
 * <pre>
 * kasd {
 *   log-level = 1            # 0=none .. 4=debug, overridden by --log-level
 *   diagnostics.color = true # ANSI colours in rendered diagnostics
 *   repl {
 *     banner = true
 *     prompt = "> "
 *   }
 * }
 * </pre>
 *
 * @param logLevel The configured log level number, used when --log-level is absent (validated when applied).
 * @param colorDiagnostics Whether diagnostics are rendered with ANSI colours.
 * @param showBanner Whether the interactive session prints its banner.
 * @param prompt The interactive prompt.
 */
public record KasdSettings(int logLevel, boolean colorDiagnostics, boolean showBanner, String prompt) {

    private static final String ROOT = "kasd";

    /**
     * Reads the settings from a resolved configuration. Missing keys fall back to the built-in defaults.
     * @param config The application configuration.
     * @return The settings.
     */
    public static KasdSettings from(Config config) {
        Config kasd = config.hasPath(ROOT) ? config.getConfig(ROOT) : ConfigFactory.empty();
        return new KasdSettings(
                kasd.hasPath("log-level") ? kasd.getInt("log-level") : LogLevel.ERROR.number(),
                !kasd.hasPath("diagnostics.color") || kasd.getBoolean("diagnostics.color"),
                !kasd.hasPath("repl.banner") || kasd.getBoolean("repl.banner"),
                kasd.hasPath("repl.prompt") ? kasd.getString("repl.prompt") : "> "
        );
    }
}
