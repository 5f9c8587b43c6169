package org.kasd.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link ConfigLoader} and {@link KasdSettings}.
 */
public class KasdSettingsTest {

    @TempDir
    Path tempDir;

    /**
     * Verifies the defaults shipped in reference.conf.
     */
    @Test
    @Tag("unit")
    void testDefaultsFromReferenceConf() {
        // Act
        KasdSettings settings = KasdSettings.from(ConfigLoader.load(tempDir.resolve("absent.conf").toFile()));

        // Assert
        assertThat(settings).isEqualTo(new KasdSettings(1, true, true, "> "));
    }

    /**
     * Verifies that a configuration file overrides the defaults it names and keeps the rest.
     */
    @Test
    @Tag("unit")
    void testFileOverridesDefaults() throws IOException {
        // Arrange
        File file = tempDir.resolve("kasd.conf").toFile();
        Files.writeString(file.toPath(), "kasd { log-level = 3, repl.prompt = \"kasd> \" }", StandardCharsets.UTF_8);

        // Act
        KasdSettings settings = KasdSettings.from(ConfigLoader.load(file));

        // Assert
        assertThat(settings.logLevel()).isEqualTo(3);
        assertThat(settings.prompt()).isEqualTo("kasd> ");
        assertThat(settings.showBanner()).isTrue();
    }

    /**
     * Verifies that system properties take precedence over the configuration file.
     */
    @Test
    @Tag("unit")
    void testSystemPropertyWins() throws IOException {
        File file = tempDir.resolve("kasd.conf").toFile();
        Files.writeString(file.toPath(), "kasd.repl.banner = true", StandardCharsets.UTF_8);
        System.setProperty("kasd.repl.banner", "false");
        ConfigFactory.invalidateCaches();
        try {
            assertThat(KasdSettings.from(ConfigLoader.load(file)).showBanner()).isFalse();
        } finally {
            System.clearProperty("kasd.repl.banner");
            ConfigFactory.invalidateCaches();
        }
    }

    /**
     * Verifies the built-in fallbacks for a configuration without a kasd block.
     */
    @Test
    @Tag("unit")
    void testMissingBlockFallsBack() {
        Config empty = ConfigFactory.empty();

        KasdSettings settings = KasdSettings.from(empty);

        assertThat(settings).isEqualTo(new KasdSettings(1, true, true, "> "));
    }
}
