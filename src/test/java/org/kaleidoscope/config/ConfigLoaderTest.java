package org.kaleidoscope.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.kaleidoscope.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. Environment Variables / System Properties
 * 2. Explicit configuration file
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String SEPARATOR_PATH = "kaleidoscope.frontend.input-separator";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(SEPARATOR_PATH);
        ConfigFactory.invalidateCaches();
    }

    /**
     * Verifies that reference.conf supplies every default when nothing overrides it.
     */
    @Test
    @DisplayName("Should fall back to reference.conf when nothing else is configured")
    void load_shouldUseReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load();

        // Assert
        assertEquals(" ", config.getString(SEPARATOR_PATH));
        assertEquals(20, config.getInt("kaleidoscope.frontend.binary-operators.\"+\""));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    /**
     * Verifies that an explicit file overrides the keys it sets and leaves the rest to the defaults.
     */
    @Test
    @DisplayName("Explicit file should override reference defaults")
    void load_explicitFileOverridesDefaults() throws IOException {
        // Arrange
        File file = writeConfig("kaleidoscope.frontend.input-separator = \",\"\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(",", config.getString(SEPARATOR_PATH));
        assertEquals(40, config.getInt("kaleidoscope.frontend.binary-operators.\"*\""));
    }

    /**
     * Verifies that a system property wins over the explicit file.
     */
    @Test
    @DisplayName("System properties should override the explicit file")
    void load_systemPropertyOverridesFile() throws IOException {
        // Arrange
        File file = writeConfig("kaleidoscope.frontend.input-separator = \",\"\n");
        System.setProperty(SEPARATOR_PATH, "|");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("|", config.getString(SEPARATOR_PATH));
    }

    /**
     * Verifies that naming a file that does not exist is an error rather than a silent fallback.
     */
    @Test
    @DisplayName("Missing explicit file should be rejected")
    void load_missingExplicitFileIsRejected() {
        // Arrange
        File missing = tempDir.resolve("absent.conf").toFile();

        // Act & Assert
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("absent.conf"));
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content);
        return file.toFile();
    }
}
