package org.stylecast.lowering.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties over the configuration file over reference.conf.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("stylecast.lowering.theme-key");
        System.clearProperty("stylecast.config");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("stylecast.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when the file is missing")
    void load_shouldUseDefaultsWhenFileIsMissing() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertEquals("__SC_EXPR_", config.getString("stylecast.lowering.placeholder-prefix"));
        assertTrue(config.getBoolean("stylecast.lowering.recover-dropped-placeholders"));
        assertEquals("themeVars", config.getString("stylecast.adapter.theme.object"));
    }

    @Test
    @DisplayName("File values should override reference.conf and keep the remaining defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("stylecast.lowering.theme-key = \"tokens\"\nstylecast.adapter.theme.object = \"t\"\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("tokens", config.getString("stylecast.lowering.theme-key"));
        assertEquals("t", config.getString("stylecast.adapter.theme.object"));
        assertEquals("./tokens.stylex", config.getString("stylecast.adapter.theme.import-source"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = writeConfig("stylecast.lowering.theme-key = \"tokens\"\n");
        System.setProperty("stylecast.lowering.theme-key", "palette");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("palette", config.getString("stylecast.lowering.theme-key"));
        assertEquals("palette", LoweringOptions.fromConfig(config).themeKey());
    }

    @Test
    @DisplayName("A setting with the wrong type should be rejected")
    void load_shouldRejectWrongType() throws IOException {
        // Arrange
        File file = writeConfig("stylecast.lowering.recover-dropped-placeholders { enabled = true }\n");

        // Act & Assert
        ConfigException.ValidationFailed failure =
            assertThrows(ConfigException.ValidationFailed.class, () -> ConfigLoader.load(file));
        assertTrue(failure.getMessage().contains("recover-dropped-placeholders"));
    }

    @Test
    @DisplayName("The stylecast.config system property should name the configuration file")
    void configFile_shouldFollowSystemProperty() throws IOException {
        // Arrange
        File file = writeConfig("stylecast.adapter.css-variables.object = \"cssVars\"\n");
        System.setProperty("stylecast.config", file.getAbsolutePath());

        // Act
        Config config = ConfigLoader.load(ConfigLoader.configFile());

        // Assert
        assertEquals(file.getAbsolutePath(), ConfigLoader.configFile().getPath());
        assertEquals("cssVars", config.getString("stylecast.adapter.css-variables.object"));
    }

    @Test
    @DisplayName("Without the system property the working directory file is used")
    void configFile_shouldDefaultToWorkingDirectory() {
        assertEquals("stylecast.conf", ConfigLoader.configFile().getPath());
    }

    @Test
    @DisplayName("A directory in place of the file should be skipped")
    void load_shouldSkipDirectory() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertEquals("theme", config.getString("stylecast.lowering.theme-key"));
    }
}
