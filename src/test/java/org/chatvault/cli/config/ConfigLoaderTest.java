package org.chatvault.cli.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Configuration precedence: system properties, then the file, then {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    File tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("chatvault.replay.port");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadDefaults exposes every reference.conf key")
    void loadDefaults_shouldExposeReferenceKeys() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(".state", config.getString("chatvault.record.state-suffix"));
        assertEquals("127.0.0.1", config.getString("chatvault.replay.host"));
        assertEquals(8080, config.getInt("chatvault.replay.port"));
        assertEquals("/api", config.getString("chatvault.replay.base-path"));
        assertEquals("PLAIN", config.getString("logging.format"));
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("File values override defaults, untouched keys keep their default")
    void loadFromFile_shouldOverrideDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(".ledger", config.getString("chatvault.record.state-suffix"));
        assertEquals(9191, config.getInt("chatvault.replay.port"));
        assertEquals("127.0.0.1", config.getString("chatvault.replay.host"));
        assertEquals("DEBUG", config.getString("logging.levels.\"org.chatvault.replay\""));
    }

    @Test
    @DisplayName("Substitutions in the file are resolved after composition")
    void loadFromFile_shouldResolveSubstitutions() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("/slack/api", config.getString("chatvault.replay.base-path"));
    }

    @Test
    @DisplayName("System property overrides the file")
    void loadFromFile_systemPropertyShouldOverrideFile() {
        System.setProperty("chatvault.replay.port", "7000");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(7000, config.getInt("chatvault.replay.port"));
        assertEquals(".ledger", config.getString("chatvault.record.state-suffix"));
    }

    @Test
    @DisplayName("Explicit file is used and reported")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
            (level, message) -> messages.add(level + " " + message));

        assertEquals(9191, config.getInt("chatvault.replay.port"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("Missing explicit file is an error")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File(tempDir, "missing.conf");

        assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(missing, (level, message) -> { }));
    }

    @Test
    @DisplayName("config.file system property is honoured")
    void resolve_shouldUseConfigFileProperty() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.resolve(null, (level, message) -> { });

        assertEquals(".ledger", config.getString("chatvault.record.state-suffix"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
