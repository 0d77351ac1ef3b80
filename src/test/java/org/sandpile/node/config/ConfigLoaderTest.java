package org.sandpile.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the layered configuration loading.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String GRID_SIZE_PROPERTY = "sandpile.simulation.grid-size";

    @AfterEach
    void tearDown() {
        System.clearProperty(GRID_SIZE_PROPERTY);
    }

    @Test
    void referenceDefaultsApplyWithoutFile() {
        final Config config = ConfigLoader.loadResource("does-not-exist.conf");

        assertEquals(30, config.getInt("sandpile.simulation.grid-size"));
        assertEquals(5000, config.getInt("sandpile.simulation.iterations"));
        assertEquals(42L, config.getLong("sandpile.simulation.seed"));
        assertEquals(100, config.getInt("sandpile.statistics.max-cascade"));
        assertEquals(50, config.getInt("sandpile.statistics.num-bins"));
        assertEquals("images", config.getString("sandpile.output.frame-directory"));
        assertEquals(64, config.getInt("sandpile.video.fps"));
        assertEquals("sandpile_2d.mp4", config.getString("sandpile.video.output"));
    }

    @Test
    void fileValuesOverrideDefaults() {
        final Config config = ConfigLoader.loadResource("test-config.conf");

        assertEquals(5, config.getInt("sandpile.simulation.grid-size"));
        assertEquals(20, config.getInt("sandpile.simulation.iterations"));
        assertEquals(2, config.getInt("sandpile.output.cell-size"));
        assertEquals(0L, config.getLong("sandpile.simulation.max-waves"));
    }

    @Test
    void systemPropertiesOverrideFile() {
        System.setProperty(GRID_SIZE_PROPERTY, "9");

        final Config config = ConfigLoader.loadResource("test-config.conf");

        assertEquals(9, config.getInt("sandpile.simulation.grid-size"));
    }

    @Test
    void explicitFileIsLoaded(@TempDir Path tempDir) throws Exception {
        final Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "sandpile.simulation.iterations = 77\n");

        final Config config = ConfigLoader.load(file.toFile());

        assertEquals(77, config.getInt("sandpile.simulation.iterations"));
        assertEquals(30, config.getInt("sandpile.simulation.grid-size"));
    }

    @Test
    void missingExplicitFileFails(@TempDir Path tempDir) {
        final File missing = tempDir.resolve("missing.conf").toFile();

        final ConfigException.IO e = assertThrows(ConfigException.IO.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("missing.conf"));
    }

    @Test
    void overridesReplaceValuesAndSkipNulls() {
        final Map<String, Object> overrides = new HashMap<>();
        overrides.put("sandpile.simulation.grid-size", 11);
        overrides.put("sandpile.simulation.iterations", null);
        overrides.put("sandpile.output.display", true);

        final Config config = ConfigLoader.withOverrides(ConfigLoader.loadResource("test-config.conf"), overrides);

        assertEquals(11, config.getInt("sandpile.simulation.grid-size"));
        assertEquals(20, config.getInt("sandpile.simulation.iterations"));
        assertTrue(config.getBoolean("sandpile.output.display"));
    }
}
