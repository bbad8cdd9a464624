package com.skyfinal.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigResolveOptions;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for configuration loading:
 * - Defaults from reference.conf
 * - Fail-fast on a missing series id
 * - File and builder overrides
 */
@DisplayName("Pipeline Config Tests")
class PipelineConfigTest {

    @TempDir
    Path tempDir;

    private static Config withDefaults(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve(ConfigResolveOptions.noSystem());
    }

    // ==========================================
    // Test: Defaults
    // ==========================================

    @Test
    @DisplayName("Should read defaults once a series id is given")
    void testDefaults() {
        PipelineConfig config = PipelineConfig.fromConfig(withDefaults("pipeline.grid.series-id = \"2629390\""));

        assertEquals("2629390", config.getSeriesId());
        assertEquals(Duration.ofSeconds(5), config.getPollInterval());
        assertEquals(Duration.ofSeconds(1), config.getPollErrorBackoff());
        assertEquals(50, config.getHistoryWindowSize());
        assertEquals(Paths.get("DATA/history.json"), config.getHistoryFile());
        assertEquals(Set.of("Vandal", "Phantom", "Operator"), config.getPremiumWeapons());
        assertEquals(5, config.getVisibleCount());
        assertEquals(Duration.ofMillis(500), config.getClassificationPeriod());
        assertEquals(Duration.ofSeconds(2), config.getEventCooldown());
        assertEquals(0.5, config.getScaleFactor());
        assertEquals(0.8f, config.getJpegQuality());
        assertEquals(1240, config.getKillfeedRegion().getLeft());
        assertEquals(340, config.getRoundEndRegion().getHeight());
        assertEquals("qwen3-vl:2b", config.getClassifierModel());
        assertEquals(8090, config.getServerPort());
        System.out.println("✓ " + config);
    }

    // ==========================================
    // Test: Fail Fast
    // ==========================================

    @Test
    @DisplayName("Should refuse to load without a series id")
    void testMissingSeriesId() {
        Config config = withDefaults("");

        assertThrows(ConfigException.Missing.class, () -> PipelineConfig.fromConfig(config));
    }

    @Test
    @DisplayName("Should refuse a blank series id")
    void testBlankSeriesId() {
        Config config = withDefaults("pipeline.grid.series-id = \"  \"");

        assertThrows(ConfigException.BadValue.class, () -> PipelineConfig.fromConfig(config));
    }

    @Test
    @DisplayName("Should report unusable values as bad configuration")
    void testInvalidValue() {
        Config config = withDefaults("""
                pipeline.grid.series-id = "1"
                pipeline.vision.scale-factor = 3
                """);

        assertThrows(ConfigException.BadValue.class, () -> PipelineConfig.fromConfig(config));
    }

    // ==========================================
    // Test: Overrides
    // ==========================================

    @Test
    @DisplayName("Should let a configuration file override the defaults")
    void testFileOverride() throws Exception {
        Path file = tempDir.resolve("pipeline.conf");
        Files.writeString(file, """
                pipeline {
                  grid.series-id = "777"
                  poll.interval = 2s
                  tactical.premium-weapons = ["Operator"]
                }
                """);

        PipelineConfig config = PipelineConfig.fromConfig(ConfigLoader.load(file.toFile()));

        assertEquals("777", config.getSeriesId());
        assertEquals(Duration.ofSeconds(2), config.getPollInterval());
        assertEquals(Set.of("Operator"), config.getPremiumWeapons());
    }

    @Test
    @DisplayName("Should validate configurations built in code")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.builder().seriesId("1").historyWindowSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.builder().seriesId("1").visibleCount(-1).build());

        PipelineConfig config = PipelineConfig.builder().seriesId(" 42 ").build();
        assertEquals("42", config.getSeriesId());
        assertEquals(50, config.getHistoryWindowSize());
    }
}
