package com.skyfinal.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the pipeline configuration.
 *
 * Precedence, highest first:
 * 1. Environment variables
 * 2. System properties ({@code -Dpipeline.poll.interval=2s})
 * 3. {@code pipeline.conf} in the working directory
 * 4. {@code reference.conf} on the classpath
 */
public final class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "pipeline.conf";

    private ConfigLoader() {
    }

    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    public static Config load(File configFile) {
        Config envConfig = ConfigFactory.systemEnvironment();
        Config propertyConfig = ConfigFactory.systemProperties();

        Config fileConfig;
        if (configFile.isFile()) {
            logger.info("Loading configuration from {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            logger.debug("No configuration file at {}, using defaults", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        Config defaults = ConfigFactory.parseResources("reference.conf");

        return envConfig
                .withFallback(propertyConfig)
                .withFallback(fileConfig)
                .withFallback(defaults)
                .resolve();
    }
}
