package org.stylecast.lowering.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the stylecast configuration and validates it against the bundled defaults.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Dstylecast.lowering.theme-key=tokens})</li>
 *   <li>The configuration file ({@code stylecast.conf} in the working directory, or the
 *       file named by the {@code stylecast.config} system property)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "stylecast.conf";
    private static final String CONFIG_FILE_PROPERTY = "stylecast.config";
    private static final String ROOT_PATH = "stylecast";

    private ConfigLoader() {}

    /**
     * @return The file consulted by {@link #load()}.
     */
    public static File configFile() {
        return new File(System.getProperty(CONFIG_FILE_PROPERTY, CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration using {@link #configFile()}.
     * @return The resolved and validated configuration.
     * @throws ConfigException if a setting under {@code stylecast} has the wrong type.
     */
    public static Config load() {
        return load(configFile());
    }

    /**
     * Loads the configuration with an explicit configuration file.
     *
     * @param configFile The file taking the place of {@code stylecast.conf}; skipped if missing.
     * @return The resolved and validated configuration.
     * @throws ConfigException if the file does not parse or a setting under {@code stylecast}
     *                         has the wrong type.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No configuration file at '{}', using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config reference = ConfigFactory.parseResources("reference.conf").resolve();
        final Config config = ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(reference)
            .resolve();

        config.checkValid(reference, ROOT_PATH);
        return config;
    }
}
