package org.astroseq.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Central configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 */
public final class ConfigLoader {

    static final String CONFIG_FILE_PROPERTY = "config.file";
    static final File DEFAULT_CONFIG_FILE = new File("config", "astroseq.conf");

    private ConfigLoader() {
    }

    /**
     * Notified with the user configuration file that was picked.
     */
    @FunctionalInterface
    public interface ConfigSourceListener {
        /**
         * @param origin Where the file came from, e.g. {@code --config}.
         * @param file   Absolute path of the file.
         */
        void onConfigFile(String origin, File file);
    }

    /**
     * Resolves configuration with the user file taken from, in this order, the {@code --config}
     * option, the {@code config.file} system property, or {@code config/astroseq.conf} in the
     * working directory. Without any of them only {@code reference.conf} is used.
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null} for auto-discovery.
     * @param listener           told which user file was used, if any.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigSourceListener listener) {
        if (explicitConfigFile != null) {
            return loadRequired(explicitConfigFile, "--config", listener);
        }
        final String propertyPath = System.getProperty(CONFIG_FILE_PROPERTY);
        if (propertyPath != null && !propertyPath.isBlank()) {
            return loadRequired(new File(propertyPath), "-D" + CONFIG_FILE_PROPERTY, listener);
        }
        if (DEFAULT_CONFIG_FILE.isFile()) {
            listener.onConfigFile("working directory", DEFAULT_CONFIG_FILE.getAbsoluteFile());
            return loadFromFile(DEFAULT_CONFIG_FILE);
        }
        // A config file is optional for batch processing.
        return loadDefaults();
    }

    private static Config loadRequired(final File file, final String origin, final ConfigSourceListener listener) {
        final File absolute = file.getAbsoluteFile();
        if (!absolute.isFile()) {
            throw new IllegalArgumentException("Configuration file given via " + origin + " not found: " + absolute);
        }
        listener.onConfigFile(origin, absolute);
        return loadFromFile(absolute);
    }

    static Config loadFromFile(final File configFile) {
        return layered(ConfigFactory.parseFile(configFile));
    }

    static Config loadDefaults() {
        return layered(ConfigFactory.empty());
    }

    private static Config layered(final Config userConfig) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userConfig)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
