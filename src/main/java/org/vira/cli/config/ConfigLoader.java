package org.vira.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.function.Consumer;

/**
 * Loads the HOCON configuration of the command line.
 * <p>
 * The user file is taken from {@code --config}, else from {@code -Dconfig.file}, else from
 * {@code config/vira.conf} if it exists. System properties and environment variables override the
 * file, which overrides {@code reference.conf}.
 */
public final class ConfigLoader {

    static final File DEFAULT_CONFIG_FILE = new File("config", "vira.conf");

    private ConfigLoader() {
    }

    /**
     * @param explicitConfigFile The file given with {@code --config}, or null.
     * @param messages Receives a line naming the file that was chosen.
     * @return The resolved configuration.
     * @throws IllegalArgumentException If an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException If the configuration cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, Consumer<String> messages) {
        File file = explicitConfigFile;
        String source = "--config";
        if (file == null) {
            String property = System.getProperty("config.file");
            if (property != null && !property.isBlank()) {
                file = new File(property).getAbsoluteFile();
                source = "-Dconfig.file";
            }
        }
        if (file != null && !file.exists()) {
            throw new IllegalArgumentException("Configuration file not found (" + source + "): "
                    + file.getAbsolutePath());
        }
        if (file == null && DEFAULT_CONFIG_FILE.exists()) {
            file = DEFAULT_CONFIG_FILE;
            source = "working directory";
        }

        if (file == null) {
            messages.accept("No " + DEFAULT_CONFIG_FILE.getPath() + ", using built-in defaults");
            return loadDefaults();
        }
        messages.accept("Using configuration file " + file.getAbsolutePath() + " (" + source + ")");
        return loadFromFile(file);
    }

    static Config loadFromFile(File configFile) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }
}
