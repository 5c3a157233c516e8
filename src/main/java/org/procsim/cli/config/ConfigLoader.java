package org.procsim.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Central configuration loader for the CLI.
 * <p>
 * Composes HOCON configuration from several sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code config/procsim.conf} or the file given with {@code --config})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so {@code ${?PROCSIM_STORE_DIR}}
 * in {@code reference.conf} sees the environment.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "procsim.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Callback for progress messages during configuration file resolution.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration with this file discovery order:
     * <ol>
     *   <li>the file passed with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/procsim.conf} relative to the working directory</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null}.
     * @param handler            receives resolution progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found in current directory. "
                        + "Using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
