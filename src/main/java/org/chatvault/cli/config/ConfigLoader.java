package org.chatvault.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URL;
import java.security.CodeSource;

/**
 * Loads the HOCON configuration for the CLI.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code config/chatvault.conf} unless given explicitly)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved once all layers are composed, so a user override of a value
 * referenced from {@code reference.conf} reaches every reference.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "chatvault.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the configuration file and loads it. The first match wins:
     * <ol>
     *   <li>{@code explicitConfigFile}, from the {@code --config} option</li>
     *   <li>the {@code config.file} system property</li>
     *   <li>{@code config/chatvault.conf} in the working directory</li>
     *   <li>{@code config/chatvault.conf} next to the {@code lib} directory of the running jar</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the command line, or {@code null}
     * @param handler            receives progress messages
     * @return the resolved configuration
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
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
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
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

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: "
                            + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using defaults from classpath.");
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

    /**
     * Looks for {@code APP_HOME/config/chatvault.conf}, where the running jar sits in
     * {@code APP_HOME/lib}.
     *
     * @return the file, or {@code null} if it cannot be determined or does not exist
     */
    private static File detectInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final File jarOrClasses;
        try {
            final URL location = codeSource.getLocation();
            jarOrClasses = new File(location.toURI());
        } catch (java.net.URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jarOrClasses.isFile() || jarOrClasses.getParentFile() == null) {
            return null;
        }
        final File appHome = jarOrClasses.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
