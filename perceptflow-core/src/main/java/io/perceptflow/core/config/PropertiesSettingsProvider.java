package io.perceptflow.core.config;

import io.perceptflow.core.graph.FatalConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/// Reads {@link EngineConfig} from `perceptflow.*` properties.
///
/// ### Recognized Keys
/// | Key | Meaning |
/// |---|---|
/// | `perceptflow.step-budget` | step budget |
/// | `perceptflow.max-retries` | default retry allowance |
/// | `perceptflow.node-timeout-ms` | default node timeout in milliseconds |
/// | `perceptflow.durable-checkpoints` | `true` to fail sessions on checkpoint write errors |
/// | `perceptflow.stream-buffer` | stream buffer capacity |
/// | `perceptflow.node.<name>.max-retries` | retry allowance of one node |
/// | `perceptflow.node.<name>.timeout-ms` | timeout of one node in milliseconds |
///
/// Unknown keys under the prefix are ignored. Missing keys keep their defaults.
///
/// @see EngineConfig for default values
public final class PropertiesSettingsProvider implements SettingsProvider {

    private static final Logger logger =
            Logger.getLogger(PropertiesSettingsProvider.class.getName());

    public static final String PREFIX = "perceptflow.";
    private static final String NODE_PREFIX = PREFIX + "node.";
    private static final String MAX_RETRIES_SUFFIX = ".max-retries";
    private static final String TIMEOUT_SUFFIX = ".timeout-ms";

    private final Properties properties;

    public PropertiesSettingsProvider(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /// Loads properties from a file.
    ///
    /// @param file properties file, not null
    /// @return provider backed by the file contents, never null
    /// @throws FatalConfigurationException if the file cannot be read
    public static PropertiesSettingsProvider fromFile(Path file) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new FatalConfigurationException("Cannot read settings file " + file, e);
        }
        return new PropertiesSettingsProvider(properties);
    }

    /// Loads properties from a classpath resource; a missing resource yields the defaults.
    ///
    /// @param resource resource name, e.g. `perceptflow.properties`, not null
    /// @return provider backed by the resource, never null
    /// @throws FatalConfigurationException if the resource exists but cannot be read
    public static PropertiesSettingsProvider fromClasspath(String resource) {
        Properties properties = new Properties();
        ClassLoader loader = PropertiesSettingsProvider.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.fine("Settings resource not found, using defaults: " + resource);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new FatalConfigurationException("Cannot read settings resource " + resource, e);
        }
        return new PropertiesSettingsProvider(properties);
    }

    @Override
    public EngineConfig load() {
        EngineConfig.Builder builder = EngineConfig.builder();
        try {
            String value = properties.getProperty(PREFIX + "step-budget");
            if (value != null) {
                builder.stepBudget(Integer.parseInt(value.trim()));
            }
            value = properties.getProperty(PREFIX + "max-retries");
            if (value != null) {
                builder.defaultMaxRetries(Integer.parseInt(value.trim()));
            }
            value = properties.getProperty(PREFIX + "node-timeout-ms");
            if (value != null) {
                builder.defaultNodeTimeout(Duration.ofMillis(Long.parseLong(value.trim())));
            }
            value = properties.getProperty(PREFIX + "durable-checkpoints");
            if (value != null) {
                builder.durableCheckpoints(Boolean.parseBoolean(value.trim()));
            }
            value = properties.getProperty(PREFIX + "stream-buffer");
            if (value != null) {
                builder.streamBufferCapacity(Integer.parseInt(value.trim()));
            }

            for (String key : properties.stringPropertyNames()) {
                if (!key.startsWith(NODE_PREFIX)) {
                    continue;
                }
                String nodeValue = properties.getProperty(key).trim();
                if (key.endsWith(MAX_RETRIES_SUFFIX)) {
                    builder.maxRetries(
                            nodeName(key, MAX_RETRIES_SUFFIX), Integer.parseInt(nodeValue));
                } else if (key.endsWith(TIMEOUT_SUFFIX)) {
                    builder.nodeTimeout(
                            nodeName(key, TIMEOUT_SUFFIX),
                            Duration.ofMillis(Long.parseLong(nodeValue)));
                } else {
                    logger.warning("Ignoring unrecognized node setting: " + key);
                }
            }
        } catch (IllegalArgumentException e) {
            throw new FatalConfigurationException("Invalid engine setting: " + e.getMessage(), e);
        }
        EngineConfig config = builder.build();
        logger.fine("Loaded engine configuration: " + config);
        return config;
    }

    private static String nodeName(String key, String suffix) {
        String name = key.substring(NODE_PREFIX.length(), key.length() - suffix.length());
        if (name.isBlank()) {
            throw new IllegalArgumentException("missing node name in key " + key);
        }
        return name;
    }
}
