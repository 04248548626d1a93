package fr.lapetina.resilienthttp.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link ResilientHttpConfig} from YAML and tells listeners about reloads.
 *
 * The file system is tried first, then the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<ResilientHttpConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(ResilientHttpConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ResilientHttpConfig load() {
        return publish(loadFromPath());
    }

    private ResilientHttpConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public ResilientHttpConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private ResilientHttpConfig parse(InputStream is, String origin) {
        ResilientHttpConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Empty configuration in {}, using defaults", origin);
            config = createDefault();
        }
        validate(config, origin);
        return config;
    }

    private static void validate(ResilientHttpConfig config, String origin) {
        if (config.getRetry() == null || config.getBatch() == null
                || config.getTransport() == null || config.getMetrics() == null) {
            throw new ConfigurationException("Missing configuration section in " + origin);
        }
        int ringBufferSize = config.getBatch().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("batch.ringBufferSize must be a power of 2, got " + ringBufferSize);
        }
        if (config.getBatch().getPollIntervalMs() <= 0) {
            throw new ConfigurationException("batch.pollIntervalMs must be positive, got "
                    + config.getBatch().getPollIntervalMs());
        }
    }

    private ResilientHttpConfig publish(ResilientHttpConfig config) {
        ResilientHttpConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Returns the current configuration, or null before the first load.
     */
    public ResilientHttpConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Forces a configuration reload. On failure the current configuration is kept.
     */
    public ResilientHttpConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ResilientHttpConfig oldConfig, ResilientHttpConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ResilientHttpConfig createDefault() {
        return new ResilientHttpConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
