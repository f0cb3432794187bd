package fr.lapetina.rpcpool.infrastructure.config;

import fr.lapetina.rpcpool.domain.strategy.StrategyType;
import fr.lapetina.rpcpool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Validation before a configuration becomes current
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<RpcPoolConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RpcPoolConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public RpcPoolConfig load() {
        return apply(loadFromPath());
    }

    /**
     * Loads configuration from an input stream.
     *
     * @throws ConfigurationException if parsing or validation fails
     */
    public RpcPoolConfig loadFromStream(InputStream inputStream) {
        return apply(parse(inputStream, "stream"));
    }

    private RpcPoolConfig apply(RpcPoolConfig config) {
        validate(config);
        RpcPoolConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private RpcPoolConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
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

    private RpcPoolConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private RpcPoolConfig parse(InputStream inputStream, String source) {
        try {
            RpcPoolConfig config = yaml.load(inputStream);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validates a configuration.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public static void validate(RpcPoolConfig config) {
        if (config.getRpcUrls() == null || config.getRpcUrls().isEmpty()) {
            throw new ConfigurationException("At least one RPC URL must be provided");
        }
        for (String url : config.getRpcUrls()) {
            if (url == null || url.isBlank()) {
                throw new ConfigurationException("RPC URL must not be blank");
            }
        }
        StrategyType.fromName(config.getStrategy());

        RpcPoolConfig.TimeoutsConfig timeouts = config.getTimeouts();
        if (timeouts == null) {
            throw new ConfigurationException("Timeouts section must not be null");
        }
        if (timeouts.getConnectTimeoutMs() <= 0) {
            throw new ConfigurationException("connectTimeoutMs must be positive: " + timeouts.getConnectTimeoutMs());
        }
        if (timeouts.getRequestTimeoutMs() < 0) {
            throw new ConfigurationException("requestTimeoutMs must not be negative: " + timeouts.getRequestTimeoutMs());
        }
        if (config.getMetrics() == null) {
            throw new ConfigurationException("Metrics section must not be null");
        }
    }

    /**
     * Returns the current configuration.
     */
    public RpcPoolConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "rpc-pool-config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. An invalid file leaves the current configuration in place.
     */
    public RpcPoolConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: error={}", e.getMessage());
            return currentConfig.get();
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RpcPoolConfig oldConfig, RpcPoolConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }
}
