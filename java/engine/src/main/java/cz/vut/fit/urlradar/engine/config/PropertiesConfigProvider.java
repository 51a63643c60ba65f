package cz.vut.fit.urlradar.engine.config;

import cz.vut.fit.urlradar.Common;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link ConfigProvider} backed by {@link Properties}. Reloading builds a new snapshot; scans that
 * already obtained the previous snapshot keep using it.
 *
 * @author URLRadar developers
 */
public class PropertiesConfigProvider implements ConfigProvider {
    public static final String COMPONENT_NAME = "config";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(PropertiesConfigProvider.class);

    private final AtomicReference<ConfigSnapshot> _current;

    /**
     * Creates a provider from the given properties.
     *
     * @throws ConfigurationException if the properties are invalid
     */
    public PropertiesConfigProvider(@NotNull Properties properties) {
        _current = new AtomicReference<>(ConfigSnapshot.fromProperties(properties));
    }

    /**
     * Loads the properties file (if any) and applies the overrides on top of it.
     *
     * @param file      The properties file, or null to use only the defaults and the overrides.
     * @param overrides Values that take precedence over the file.
     * @return The provider.
     * @throws IOException            if the file cannot be read
     * @throws ConfigurationException if the resulting configuration is invalid
     */
    public static PropertiesConfigProvider load(@Nullable Path file, @NotNull Properties overrides) throws IOException {
        final var properties = new Properties();
        if (file != null) {
            properties.putAll(readProperties(file));
            Logger.info("Loaded configuration from {}", file);
        }
        properties.putAll(overrides);
        return new PropertiesConfigProvider(properties);
    }

    /**
     * Reads a properties file.
     */
    public static Properties readProperties(@NotNull Path file) throws IOException {
        final var properties = new Properties();
        try (InputStream stream = Files.newInputStream(file)) {
            properties.load(stream);
        }
        return properties;
    }

    @Override
    public @NotNull ConfigSnapshot snapshot() {
        return _current.get();
    }

    /**
     * Replaces the current snapshot. On invalid properties the current snapshot stays in place.
     *
     * @param properties The new properties.
     * @return The new snapshot.
     * @throws ConfigurationException if the properties are invalid
     */
    public ConfigSnapshot reload(@NotNull Properties properties) {
        final ConfigSnapshot snapshot;
        try {
            snapshot = ConfigSnapshot.fromProperties(properties);
        } catch (ConfigurationException e) {
            Logger.warn("Rejected configuration reload: {}", e.getMessage());
            throw e;
        }
        _current.set(snapshot);
        Logger.info("Configuration reloaded");
        return snapshot;
    }
}
