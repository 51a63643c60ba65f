package cz.vut.fit.urlradar.engine.config;

import org.jetbrains.annotations.NotNull;

/**
 * Supplies the configuration for scans. A scan obtains one snapshot when it starts and reads only that
 * snapshot until it finishes.
 */
public interface ConfigProvider {
    /**
     * Returns the current configuration snapshot.
     */
    @NotNull ConfigSnapshot snapshot();
}
