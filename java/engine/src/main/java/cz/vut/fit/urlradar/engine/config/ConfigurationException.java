package cz.vut.fit.urlradar.engine.config;

/**
 * Signals invalid configuration (weights not summing to 1, thresholds out of order, malformed values).
 * Raised when a {@link ConfigSnapshot} or the calibration data is loaded, never during a scan.
 *
 * @author URLRadar developers
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
