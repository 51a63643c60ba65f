package cz.vut.fit.urlradar.models.intel;

import java.util.Locale;

/**
 * The severity reported with a threat-intelligence finding.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parses a severity name case-insensitively. Unknown values map to {@link #MEDIUM}.
     */
    public static Severity parse(String value) {
        if (value == null)
            return MEDIUM;
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
