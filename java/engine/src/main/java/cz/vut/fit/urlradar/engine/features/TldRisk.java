package cz.vut.fit.urlradar.engine.features;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Set;

/**
 * Risk scores (0-100) of top-level domains.
 *
 * @author URLRadar developers
 */
public final class TldRisk {
    public static final double HIGH = 100.0;
    public static final double MEDIUM = 60.0;
    public static final double ESTABLISHED = 10.0;
    public static final double UNKNOWN = 30.0;

    private static final Set<String> HIGH_RISK = Set.of(
            "tk", "ml", "ga", "cf", "gq", "xyz", "top", "work", "date", "download",
            "bid", "win", "review", "trade", "racing", "click", "link", "stream", "loan");

    private static final Set<String> MEDIUM_RISK = Set.of(
            "info", "biz", "club", "online", "site", "website", "space", "live", "tech");

    private static final Set<String> ESTABLISHED_TLDS = Set.of("com", "org", "net", "edu", "gov");

    private TldRisk() {
    }

    public static double score(@NotNull String tld) {
        final var normalized = tld.toLowerCase(Locale.ROOT);
        if (HIGH_RISK.contains(normalized)) return HIGH;
        if (MEDIUM_RISK.contains(normalized)) return MEDIUM;
        if (ESTABLISHED_TLDS.contains(normalized)) return ESTABLISHED;
        return UNKNOWN;
    }
}
