package cz.vut.fit.urlradar.models.intel;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A single hit reported by a threat-intelligence source.
 *
 * @param source     The name of the source.
 * @param tier       The tier of the source.
 * @param severity   The severity of the hit.
 * @param lastSeen   When the source last observed the threat, if known.
 * @param threatType The source-specific threat type (e.g. SOCIAL_ENGINEERING), if known.
 */
public record TIFinding(@NotNull String source,
                        @NotNull SourceTier tier,
                        @NotNull Severity severity,
                        @Nullable Instant lastSeen,
                        @Nullable String threatType) {
}
