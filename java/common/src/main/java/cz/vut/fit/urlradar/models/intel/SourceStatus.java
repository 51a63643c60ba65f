package cz.vut.fit.urlradar.models.intel;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of querying a single threat-intelligence source.
 *
 * @param source     The name of the source.
 * @param statusCode A code from {@link cz.vut.fit.urlradar.ResultCodes}.
 * @param error      The error message, if the query failed.
 * @param hits       The number of findings returned.
 * @param latencyMs  The time spent on the query.
 */
public record SourceStatus(@NotNull String source,
                           int statusCode,
                           @Nullable String error,
                           int hits,
                           long latencyMs) {
}
