package cz.vut.fit.urlradar.models.checks;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of a single check. Points are safety points: a passing check earns its maximum, a failing
 * one earns nothing. Skipped checks score 0 of 0.
 *
 * @param checkId     The check identifier.
 * @param name        The human-readable check name.
 * @param category    The identifier of the category the check belongs to.
 * @param status      The status.
 * @param points      The points earned.
 * @param maxPoints   The points possible.
 * @param description A human-readable description of the outcome.
 * @param skipped     True if the check did not run because its evidence is absent.
 * @param skipReason  The reason for skipping.
 * @param evidence    A snapshot of the evidence the check looked at.
 */
public record CheckResult(@NotNull String checkId,
                          @NotNull String name,
                          @NotNull String category,
                          @NotNull CheckStatus status,
                          int points,
                          int maxPoints,
                          @NotNull String description,
                          boolean skipped,
                          @Nullable String skipReason,
                          @NotNull Map<String, Object> evidence) {

    public CheckResult {
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    /**
     * The points lost by this check.
     */
    public int penalty() {
        return maxPoints - points;
    }
}
