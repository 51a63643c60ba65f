package cz.vut.fit.urlradar.models.checks;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The aggregated outcome of a category.
 *
 * @param categoryId     The category identifier.
 * @param name           The human-readable category name.
 * @param weight         The configured category weight.
 * @param earnedPoints   The sum of earned points of the category's checks.
 * @param possiblePoints The sum of possible points of the category's checks.
 * @param checks         The check results.
 * @param skipped        True if the category declined to run for the current reachability branch.
 * @param skipReason     The reason for skipping.
 */
public record CategoryResult(@NotNull String categoryId,
                             @NotNull String name,
                             double weight,
                             int earnedPoints,
                             int possiblePoints,
                             @NotNull List<CheckResult> checks,
                             boolean skipped,
                             @Nullable String skipReason) {

    public CategoryResult {
        checks = List.copyOf(checks);
    }

    /**
     * Creates a skipped category contributing nothing to the totals.
     */
    public static CategoryResult skipped(@NotNull String categoryId, @NotNull String name, double weight,
                                         @NotNull String reason) {
        return new CategoryResult(categoryId, name, weight, 0, 0, List.of(), true, reason);
    }

    /**
     * Aggregates the check results into a category result.
     */
    public static CategoryResult of(@NotNull String categoryId, @NotNull String name, double weight,
                                    @NotNull List<CheckResult> checks) {
        int earned = 0;
        int possible = 0;
        for (var check : checks) {
            earned += check.points();
            possible += check.maxPoints();
        }
        return new CategoryResult(categoryId, name, weight, earned, possible, checks, false, null);
    }

    /**
     * The points lost in this category.
     */
    public int penaltyPoints() {
        return possiblePoints - earnedPoints;
    }
}
