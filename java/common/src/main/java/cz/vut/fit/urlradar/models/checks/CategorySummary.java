package cz.vut.fit.urlradar.models.checks;

import java.util.List;

/**
 * Totals over all category results.
 *
 * @param earnedPoints      The sum of earned points.
 * @param possiblePoints    The sum of possible points.
 * @param penaltyPoints     The sum of lost points.
 * @param riskFactor        The weighted share of lost points (0-1).
 * @param categoriesRun     The number of categories that ran.
 * @param categoriesSkipped The number of skipped categories.
 */
public record CategorySummary(int earnedPoints,
                              int possiblePoints,
                              int penaltyPoints,
                              double riskFactor,
                              int categoriesRun,
                              int categoriesSkipped) {

    /**
     * Sums the category results. Skipped categories contribute zero points. The risk factor weighs each
     * category's penalty share by the category weight.
     */
    public static CategorySummary of(List<CategoryResult> categories) {
        int earned = 0;
        int possible = 0;
        int run = 0;
        int skipped = 0;
        double weightedPenalty = 0.0;
        double weightedPossible = 0.0;

        for (var category : categories) {
            if (category.skipped()) {
                skipped++;
                continue;
            }
            run++;
            earned += category.earnedPoints();
            possible += category.possiblePoints();
            weightedPenalty += category.weight() * category.penaltyPoints();
            weightedPossible += category.weight() * category.possiblePoints();
        }

        final double factor = weightedPossible > 0 ? weightedPenalty / weightedPossible : 0.0;
        return new CategorySummary(earned, possible, possible - earned, factor, run, skipped);
    }
}
