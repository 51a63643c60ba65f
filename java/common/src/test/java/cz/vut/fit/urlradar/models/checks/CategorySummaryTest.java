package cz.vut.fit.urlradar.models.checks;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CategorySummaryTest {

    private static CheckResult check(CheckStatus status, int points, int max) {
        return new CheckResult("c", "Check", "cat", status, points, max, "", false, null, Map.of());
    }

    @Test
    void skippedCategoriesContributeNothing() {
        var run = CategoryResult.of("a", "A", 1.0,
                List.of(check(CheckStatus.PASS, 10, 10), check(CheckStatus.FAIL, 0, 10)));
        var skipped = CategoryResult.skipped("b", "B", 1.0, "Site not reachable");

        var summary = CategorySummary.of(List.of(run, skipped));

        assertEquals(10, summary.earnedPoints());
        assertEquals(20, summary.possiblePoints());
        assertEquals(10, summary.penaltyPoints());
        assertEquals(0.5, summary.riskFactor(), 1e-9);
        assertEquals(1, summary.categoriesRun());
        assertEquals(1, summary.categoriesSkipped());
    }

    @Test
    void weightsScaleRiskFactor() {
        var heavy = CategoryResult.of("a", "A", 3.0, List.of(check(CheckStatus.FAIL, 0, 10)));
        var light = CategoryResult.of("b", "B", 1.0, List.of(check(CheckStatus.PASS, 10, 10)));

        var summary = CategorySummary.of(List.of(heavy, light));

        assertEquals(0.75, summary.riskFactor(), 1e-9);
    }

    @Test
    void emptyIsNeutral() {
        var summary = CategorySummary.of(List.of());
        assertEquals(0.0, summary.riskFactor());
        assertEquals(0, summary.possiblePoints());
    }
}
