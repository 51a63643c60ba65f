package cz.vut.fit.urlradar.engine.calibration;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConformalCalibratorTest {

    @Test
    void quantileRank() {
        // n = 9, alpha = 0.1: rank = ceil(10 * 0.9) = 9
        var calibrator = new SplitConformalCalibrator(List.of(0.9, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8));
        assertEquals(0.9, calibrator.halfWidth(0.5, 0.1), 1e-9);
        // alpha = 0.5: rank = ceil(10 * 0.5) = 5
        assertEquals(0.5, calibrator.halfWidth(0.5, 0.5), 1e-9);
    }

    @Test
    void tooFewScoresCoverEverything() {
        var calibrator = new SplitConformalCalibrator(List.of(0.05, 0.1, 0.2));
        assertEquals(1.0, calibrator.halfWidth(0.3, 0.1));
    }

    @Test
    void negativeScoresAreTakenAbsolute() {
        var calibrator = new SplitConformalCalibrator(List.of(-0.4));
        assertEquals(0.4, calibrator.halfWidth(0.5, 0.6), 1e-9);
    }

    @Test
    void requiresScores() {
        assertThrows(IllegalArgumentException.class, () -> new SplitConformalCalibrator(List.of()));
    }

    @Test
    void binomialMarginIsZeroAtTheExtremes() {
        var calibrator = new BinomialMarginCalibrator();
        assertEquals(0.0, calibrator.halfWidth(0.0, 0.1), 1e-12);
        assertEquals(0.0, calibrator.halfWidth(1.0, 0.1), 1e-12);
        assertTrue(calibrator.halfWidth(0.5, 0.1) > calibrator.halfWidth(0.2, 0.1));
        assertTrue(calibrator.halfWidth(0.5, 0.05) > calibrator.halfWidth(0.5, 0.1));
    }

    @Test
    void bundledCalibrationSets() {
        var store = JsonCalibrationStore.fromClasspath();
        for (var branch : ReachabilityStatus.values()) {
            var set = store.forBranch(branch);
            assertNotNull(set, branch.name());
            assertEquals(branch, set.branch());
            assertFalse(set.isEmpty());
        }
    }
}
