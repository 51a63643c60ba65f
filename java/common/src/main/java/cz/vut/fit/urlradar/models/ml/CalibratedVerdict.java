package cz.vut.fit.urlradar.models.ml;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * The fused and calibrated ML verdict.
 *
 * @param probability       The final probability (0-1).
 * @param lower             The lower bound of the conformal interval.
 * @param upper             The upper bound of the conformal interval.
 * @param confidence        The confidence derived from the interval width and the evidence coverage.
 * @param alpha             The miscoverage rate of the interval.
 * @param calibrationMethod The identifier of the calibration strategy.
 * @param decisionGraph     The ordered contributions that produced the probability.
 */
public record CalibratedVerdict(double probability,
                                double lower,
                                double upper,
                                double confidence,
                                double alpha,
                                @NotNull String calibrationMethod,
                                @NotNull List<DecisionGraphEntry> decisionGraph) {

    public CalibratedVerdict {
        decisionGraph = List.copyOf(decisionGraph);
    }

    public double width() {
        return upper - lower;
    }
}
