package cz.vut.fit.urlradar.engine.calibration;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;

/**
 * Split (inductive) conformal calibration. The half-width is the {@code ceil((n + 1)(1 - alpha)) / n}
 * empirical quantile of the non-conformity scores; when fewer scores exist than the quantile requires,
 * the interval covers the whole [0, 1] range.
 *
 * @author URLRadar developers
 */
public class SplitConformalCalibrator implements ConformalCalibrator {
    public static final String METHOD = "split-conformal";

    private final double[] _sortedScores;

    public SplitConformalCalibrator(@NotNull List<Double> scores) {
        if (scores.isEmpty())
            throw new IllegalArgumentException("Split conformal calibration requires at least one score");

        _sortedScores = new double[scores.size()];
        for (int i = 0; i < scores.size(); i++) {
            _sortedScores[i] = Math.abs(scores.get(i));
        }
        Arrays.sort(_sortedScores);
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public double halfWidth(double probability, double alpha) {
        final int n = _sortedScores.length;
        final int rank = (int) Math.ceil((n + 1) * (1.0 - alpha));
        if (rank > n)
            return 1.0;
        return _sortedScores[Math.max(rank, 1) - 1];
    }
}
