package cz.vut.fit.urlradar.engine.calibration;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Historical calibration data of a reachability branch.
 *
 * @param branch The branch the data was collected for.
 * @param scores The non-conformity scores {@code |y - p|} of the held-out calibration examples.
 */
public record CalibrationSet(@NotNull ReachabilityStatus branch,
                             @NotNull List<Double> scores) {
    public CalibrationSet {
        scores = List.copyOf(scores);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }
}
