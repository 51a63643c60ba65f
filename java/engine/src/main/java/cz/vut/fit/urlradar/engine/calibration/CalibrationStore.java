package cz.vut.fit.urlradar.engine.calibration;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Provides the calibration data of each reachability branch.
 */
public interface CalibrationStore {
    /**
     * Returns the calibration data of the branch, or null when the branch has none.
     */
    @Nullable CalibrationSet forBranch(@NotNull ReachabilityStatus branch);
}
