package cz.vut.fit.urlradar.engine.risk;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * The probability thresholds separating the six risk bands of a reachability branch. A probability
 * below {@code safe} maps to A, below {@code low} to B, below {@code medium} to C, below {@code high}
 * to D, below {@code critical} to E and anything else to F.
 *
 * @param safe     The upper bound of band A.
 * @param low      The upper bound of band B.
 * @param medium   The upper bound of band C.
 * @param high     The upper bound of band D.
 * @param critical The upper bound of band E.
 */
public record BranchThresholds(double safe, double low, double medium, double high, double critical) {

    public BranchThresholds {
        if (!(safe > 0.0 && safe < low && low < medium && medium < high && high < critical && critical <= 1.0))
            throw new IllegalArgumentException("Thresholds must be strictly ascending within (0, 1]: "
                    + List.of(safe, low, medium, high, critical));
    }

    /**
     * The built-in thresholds of a branch. OFFLINE and PARKED use wider safe bands, SINKHOLE a narrower one.
     */
    public static BranchThresholds defaults(@NotNull ReachabilityStatus branch) {
        return switch (branch) {
            case ONLINE -> new BranchThresholds(0.15, 0.30, 0.50, 0.75, 0.90);
            case OFFLINE, WAF -> new BranchThresholds(0.15, 0.30, 0.50, 0.70, 0.85);
            case PARKED -> new BranchThresholds(0.30, 0.50, 0.70, 0.85, 0.95);
            case SINKHOLE -> new BranchThresholds(0.05, 0.15, 0.30, 0.50, 0.70);
        };
    }

    /**
     * Parses five comma-separated thresholds.
     *
     * @throws IllegalArgumentException if the value is malformed or the thresholds are not ascending
     */
    public static BranchThresholds parse(@NotNull String value) {
        final var parts = Common.splitList(value);
        if (parts.size() != 5)
            throw new IllegalArgumentException("Expected 5 thresholds, got " + parts.size() + ": " + value);

        final double[] t = new double[5];
        for (int i = 0; i < 5; i++) {
            t[i] = Double.parseDouble(parts.get(i));
        }
        return new BranchThresholds(t[0], t[1], t[2], t[3], t[4]);
    }

    /**
     * Maps a probability to its band.
     */
    public @NotNull RiskLevel map(double probability) {
        if (probability < safe) return RiskLevel.A;
        if (probability < low) return RiskLevel.B;
        if (probability < medium) return RiskLevel.C;
        if (probability < high) return RiskLevel.D;
        if (probability < critical) return RiskLevel.E;
        return RiskLevel.F;
    }
}
