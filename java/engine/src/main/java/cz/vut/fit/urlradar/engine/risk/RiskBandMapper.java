package cz.vut.fit.urlradar.engine.risk;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import cz.vut.fit.urlradar.models.results.RiskSource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Determines the final risk level of a scan. An overriding policy decision is used verbatim; otherwise the
 * calibrated probability is mapped through the thresholds of the reachability branch.
 *
 * @author URLRadar developers
 */
public class RiskBandMapper {

    /**
     * The final risk level and what determined it.
     */
    public record Outcome(@NotNull RiskLevel level, @NotNull RiskSource source) {
    }

    public @NotNull RiskLevel map(double probability, @NotNull ReachabilityStatus branch,
                                  @NotNull ConfigSnapshot config) {
        return config.thresholds(branch).map(probability);
    }

    /**
     * Resolves the final risk level.
     *
     * @throws IllegalArgumentException if the policy did not override and no verdict exists
     */
    public @NotNull Outcome resolve(@NotNull PolicyDecision decision, @Nullable CalibratedVerdict verdict,
                                    @NotNull ReachabilityStatus branch, @NotNull ConfigSnapshot config) {
        if (decision.overridden())
            return new Outcome(decision.riskLevel(), RiskSource.POLICY);
        if (verdict == null)
            throw new IllegalArgumentException("A calibrated verdict is required when the policy did not override");

        return new Outcome(map(verdict.probability(), branch, config), RiskSource.CALIBRATED);
    }
}
