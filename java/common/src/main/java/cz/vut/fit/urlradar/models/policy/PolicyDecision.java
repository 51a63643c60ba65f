package cz.vut.fit.urlradar.models.policy;

import cz.vut.fit.urlradar.models.RiskLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of the policy engine.
 *
 * @param overridden True if a rule superseded the calibrated verdict.
 * @param rule       The identifier of the matched rule.
 * @param riskLevel  The risk level imposed by the rule.
 * @param reason     A human-readable reason.
 */
public record PolicyDecision(boolean overridden,
                             @Nullable String rule,
                             @Nullable RiskLevel riskLevel,
                             @Nullable String reason) {

    public static PolicyDecision none() {
        return new PolicyDecision(false, null, null, null);
    }

    public static PolicyDecision override(@NotNull String rule, @NotNull RiskLevel level, @NotNull String reason) {
        return new PolicyDecision(true, rule, level, reason);
    }
}
