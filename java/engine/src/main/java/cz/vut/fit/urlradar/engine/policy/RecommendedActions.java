package cz.vut.fit.urlradar.engine.policy;

import cz.vut.fit.urlradar.engine.policy.rules.DualTier1Rule;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the user-facing action list of a scan result.
 *
 * @author URLRadar developers
 */
public final class RecommendedActions {
    static final double WIDE_INTERVAL = 0.3;

    private RecommendedActions() {
    }

    /**
     * Builds the recommended actions.
     *
     * @param decision The policy decision.
     * @param verdict  The calibrated verdict, null when the scan ended before the combiner.
     * @param level    The final risk level.
     * @return The actions, most important first.
     */
    public static @NotNull List<String> of(@NotNull PolicyDecision decision, @Nullable CalibratedVerdict verdict,
                                           @NotNull RiskLevel level) {
        final var actions = new ArrayList<String>();

        if (decision.overridden() && decision.riskLevel() == RiskLevel.F) {
            actions.add("Block access to this URL immediately");
            actions.add("Report to threat intelligence feeds");
            if (DualTier1Rule.ID.equals(decision.rule()))
                actions.add("Investigate related domains and IPs");
            return actions;
        }

        final double p = verdict != null ? verdict.probability() : probabilityOf(level);
        if (p > 0.9) {
            actions.add("Block access to this URL");
            actions.add("Report to threat intelligence feeds");
            actions.add("Alert users who may have visited this URL");
        } else if (p > 0.75) {
            actions.add("Block and investigate");
            actions.add("Review scan evidence");
            actions.add("Check for similar domains");
        } else if (p > 0.5) {
            actions.add("Proceed with extreme caution");
            actions.add("Do not enter credentials or payment info");
            actions.add("Verify sender if URL came from email");
        } else if (p > 0.3) {
            actions.add("Low risk detected");
            actions.add("Verify URL authenticity before entering sensitive data");
        } else {
            actions.add("Low risk - likely safe");
            actions.add("Still use HTTPS and verify domain legitimacy");
        }

        if (verdict != null && verdict.width() > WIDE_INTERVAL)
            actions.add("High uncertainty - consider additional checks");
        return actions;
    }

    // Representative probabilities for overridden levels below F
    private static double probabilityOf(RiskLevel level) {
        return switch (level) {
            case A -> 0.05;
            case B -> 0.2;
            case C -> 0.4;
            case D -> 0.6;
            case E -> 0.8;
            case F -> 0.95;
        };
    }
}
