package cz.vut.fit.urlradar.engine.intel;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.policy.PolicyEngine;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import org.jetbrains.annotations.NotNull;

/**
 * Decides whether the threat-intel summary alone is conclusive, so that the scan ends before any contact
 * with the target. Uses the intel-only policy rules with their configured enable flags. A conclusive gate
 * always ends the scan at {@link RiskLevel#F}, whatever level the matched rule is configured with.
 *
 * @author URLRadar developers
 */
public class IntelGate {
    public static final RiskLevel GATE_LEVEL = RiskLevel.F;

    private final PolicyEngine _engine;

    public IntelGate() {
        _engine = new PolicyEngine(PolicyEngine.intelOnlyRules());
    }

    /**
     * Evaluates the gate.
     *
     * @return An overriding decision when the scan must end, {@link PolicyDecision#none()} otherwise.
     */
    public @NotNull PolicyDecision evaluate(@NotNull TISummary intel, @NotNull ConfigSnapshot config) {
        final var decision = _engine.evaluate(null, intel, null, config);
        if (!decision.overridden() || decision.riskLevel() == GATE_LEVEL)
            return decision;
        return new PolicyDecision(true, decision.rule(), GATE_LEVEL, decision.reason());
    }
}
