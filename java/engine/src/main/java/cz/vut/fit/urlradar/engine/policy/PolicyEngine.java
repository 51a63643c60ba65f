package cz.vut.fit.urlradar.engine.policy;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.policy.rules.BrandDivergenceRule;
import cz.vut.fit.urlradar.engine.policy.rules.CriticalTier1Rule;
import cz.vut.fit.urlradar.engine.policy.rules.DualTier1Rule;
import cz.vut.fit.urlradar.engine.policy.rules.FormMismatchYoungDomainRule;
import cz.vut.fit.urlradar.engine.policy.rules.RecentTiHitRule;
import cz.vut.fit.urlradar.engine.policy.rules.TombstoneRule;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Evaluates the ordered policy rules. The first enabled rule that matches determines the decision; the
 * evaluation is a pure function of its inputs.
 *
 * @author URLRadar developers
 */
public class PolicyEngine {
    public static final String COMPONENT_NAME = "policy";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(PolicyEngine.class);

    private final List<PolicyRule> _rules;

    public PolicyEngine() {
        this(defaultRules());
    }

    public PolicyEngine(@NotNull List<PolicyRule> rules) {
        _rules = List.copyOf(rules);
    }

    /**
     * The built-in rules in evaluation order.
     */
    public static List<PolicyRule> defaultRules() {
        return List.of(new TombstoneRule(), new DualTier1Rule(), new CriticalTier1Rule(),
                new FormMismatchYoungDomainRule(), new BrandDivergenceRule(), new RecentTiHitRule());
    }

    /**
     * The rules that only depend on the threat-intel summary and can be evaluated before any probing.
     */
    public static List<PolicyRule> intelOnlyRules() {
        return List.of(new TombstoneRule(), new DualTier1Rule(), new CriticalTier1Rule());
    }

    public List<PolicyRule> rules() {
        return _rules;
    }

    /**
     * Evaluates the rules.
     *
     * @param features     The feature vector; null when not computed.
     * @param intel        The threat-intel summary.
     * @param reachability The reachability result; null when not probed.
     * @param config       The configuration snapshot.
     * @return The decision of the first matching rule, or {@link PolicyDecision#none()}.
     */
    public @NotNull PolicyDecision evaluate(@Nullable FeatureVector features, @NotNull TISummary intel,
                                            @Nullable ReachabilityResult reachability,
                                            @NotNull ConfigSnapshot config) {
        final var context = new PolicyContext(features, intel, reachability, config);
        for (var rule : _rules) {
            if (!config.policyRuleEnabled(rule.id()))
                continue;

            final var reason = rule.evaluate(context);
            if (reason != null) {
                final var level = config.policyRuleLevel(rule.id(), rule.defaultLevel());
                Logger.debug("Rule {} matched: {} (level {})", rule.id(), reason, level);
                return PolicyDecision.override(rule.id(), level, reason);
            }
        }
        return PolicyDecision.none();
    }
}
