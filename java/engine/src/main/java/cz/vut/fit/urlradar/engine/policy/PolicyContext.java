package cz.vut.fit.urlradar.engine.policy;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The inputs of policy rule evaluation.
 *
 * @param features     The feature vector; null at the intel gate, before any evidence exists.
 * @param intel        The threat-intel summary.
 * @param reachability The reachability result; null at the intel gate.
 * @param config       The configuration snapshot of the scan.
 */
public record PolicyContext(@Nullable FeatureVector features,
                            @NotNull TISummary intel,
                            @Nullable ReachabilityResult reachability,
                            @NotNull ConfigSnapshot config) {

    /**
     * Returns true if the domain age is known and below the young-domain threshold.
     */
    public boolean youngDomain() {
        return features != null
                && !features.unavailable("whois")
                && features.tabular().domainAgeDays() < config.youngDomainDays();
    }
}
