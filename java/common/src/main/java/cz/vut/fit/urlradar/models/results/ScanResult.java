package cz.vut.fit.urlradar.models.results;

import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.checks.CategorySummary;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.ml.StageResult;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The complete, immutable outcome of a scan.
 * <p>
 * The risk level comes from the policy decision when {@link PolicyDecision#overridden()} is true
 * ({@link RiskSource#POLICY}), otherwise from the calibrated verdict mapped through the branch thresholds
 * ({@link RiskSource#CALIBRATED}).
 *
 * @param scanId             The scan identifier.
 * @param url                The canonical URL.
 * @param hostname           The host name.
 * @param startedAt          When the scan started.
 * @param completedAt        When the result was assembled.
 * @param reachability       The reachability result; null when the intel gate ended the scan.
 * @param intel              The threat-intelligence summary.
 * @param evidence           The collected evidence; null when not collected.
 * @param features           The feature vector; null when not computed.
 * @param stage1             The Stage-1 result; null when not computed.
 * @param stage2             The Stage-2 result; null when Stage-2 did not run.
 * @param stage2SkipReason   Why Stage-2 did not run.
 * @param verdict            The calibrated verdict; null when the scan ended before the combiner.
 * @param policy             The policy decision.
 * @param categories         The category results.
 * @param categorySummary    Totals over the category results.
 * @param riskLevel          The final risk level.
 * @param riskSource         What determined the final risk level.
 * @param terminal           True if the scan ended at the intel gate.
 * @param incomplete         True if the deadline expired before the pipeline finished.
 * @param incompleteReason   The stage running when the deadline expired.
 * @param recommendedActions Suggested actions for the final risk level.
 * @param stageLatenciesMs   The time spent in each pipeline stage, in execution order.
 *
 * @author URLRadar developers
 */
public record ScanResult(@NotNull String scanId,
                         @NotNull String url,
                         @NotNull String hostname,
                         @NotNull Instant startedAt,
                         @NotNull Instant completedAt,
                         @Nullable ReachabilityResult reachability,
                         @NotNull TISummary intel,
                         @Nullable EvidenceBundle evidence,
                         @Nullable FeatureVector features,
                         @Nullable StageResult stage1,
                         @Nullable StageResult stage2,
                         @Nullable String stage2SkipReason,
                         @Nullable CalibratedVerdict verdict,
                         @NotNull PolicyDecision policy,
                         @NotNull List<CategoryResult> categories,
                         @Nullable CategorySummary categorySummary,
                         @NotNull RiskLevel riskLevel,
                         @NotNull RiskSource riskSource,
                         boolean terminal,
                         boolean incomplete,
                         @Nullable String incompleteReason,
                         @NotNull List<String> recommendedActions,
                         @NotNull Map<String, Long> stageLatenciesMs) {

    public ScanResult {
        categories = List.copyOf(categories);
        recommendedActions = List.copyOf(recommendedActions);
        stageLatenciesMs = Collections.unmodifiableMap(new LinkedHashMap<>(stageLatenciesMs));
    }

    /**
     * The final probability, or null when the scan ended before the combiner.
     */
    public @Nullable Double probability() {
        return verdict == null ? null : verdict.probability();
    }
}
