package cz.vut.fit.urlradar.engine.calibration;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.features.CausalSignal;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.ml.DecisionGraphEntry;
import cz.vut.fit.urlradar.models.ml.StageResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * Fuses the stage results with the causal signals into a single probability and wraps it in a conformal
 * interval. Every contribution is recorded, in order, in the decision graph of the verdict.
 *
 * @author URLRadar developers
 */
public class Combiner {
    public static final String COMPONENT_NAME = "combiner";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(Combiner.class);

    public static final String STAGE1 = "stage1";
    public static final String STAGE2 = "stage2";
    public static final String CAUSAL = "causal";
    public static final String BRANCH_CORRECTION = "branch-correction";
    public static final String ESTABLISHED_DOMAIN = "established-domain";

    private static final double MAX_AGE_DISCOUNT = 0.25;
    private static final double AGE_DISCOUNT_RATE = 0.30;
    private static final double TEN_YEARS_DAYS = 3650.0;
    // Evidence kinds plus the intel summary
    private static final int INPUT_COUNT = EvidenceKind.values().length + 1;

    private final CalibrationStore _store;
    private final ConformalCalibrator _fallback = new BinomialMarginCalibrator();
    private final Clock _clock;

    public Combiner(@NotNull CalibrationStore store) {
        this(store, Clock.systemUTC());
    }

    public Combiner(@NotNull CalibrationStore store, @NotNull Clock clock) {
        _store = store;
        _clock = clock;
    }

    /**
     * Combines and calibrates.
     *
     * @param stage1   The Stage-1 result.
     * @param stage2   The Stage-2 result, or null when Stage-2 did not run.
     * @param features The feature vector.
     * @param config   The configuration snapshot of the scan.
     * @return The verdict; the point estimate always lies within its interval.
     */
    public @NotNull CalibratedVerdict combine(@NotNull StageResult stage1, @Nullable StageResult stage2,
                                              @NotNull FeatureVector features, @NotNull ConfigSnapshot config) {
        final var graph = new ArrayList<DecisionGraphEntry>();
        final var weights = config.fusionWeights(stage2 != null);

        double p = weights.stage1() * stage1.probability();
        graph.add(entry(STAGE1, weights.stage1(), stage1.probability(), weights.stage1() * stage1.probability(),
                "confidence %.3f".formatted(stage1.confidence())));

        if (stage2 != null) {
            p += weights.stage2() * stage2.probability();
            graph.add(entry(STAGE2, weights.stage2(), stage2.probability(),
                    weights.stage2() * stage2.probability(), "confidence %.3f".formatted(stage2.confidence())));
        }

        final var active = features.causal().active();
        double causal = 0.0;
        for (var signal : active) {
            causal += config.causalWeight(signal);
        }
        causal = Math.min(1.0, causal);
        p += weights.causal() * causal;
        graph.add(entry(CAUSAL, weights.causal(), causal, weights.causal() * causal,
                active.isEmpty() ? null : active.stream().map(CausalSignal::key).collect(Collectors.joining(","))));
        p = Common.clamp01(p);

        final double correction = config.branchCorrection(features.branch());
        final double corrected = Common.clamp01(p + correction);
        graph.add(entry(BRANCH_CORRECTION, 1.0, correction, corrected - p, features.branch().name()));
        p = corrected;

        final int establishedDays = config.establishedDomainDays();
        final int age = features.tabular().domainAgeDays();
        if (establishedDays > 0 && !features.unavailable("whois") && age > establishedDays) {
            final double yearsFactor = Math.min(age / TEN_YEARS_DAYS, 10.0) / 10.0;
            final double discount = -Math.min(MAX_AGE_DISCOUNT, p * yearsFactor * AGE_DISCOUNT_RATE);
            graph.add(entry(ESTABLISHED_DOMAIN, 1.0, age, discount, age + " days"));
            p = Common.clamp01(p + discount);
        }

        final var set = _store.forBranch(features.branch());
        final ConformalCalibrator calibrator = set == null || set.isEmpty()
                ? _fallback
                : new SplitConformalCalibrator(set.scores());

        final double alpha = config.calibrationAlpha();
        final double missingShare = Math.min(1.0, features.unavailableInputs().size() / (double) INPUT_COUNT);
        final double halfWidth = calibrator.halfWidth(p, alpha) * (1.0 + missingShare);
        final double lower = Math.max(0.0, p - halfWidth);
        final double upper = Math.min(1.0, p + halfWidth);
        final double confidence = Common.clamp01(1.0 - (upper - lower));

        Logger.debug("{}: p={} interval=[{}, {}] method={}", features.url(), p, lower, upper, calibrator.method());
        return new CalibratedVerdict(p, lower, upper, confidence, alpha, calibrator.method(), graph);
    }

    private DecisionGraphEntry entry(String component, double weight, double value, double contribution,
                                     @Nullable String note) {
        return new DecisionGraphEntry(component, weight, value, contribution, _clock.instant(), note);
    }
}
