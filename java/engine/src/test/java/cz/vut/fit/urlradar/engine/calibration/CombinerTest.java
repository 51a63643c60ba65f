package cz.vut.fit.urlradar.engine.calibration;

import cz.vut.fit.urlradar.engine.Fixtures;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.ml.DecisionGraphEntry;
import cz.vut.fit.urlradar.models.ml.StageResult;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CombinerTest {
    private static final double EPSILON = 1e-9;

    private final ConfigSnapshot config = ConfigSnapshot.defaults();

    private static StageResult stage(String name, double probability) {
        return new StageResult(name, List.of(), probability, 0.5, false, false, 1);
    }

    private static CalibrationStore store(ReachabilityStatus branch, List<Double> scores) {
        return b -> b == branch ? new CalibrationSet(branch, scores) : null;
    }

    private static FeatureVector established(ReachabilityStatus branch, int ageDays) {
        var evidence = Fixtures.bundle(branch, Fixtures.whois(ageDays), Fixtures.healthyDns(), Fixtures.validTls(),
                null, null, Fixtures.network());
        return Fixtures.features("https://example.com/", branch, evidence, TISummary.empty());
    }

    private static List<String> components(List<DecisionGraphEntry> graph) {
        return graph.stream().map(DecisionGraphEntry::component).toList();
    }

    @Test
    void fusesStage1AndCausalWithoutStage2() {
        var combiner = new Combiner(store(ReachabilityStatus.ONLINE, List.of()), Fixtures.CLOCK);
        var features = established(ReachabilityStatus.ONLINE, 365);

        var verdict = combiner.combine(stage("stage1", 0.5), null, features, config);

        assertEquals(0.80 * 0.5, verdict.probability(), EPSILON);
        assertEquals(List.of(Combiner.STAGE1, Combiner.CAUSAL, Combiner.BRANCH_CORRECTION),
                components(verdict.decisionGraph()));
        assertEquals(BinomialMarginCalibrator.METHOD, verdict.calibrationMethod());
    }

    @Test
    void fusesBothStagesAndCausalSignals() {
        var combiner = new Combiner(store(ReachabilityStatus.ONLINE, List.of()), Fixtures.CLOCK);
        var dom = Fixtures.dom("Sign in", "", List.of(Fixtures.passwordForm("evil.example.net", true)));
        var evidence = Fixtures.bundle(ReachabilityStatus.ONLINE, Fixtures.whois(365), Fixtures.healthyDns(),
                Fixtures.validTls(), dom, null, Fixtures.network());
        var features = Fixtures.features("https://example.org/", ReachabilityStatus.ONLINE, evidence,
                TISummary.empty());

        var verdict = combiner.combine(stage("stage1", 0.4), stage("stage2", 0.6), features, config);

        // form-origin-mismatch contributes its weight 0.35
        assertEquals(0.30 * 0.4 + 0.50 * 0.6 + 0.20 * 0.35, verdict.probability(), EPSILON);
        assertEquals(List.of(Combiner.STAGE1, Combiner.STAGE2, Combiner.CAUSAL, Combiner.BRANCH_CORRECTION),
                components(verdict.decisionGraph()));
    }

    @Test
    void causalContributionIsCapped() {
        var combiner = new Combiner(store(ReachabilityStatus.SINKHOLE, List.of()), Fixtures.CLOCK);
        var intel = new TISummary(List.of(), List.of(), 2, 2, 0, true, false, false, true);
        var features = Fixtures.features("https://example.com/", ReachabilityStatus.SINKHOLE,
                EvidenceBundle.empty(ReachabilityStatus.SINKHOLE, Map.of()), intel);

        var verdict = combiner.combine(stage("stage1", 0.0), null, features, config);

        var causal = verdict.decisionGraph().get(1);
        assertEquals(Combiner.CAUSAL, causal.component());
        assertEquals(1.0, causal.value(), EPSILON);
        // 0.20 causal plus the sinkhole correction of 0.40
        assertEquals(0.60, verdict.probability(), EPSILON);
    }

    @Test
    void branchCorrectionIsClamped() {
        var combiner = new Combiner(store(ReachabilityStatus.PARKED, List.of()), Fixtures.CLOCK);
        var features = Fixtures.urlOnlyFeatures("https://example.com/", ReachabilityStatus.PARKED);

        var verdict = combiner.combine(stage("stage1", 0.1), null, features, config);

        assertEquals(0.0, verdict.probability(), EPSILON);
        assertEquals(0.0, verdict.lower(), EPSILON);
    }

    @Test
    void establishedDomainDiscount() {
        var combiner = new Combiner(store(ReachabilityStatus.ONLINE, List.of()), Fixtures.CLOCK);
        var features = established(ReachabilityStatus.ONLINE, 3650);

        var verdict = combiner.combine(stage("stage1", 0.5), null, features, config);

        var entry = verdict.decisionGraph().get(verdict.decisionGraph().size() - 1);
        assertEquals(Combiner.ESTABLISHED_DOMAIN, entry.component());
        // p = 0.4, factor = 1/10, discount = 0.4 * 0.1 * 0.3
        assertEquals(-0.012, entry.contribution(), EPSILON);
        assertEquals(0.388, verdict.probability(), EPSILON);
    }

    @Test
    void noDiscountWhenAgeIsUnknown() {
        var combiner = new Combiner(store(ReachabilityStatus.OFFLINE, List.of()), Fixtures.CLOCK);
        var features = Fixtures.urlOnlyFeatures("https://example.com/", ReachabilityStatus.OFFLINE);

        var verdict = combiner.combine(stage("stage1", 0.5), null, features, config);

        assertFalse(components(verdict.decisionGraph()).contains(Combiner.ESTABLISHED_DOMAIN));
    }

    @Test
    void intervalAlwaysContainsThePointEstimate() {
        var scores = List.of(0.02, 0.05, 0.08, 0.1, 0.12, 0.15, 0.2, 0.25, 0.3, 0.4, 0.5, 0.6, 0.05, 0.07, 0.09,
                0.11, 0.13, 0.03, 0.04, 0.06);
        var combiner = new Combiner(store(ReachabilityStatus.ONLINE, scores), Fixtures.CLOCK);
        var features = established(ReachabilityStatus.ONLINE, 365);

        for (int i = 0; i <= 20; i++) {
            var verdict = combiner.combine(stage("stage1", i / 20.0), null, features, config);
            assertTrue(verdict.lower() <= verdict.probability());
            assertTrue(verdict.probability() <= verdict.upper());
            assertTrue(verdict.lower() >= 0.0 && verdict.upper() <= 1.0);
            assertEquals(SplitConformalCalibrator.METHOD, verdict.calibrationMethod());
            assertEquals(1.0 - verdict.width(), verdict.confidence(), EPSILON);
        }
    }

    @Test
    void missingInputsWidenTheInterval() {
        var scores = Collections.nCopies(99, 0.1);
        var combiner = new Combiner(store(ReachabilityStatus.OFFLINE, scores), Fixtures.CLOCK);
        var complete = established(ReachabilityStatus.OFFLINE, 365);
        var bare = Fixtures.urlOnlyFeatures("https://example.com/", ReachabilityStatus.OFFLINE);

        var narrow = combiner.combine(stage("stage1", 0.6), null, complete, config);
        var wide = combiner.combine(stage("stage1", 0.6), null, bare, config);

        assertEquals(narrow.probability(), wide.probability(), EPSILON);
        assertTrue(wide.width() > narrow.width());
    }
}
