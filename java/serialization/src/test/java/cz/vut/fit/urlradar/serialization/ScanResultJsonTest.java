package cz.vut.fit.urlradar.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.checks.CategorySummary;
import cz.vut.fit.urlradar.models.checks.CheckResult;
import cz.vut.fit.urlradar.models.checks.CheckStatus;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.WhoisEvidence;
import cz.vut.fit.urlradar.models.intel.SourceStatus;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.ml.DecisionGraphEntry;
import cz.vut.fit.urlradar.models.ml.ModelPrediction;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import cz.vut.fit.urlradar.models.ml.StageResult;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import cz.vut.fit.urlradar.models.results.RiskSource;
import cz.vut.fit.urlradar.models.results.ScanResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScanResultJsonTest {
    private final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    private ScanResultJson json;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = Common.makeMapper().build();
        json = new ScanResultJson(mapper);
    }

    private ScanResult sampleResult() {
        var graph = List.of(
                new DecisionGraphEntry("stage1", 0.8, 0.10, 0.08, now, null),
                new DecisionGraphEntry("causal", 0.2, 0.0, 0.0, now, "no active signals"),
                new DecisionGraphEntry("branch-correction", 1.0, 0.0, 0.0, now, "ONLINE"),
                new DecisionGraphEntry("established-domain", 1.0, -0.02, -0.02, now, null)
        );
        var verdict = new CalibratedVerdict(0.06, 0.0, 0.21, 0.79, 0.1, "split-conformal", graph);
        var stage1 = new StageResult("stage1", List.of(
                new ModelPrediction("lexical-a", PredictorKind.HEURISTIC_FALLBACK, 0.05, 0.9, null, 3, null)),
                0.05, 0.9, true, false, 5);

        var check = new CheckResult("tls_valid", "SSL Certificate Validity", "tls", CheckStatus.PASS,
                15, 15, "Certificate is valid", false, null, Map.of("valid", true));
        var categories = List.of(CategoryResult.of("tls", "SSL/TLS Security", 1.0, List.of(check)),
                CategoryResult.skipped("content", "Content Analysis", 1.0, "No HTML content available"));

        var reasons = new LinkedHashMap<EvidenceKind, String>();
        reasons.put(EvidenceKind.SCREENSHOT, "skipped by scan options");
        var evidence = new EvidenceBundle(ReachabilityStatus.ONLINE,
                new WhoisEvidence(3650, "Example Registrar", false, now, null, List.of("ns1.example.com")),
                null, null, null, null, null, null, reasons);

        var latencies = new LinkedHashMap<String, Long>();
        latencies.put("intel", 120L);
        latencies.put("reachability", 300L);
        latencies.put("evidence", 900L);

        return new ScanResult("scan-1", "https://example.com/", "example.com", now, now.plusMillis(1500),
                ReachabilityResult.of(ReachabilityStatus.ONLINE),
                TISummary.of(List.of(), List.of(new SourceStatus("gsb", 0, null, 0, 100)), false, now, 90),
                evidence, null, stage1, null, "Stage-1 early exit", verdict, PolicyDecision.none(),
                categories, CategorySummary.of(categories), RiskLevel.A, RiskSource.CALIBRATED,
                false, false, null, List.of("Low risk - likely safe"), latencies);
    }

    @Test
    void roundTripKeepsRiskLevelAndDecisionGraphOrder() {
        var original = sampleResult();

        var decoded = json.deserialize(json.serialize(original));

        assertEquals(original.riskLevel(), decoded.riskLevel());
        assertEquals(original.riskSource(), decoded.riskSource());
        assertNotNull(decoded.verdict());
        assertEquals(
                original.verdict().decisionGraph().stream().map(DecisionGraphEntry::component).toList(),
                decoded.verdict().decisionGraph().stream().map(DecisionGraphEntry::component).toList());
        assertEquals(original.verdict(), decoded.verdict());
    }

    @Test
    void roundTripKeepsEvidenceAbsence() {
        var decoded = json.deserialize(json.serialize(sampleResult()));

        assertNotNull(decoded.evidence());
        assertNotNull(decoded.evidence().whois());
        assertNull(decoded.evidence().tls(), "Absent evidence must stay absent");
        assertEquals("skipped by scan options", decoded.evidence().unavailableReason(EvidenceKind.SCREENSHOT));
        assertEquals(List.of("intel", "reachability", "evidence"),
                List.copyOf(decoded.stageLatenciesMs().keySet()));
    }

    @Test
    void roundTripKeepsCategories() {
        var original = sampleResult();
        var decoded = json.deserialize(json.serialize(original));

        assertEquals(2, decoded.categories().size());
        assertTrue(decoded.categories().get(1).skipped());
        assertEquals(original.categorySummary(), decoded.categorySummary());
        assertEquals(CheckStatus.PASS, decoded.categories().get(0).checks().get(0).status());
    }

    @Test
    void nullAndEmptyInput() {
        assertNull(json.serialize(null));
        assertNull(json.deserialize((byte[]) null));
        assertNull(json.deserialize(new byte[0]));
    }

    @Test
    void prettyOutputIsIndentedAndEquivalent() {
        var original = sampleResult();

        var compact = json.toJson(original, false);
        var pretty = json.toJson(original, true);

        assertFalse(compact.contains("\n"));
        assertTrue(pretty.contains("\"scanId\" : \"scan-1\""));
        assertEquals(json.deserialize(compact).riskLevel(), json.deserialize(pretty).riskLevel());
    }

    @Test
    void malformedInputThrows() {
        assertThrows(SerializationException.class,
                () -> json.deserialize("{\"scanId\":"));
    }
}
