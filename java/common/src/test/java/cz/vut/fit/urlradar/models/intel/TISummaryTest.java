package cz.vut.fit.urlradar.models.intel;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TISummaryTest {
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void countsDistinctSourcesPerTier() {
        var findings = List.of(
                new TIFinding("gsb", SourceTier.TIER_1, Severity.HIGH, NOW, "SOCIAL_ENGINEERING"),
                new TIFinding("gsb", SourceTier.TIER_1, Severity.HIGH, NOW, "MALWARE"),
                new TIFinding("community", SourceTier.TIER_2, Severity.MEDIUM, null, null)
        );

        var summary = TISummary.of(findings, List.of(), false, NOW, 90);

        assertEquals(2, summary.totalHits());
        assertEquals(1, summary.tier1Hits());
        assertEquals(1, summary.tier2Hits());
        assertFalse(summary.dualTier1(), "One source reporting twice is not a dual tier-1 hit");
        assertFalse(summary.criticalTier1());
        assertEquals(List.of("gsb"), summary.tier1Sources());
    }

    @Test
    void dualTier1AndCritical() {
        var findings = List.of(
                new TIFinding("gsb", SourceTier.TIER_1, Severity.HIGH, NOW, null),
                new TIFinding("virustotal", SourceTier.TIER_1, Severity.CRITICAL, NOW, null)
        );

        var summary = TISummary.of(findings, List.of(), false, NOW, 90);

        assertTrue(summary.dualTier1());
        assertTrue(summary.criticalTier1());
    }

    @Test
    void recencyWindow() {
        var old = new TIFinding("feed", SourceTier.TIER_3, Severity.LOW,
                NOW.minus(Duration.ofDays(120)), null);
        var recent = new TIFinding("feed", SourceTier.TIER_3, Severity.LOW,
                NOW.minus(Duration.ofDays(89)), null);

        assertFalse(TISummary.of(List.of(old), List.of(), false, NOW, 90).recentHit());
        assertTrue(TISummary.of(List.of(recent), List.of(), false, NOW, 90).recentHit());
    }

    @Test
    void unavailableSources() {
        var summary = TISummary.of(List.of(),
                List.of(new SourceStatus("a", 0, null, 0, 10), new SourceStatus("b", 52, "timeout", 0, 2000)),
                false, NOW, 90);

        assertEquals(List.of("b"), summary.unavailableSources());
        assertFalse(summary.hasHits());
    }
}
