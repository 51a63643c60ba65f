package cz.vut.fit.urlradar.models.intel;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregated threat-intelligence findings for a scanned URL.
 * <p>
 * Hit counts count distinct sources, so a single source reporting several matches contributes
 * one hit.
 *
 * @param findings      All findings, in source order.
 * @param sources       The per-source query outcomes.
 * @param totalHits     The number of sources with at least one finding.
 * @param tier1Hits     The number of tier-1 sources with at least one finding.
 * @param tier2Hits     The number of tier-2 sources with at least one finding.
 * @param dualTier1     True if at least two tier-1 sources reported the URL.
 * @param criticalTier1 True if a tier-1 source reported a critical finding.
 * @param recentHit     True if a finding was last seen within the recency window.
 * @param tombstoned    True if the URL was previously confirmed malicious and taken down.
 */
public record TISummary(@NotNull List<TIFinding> findings,
                        @NotNull List<SourceStatus> sources,
                        int totalHits,
                        int tier1Hits,
                        int tier2Hits,
                        boolean dualTier1,
                        boolean criticalTier1,
                        boolean recentHit,
                        boolean tombstoned) {

    public TISummary {
        findings = List.copyOf(findings);
        sources = List.copyOf(sources);
    }

    public static TISummary empty() {
        return new TISummary(List.of(), List.of(), 0, 0, 0,
                false, false, false, false);
    }

    /**
     * Builds the summary from the collected findings.
     *
     * @param findings           The findings of all sources.
     * @param sources            The per-source outcomes.
     * @param tombstoned         The tombstone flag.
     * @param now                The reference time for the recency window.
     * @param recencyWindowDays  The recency window length.
     * @return The summary.
     */
    public static TISummary of(@NotNull List<TIFinding> findings, @NotNull List<SourceStatus> sources,
                               boolean tombstoned, @NotNull Instant now, int recencyWindowDays) {
        final Set<String> all = distinctSources(findings, null);
        final Set<String> tier1 = distinctSources(findings, SourceTier.TIER_1);
        final Set<String> tier2 = distinctSources(findings, SourceTier.TIER_2);

        final boolean critical = findings.stream()
                .anyMatch(f -> f.tier() == SourceTier.TIER_1 && f.severity() == Severity.CRITICAL);

        final Instant windowStart = now.minus(Duration.ofDays(recencyWindowDays));
        final boolean recent = findings.stream()
                .anyMatch(f -> f.lastSeen() != null && !f.lastSeen().isBefore(windowStart));

        return new TISummary(findings, sources, all.size(), tier1.size(), tier2.size(),
                tier1.size() >= 2, critical, recent, tombstoned);
    }

    /**
     * Returns the sorted names of the tier-1 sources with a finding.
     */
    public List<String> tier1Sources() {
        return List.copyOf(distinctSources(findings, SourceTier.TIER_1));
    }

    /**
     * Returns true if any source produced a finding.
     */
    public boolean hasHits() {
        return totalHits > 0;
    }

    /**
     * Returns the names of the sources whose query did not succeed.
     */
    public List<String> unavailableSources() {
        return sources.stream()
                .filter(s -> s.statusCode() != 0)
                .map(SourceStatus::source)
                .collect(Collectors.toList());
    }

    private static Set<String> distinctSources(List<TIFinding> findings, SourceTier tier) {
        return findings.stream()
                .filter(f -> tier == null || f.tier() == tier)
                .map(TIFinding::source)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
