package cz.vut.fit.urlradar.engine.intel;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.Fixtures;
import cz.vut.fit.urlradar.models.intel.Severity;
import cz.vut.fit.urlradar.models.intel.SourceStatus;
import cz.vut.fit.urlradar.models.intel.SourceTier;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import cz.vut.fit.urlradar.models.intel.TISummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ThreatIntelAggregatorTest {
    private static final String URL = "https://paypai.com/";

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ThreatIntelSource source(String name, SourceTier tier,
                                            CompletableFuture<List<TIFinding>> answer) {
        var source = mock(ThreatIntelSource.class);
        when(source.name()).thenReturn(name);
        when(source.tier()).thenReturn(tier);
        when(source.query(anyString())).thenReturn(answer);
        return source;
    }

    private static TIFinding finding(String source, Severity severity) {
        return new TIFinding(source, SourceTier.TIER_1, severity, Fixtures.NOW, "SOCIAL_ENGINEERING");
    }

    @Test
    void mergesFindingsOfAllSources() throws Exception {
        var gsb = source("gsb", SourceTier.TIER_1,
                CompletableFuture.completedFuture(List.of(finding("gsb", Severity.HIGH))));
        var vt = source("virustotal", SourceTier.TIER_1,
                CompletableFuture.completedFuture(List.of(finding("virustotal", Severity.HIGH))));
        var aggregator = new ThreatIntelAggregator(List.of(gsb, vt), TombstoneStore.none(), executor, Fixtures.CLOCK);

        TISummary summary = aggregator.aggregate(URL, Fixtures.config()).get(5, TimeUnit.SECONDS);

        assertEquals(2, summary.tier1Hits());
        assertTrue(summary.dualTier1());
        assertTrue(summary.recentHit());
        assertEquals(2, summary.sources().size());
        assertTrue(summary.unavailableSources().isEmpty());
        verify(gsb).query(URL);
        verify(vt).query(URL);
    }

    @Test
    void failingSourceYieldsEmptyResult() throws Exception {
        var broken = source("broken", SourceTier.TIER_1, CompletableFuture.failedFuture(
                new CollaboratorException(ResultCodes.CANNOT_FETCH, "connection refused")));
        var ok = source("ok", SourceTier.TIER_2, CompletableFuture.completedFuture(List.of()));
        var aggregator = new ThreatIntelAggregator(List.of(broken, ok), TombstoneStore.none(), executor,
                Fixtures.CLOCK);

        var summary = aggregator.aggregate(URL, Fixtures.config()).get(5, TimeUnit.SECONDS);

        assertEquals(0, summary.totalHits());
        assertEquals(List.of("broken"), summary.unavailableSources());
        SourceStatus status = summary.sources().get(0);
        assertEquals(ResultCodes.CANNOT_FETCH, status.statusCode());
        assertNotNull(status.error());
    }

    @Test
    void throwingSourceYieldsEmptyResult() throws Exception {
        var throwing = mock(ThreatIntelSource.class);
        when(throwing.name()).thenReturn("throwing");
        when(throwing.query(anyString())).thenThrow(new IllegalStateException("bug"));
        var aggregator = new ThreatIntelAggregator(List.of(throwing), TombstoneStore.none(), executor,
                Fixtures.CLOCK);

        var summary = aggregator.aggregate(URL, Fixtures.config()).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("throwing"), summary.unavailableSources());
        assertEquals(ResultCodes.INTERNAL_ERROR, summary.sources().get(0).statusCode());
    }

    @Test
    void slowSourceTimesOut() throws Exception {
        var slow = source("slow", SourceTier.TIER_1, new CompletableFuture<>());
        var aggregator = new ThreatIntelAggregator(List.of(slow), TombstoneStore.none(), executor, Fixtures.CLOCK);

        long start = System.nanoTime();
        var summary = aggregator.aggregate(URL, Fixtures.config("intel.source.timeout.ms", "100"))
                .get(5, TimeUnit.SECONDS);

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2000);
        assertEquals(ResultCodes.TIMEOUT, summary.sources().get(0).statusCode());
        assertEquals(0, summary.totalHits());
    }

    @Test
    void tombstoneLookup() throws Exception {
        var tombstones = new InMemoryTombstoneStore(List.of("paypai.com"));
        var aggregator = new ThreatIntelAggregator(List.of(), tombstones, executor, Fixtures.CLOCK);

        assertTrue(aggregator.aggregate(URL, Fixtures.config()).get(5, TimeUnit.SECONDS).tombstoned());
        assertFalse(aggregator.aggregate("https://example.com/", Fixtures.config()).get(5, TimeUnit.SECONDS)
                .tombstoned());
    }

    @Test
    void cancellingTheAggregateCancelsPendingQueries() {
        var pending = new CompletableFuture<List<TIFinding>>();
        var slow = source("slow", SourceTier.TIER_1, pending);
        var aggregator = new ThreatIntelAggregator(List.of(slow), TombstoneStore.none(), executor, Fixtures.CLOCK);

        var future = aggregator.aggregate(URL, Fixtures.config("intel.source.timeout.ms", "10000"));
        future.cancel(true);

        assertTrue(pending.isCancelled());
    }
}
