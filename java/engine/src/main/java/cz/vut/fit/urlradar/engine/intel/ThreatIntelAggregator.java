package cz.vut.fit.urlradar.engine.intel;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.Futures;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.intel.SourceStatus;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import cz.vut.fit.urlradar.models.intel.TISummary;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Queries all reputation sources and the tombstone store concurrently and aggregates their findings.
 * A failing or slow source never fails the aggregation; its outcome is recorded in the source statuses.
 *
 * @author URLRadar developers
 */
public class ThreatIntelAggregator {
    public static final String COMPONENT_NAME = "intel-aggregator";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ThreatIntelAggregator.class);

    private record SourceOutcome(List<TIFinding> findings, SourceStatus status) {
    }

    private final List<ThreatIntelSource> _sources;
    private final TombstoneStore _tombstones;
    private final ExecutorService _executor;
    private final Clock _clock;

    public ThreatIntelAggregator(@NotNull List<ThreatIntelSource> sources, @NotNull TombstoneStore tombstones,
                                 @NotNull ExecutorService executor) {
        this(sources, tombstones, executor, Clock.systemUTC());
    }

    public ThreatIntelAggregator(@NotNull List<ThreatIntelSource> sources, @NotNull TombstoneStore tombstones,
                                 @NotNull ExecutorService executor, @NotNull Clock clock) {
        _sources = List.copyOf(sources);
        _tombstones = tombstones;
        _executor = executor;
        _clock = clock;
    }

    /**
     * Aggregates the findings of all sources for the URL.
     *
     * @param url    The canonical URL.
     * @param config The configuration snapshot.
     * @return A future that always completes normally with the summary.
     */
    public @NotNull CompletableFuture<TISummary> aggregate(@NotNull String url, @NotNull ConfigSnapshot config) {
        final long timeoutMs = config.intelSourceTimeout().toMillis();

        final var queries = new ArrayList<CompletableFuture<?>>(_sources.size());
        final var outcomes = new ArrayList<CompletableFuture<SourceOutcome>>(_sources.size());
        for (var source : _sources) {
            outcomes.add(querySource(source, url, timeoutMs, queries));
        }

        final var tombstone = CompletableFuture
                .supplyAsync(() -> _tombstones.isTombstoned(url), _executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    Logger.debug("Tombstone lookup failed for {}: {}", url, Futures.describe(e));
                    return false;
                });

        final var all = new ArrayList<CompletableFuture<?>>(outcomes);
        all.add(tombstone);

        final var result = CompletableFuture.allOf(all.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    final var findings = new ArrayList<TIFinding>();
                    final var statuses = new ArrayList<SourceStatus>();
                    for (var outcome : outcomes) {
                        var value = outcome.join();
                        findings.addAll(value.findings());
                        statuses.add(value.status());
                    }
                    final var summary = TISummary.of(findings, statuses, tombstone.join(), _clock.instant(),
                            config.recencyWindowDays());
                    Logger.debug("Intel for {}: {} hits ({} tier-1), {} sources unavailable, tombstoned {}", url,
                            summary.totalHits(), summary.tier1Hits(), summary.unavailableSources().size(),
                            summary.tombstoned());
                    return summary;
                });

        // Cancelling the aggregate cancels the pending source queries
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                Futures.cancelAll(queries);
                Futures.cancelAll(all);
            }
        });
        return result;
    }

    private CompletableFuture<SourceOutcome> querySource(ThreatIntelSource source, String url, long timeoutMs,
                                                         List<CompletableFuture<?>> queries) {
        final long start = System.nanoTime();
        CompletableFuture<List<TIFinding>> query;
        try {
            query = source.query(url);
        } catch (RuntimeException e) {
            query = CompletableFuture.failedFuture(e);
        }
        queries.add(query);

        return query
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((findings, error) -> {
                    final long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (error != null) {
                        final int code = Futures.codeOf(error);
                        final var description = Futures.describe(error);
                        if (code == ResultCodes.DISABLED)
                            Logger.trace("Source {} disabled: {}", source.name(), description);
                        else
                            Logger.warn("Source {} failed for {}: {}", source.name(), url, description);
                        return new SourceOutcome(List.of(),
                                new SourceStatus(source.name(), code, description, 0, latency));
                    }

                    final var list = findings == null ? List.<TIFinding>of() : findings;
                    return new SourceOutcome(list,
                            new SourceStatus(source.name(), ResultCodes.OK, null, list.size(), latency));
                });
    }
}
