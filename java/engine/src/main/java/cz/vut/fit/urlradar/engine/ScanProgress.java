package cz.vut.fit.urlradar.engine;

import cz.vut.fit.urlradar.models.ScanRequest;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.ml.StageResult;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The intermediate results of one scan. Each stage publishes its immutable output here once it completes,
 * so that a scan cut short by its deadline can still report everything finished so far.
 *
 * @author URLRadar developers
 */
final class ScanProgress {
    final ScanRequest request;
    final Instant startedAt;

    volatile String stage = ScanOrchestrator.STAGE_INTEL;
    volatile TISummary intel;
    volatile ReachabilityResult reachability;
    volatile EvidenceBundle evidence;
    volatile FeatureVector features;
    volatile StageResult stage1;
    volatile StageResult stage2;
    volatile String stage2SkipReason;
    volatile CalibratedVerdict verdict;
    volatile List<CategoryResult> categories;

    private final Map<String, Long> _latencies = new LinkedHashMap<>();
    private final List<CompletableFuture<?>> _tasks = new ArrayList<>();

    ScanProgress(@NotNull ScanRequest request, @NotNull Instant startedAt) {
        this.request = request;
        this.startedAt = startedAt;
    }

    void enter(@NotNull String stageName) {
        stage = stageName;
    }

    synchronized void recordLatency(@NotNull String stageName, long startNanos) {
        _latencies.put(stageName, (System.nanoTime() - startNanos) / 1_000_000L);
    }

    synchronized @NotNull Map<String, Long> latencies() {
        return new LinkedHashMap<>(_latencies);
    }

    /**
     * Registers a sub-task so that it can be cancelled with the scan.
     */
    synchronized <T> CompletableFuture<T> track(@NotNull CompletableFuture<T> task) {
        _tasks.add(task);
        return task;
    }

    synchronized @NotNull Collection<CompletableFuture<?>> tasks() {
        return new ArrayList<>(_tasks);
    }

    /**
     * The stage that had not finished yet. The category checks run alongside the model stages and are
     * reported once the models are done.
     */
    @NotNull String pendingStage() {
        if (verdict != null && categories == null)
            return ScanOrchestrator.STAGE_CHECKS;
        return stage;
    }
}
