package cz.vut.fit.urlradar.engine;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.calibration.CalibrationStore;
import cz.vut.fit.urlradar.engine.calibration.Combiner;
import cz.vut.fit.urlradar.engine.calibration.JsonCalibrationStore;
import cz.vut.fit.urlradar.engine.checks.CategoryCheckEngine;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.config.ConfigProvider;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.config.ConfigurationException;
import cz.vut.fit.urlradar.engine.evidence.DnsResolver;
import cz.vut.fit.urlradar.engine.evidence.DomainRegistryLookup;
import cz.vut.fit.urlradar.engine.evidence.EvidenceCollector;
import cz.vut.fit.urlradar.engine.evidence.NetworkLookup;
import cz.vut.fit.urlradar.engine.evidence.PageRenderer;
import cz.vut.fit.urlradar.engine.evidence.TlsInspector;
import cz.vut.fit.urlradar.engine.features.FeatureExtractor;
import cz.vut.fit.urlradar.engine.intel.InMemoryTombstoneStore;
import cz.vut.fit.urlradar.engine.intel.IntelGate;
import cz.vut.fit.urlradar.engine.intel.ThreatIntelAggregator;
import cz.vut.fit.urlradar.engine.intel.ThreatIntelSource;
import cz.vut.fit.urlradar.engine.intel.TombstoneStore;
import cz.vut.fit.urlradar.engine.ml.PredictorRegistry;
import cz.vut.fit.urlradar.engine.ml.Stage1Ensemble;
import cz.vut.fit.urlradar.engine.ml.Stage2Ensemble;
import cz.vut.fit.urlradar.engine.policy.PolicyEngine;
import cz.vut.fit.urlradar.engine.policy.RecommendedActions;
import cz.vut.fit.urlradar.engine.reachability.ReachabilityProber;
import cz.vut.fit.urlradar.engine.risk.RiskBandMapper;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.ScanRequest;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.checks.CategorySummary;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.ml.StageResult;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import cz.vut.fit.urlradar.models.results.RiskSource;
import cz.vut.fit.urlradar.models.results.ScanResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the scan pipeline: intel gate, reachability probe, branch-scoped evidence collection, feature
 * extraction, the two model stages and the combiner, the policy rules and the risk band mapping. The category
 * checks run alongside the model stages.
 * <p>
 * A scan never fails because a collaborator is unavailable. When the deadline expires, the scan returns
 * whatever has been computed so far, marked as incomplete. All scans share one fixed-size executor, which
 * {@link #close()} shuts down.
 *
 * @author URLRadar developers
 */
public class ScanOrchestrator implements AutoCloseable {
    public static final String COMPONENT_NAME = "orchestrator";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ScanOrchestrator.class);

    public static final String MDC_SCAN_ID = "scanId";

    public static final String STAGE_INTEL = "intel";
    public static final String STAGE_REACHABILITY = "reachability";
    public static final String STAGE_EVIDENCE = "evidence";
    public static final String STAGE_FEATURES = "features";
    public static final String STAGE_CHECKS = "checks";
    public static final String STAGE_COMBINER = "combiner";
    public static final String STAGE_POLICY = "policy";

    /**
     * The level reported by an incomplete scan that did not get as far as a probability.
     */
    static final RiskLevel INDETERMINATE_LEVEL = RiskLevel.C;

    private final ConfigProvider _configProvider;
    private final ThreatIntelAggregator _intel;
    private final IntelGate _gate;
    private final ReachabilityProber _prober;
    private final EvidenceCollector _evidence;
    private final FeatureExtractor _features;
    private final PredictorRegistry _predictors;
    private final Stage1Ensemble _stage1 = new Stage1Ensemble();
    private final Stage2Ensemble _stage2 = new Stage2Ensemble();
    private final Combiner _combiner;
    private final PolicyEngine _policy;
    private final CategoryCheckEngine _checks;
    private final RiskBandMapper _riskBands = new RiskBandMapper();
    private final ExecutorService _executor;
    private final Clock _clock;

    private ScanOrchestrator(Builder builder, ExecutorService executor) {
        _configProvider = builder._configProvider;
        _executor = executor;
        _clock = builder._clock;
        _intel = new ThreatIntelAggregator(builder._intelSources, builder._tombstones, executor, _clock);
        _gate = new IntelGate();
        _prober = builder._proberFactory.create(builder._dnsResolver, executor);
        _evidence = new EvidenceCollector(builder._registry, builder._dnsResolver, builder._tlsInspector,
                builder._renderer, builder._networkLookup, executor);
        _features = new FeatureExtractor(_clock);
        _predictors = builder._predictors;
        _combiner = new Combiner(builder._calibration, _clock);
        _policy = new PolicyEngine();
        _checks = builder._checks;
    }

    public static Builder builder(@NotNull ConfigProvider configProvider) {
        return new Builder(configProvider);
    }

    /**
     * Scans the URL and waits for the result. The scan identifier is in the MDC for the duration of the call.
     *
     * @param request The scan request.
     * @return The result; never null.
     */
    public @NotNull ScanResult scan(@NotNull ScanRequest request) {
        MDC.put(MDC_SCAN_ID, request.scanId());
        try {
            Logger.debug("Scanning {}", request.url());
            final var result = scanAsync(request).join();
            Logger.debug("{}: level {} ({}), incomplete {}", request.url(), result.riskLevel(),
                    result.riskSource(), result.incomplete());
            return result;
        } finally {
            MDC.remove(MDC_SCAN_ID);
        }
    }

    /**
     * Starts the scan on the executor. Cancelling the returned future cancels the scan's in-flight sub-tasks.
     *
     * @param request The scan request.
     * @return A future that completes normally with the result unless it is cancelled.
     */
    public @NotNull CompletableFuture<ScanResult> scanAsync(@NotNull ScanRequest request) {
        final var config = _configProvider.snapshot();
        final var progress = new ScanProgress(request, _clock.instant());
        final Duration deadline = request.options().deadline() != null
                ? request.options().deadline()
                : config.scanDeadline();

        final var pipeline = runIntel(progress, config);
        final var result = pipeline
                .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, error) -> {
                    if (error == null)
                        return value;

                    final var stage = progress.pendingStage();
                    Futures.cancelAll(progress.tasks());
                    final var cause = Futures.unwrap(error);
                    final String reason;
                    if (cause instanceof TimeoutException) {
                        reason = "Deadline of %d ms expired during the %s stage".formatted(deadline.toMillis(), stage);
                        Logger.debug("Scan {} of {}: {}", request.scanId(), request.url(), reason);
                    } else if (cause instanceof CancellationException) {
                        reason = "Cancelled during the " + stage + " stage";
                    } else {
                        reason = "The " + stage + " stage failed: " + Futures.describe(cause);
                        Logger.warn("Scan {} of {} failed in the {} stage", request.scanId(), request.url(), stage,
                                cause);
                    }
                    return partialResult(progress, config, reason);
                });

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                Logger.debug("Scan {} of {} cancelled", request.scanId(), request.url());
                pipeline.cancel(true);
                Futures.cancelAll(progress.tasks());
            }
        });
        return result;
    }

    /**
     * Evaluates the policy rules against the current configuration.
     *
     * @param features     The feature vector; null when not computed.
     * @param intel        The threat-intel summary.
     * @param reachability The reachability result; null when not probed.
     * @return The policy decision.
     */
    public @NotNull PolicyDecision evaluatePolicy(@Nullable FeatureVector features, @NotNull TISummary intel,
                                                  @Nullable ReachabilityResult reachability) {
        return _policy.evaluate(features, intel, reachability, _configProvider.snapshot());
    }

    @Override
    public void close() {
        _prober.close();
        _executor.shutdownNow();
        try {
            if (!_executor.awaitTermination(5, TimeUnit.SECONDS))
                Logger.warn("Scan executor did not terminate in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Pipeline stages ---

    private CompletableFuture<ScanResult> runIntel(ScanProgress progress, ConfigSnapshot config) {
        final long start = System.nanoTime();
        return progress.track(_intel.aggregate(progress.request.url(), config))
                .thenCompose(intel -> {
                    progress.intel = intel;
                    progress.recordLatency(STAGE_INTEL, start);

                    final var gate = _gate.evaluate(intel, config);
                    if (gate.overridden()) {
                        Logger.debug("{}: intel gate matched {}", progress.request.url(), gate.rule());
                        return CompletableFuture.completedFuture(terminalResult(progress, gate));
                    }
                    return runReachability(progress, config);
                });
    }

    private CompletableFuture<ScanResult> runReachability(ScanProgress progress, ConfigSnapshot config) {
        progress.enter(STAGE_REACHABILITY);
        final long start = System.nanoTime();
        return progress.track(_prober.probeAsync(progress.request.url(), config))
                .thenCompose(reachability -> {
                    progress.reachability = reachability;
                    progress.recordLatency(STAGE_REACHABILITY, start);
                    return runEvidence(progress, config);
                });
    }

    private CompletableFuture<ScanResult> runEvidence(ScanProgress progress, ConfigSnapshot config) {
        progress.enter(STAGE_EVIDENCE);
        final long start = System.nanoTime();
        return progress.track(_evidence.collect(progress.request.url(), progress.reachability,
                        progress.request.options(), config))
                .thenCompose(evidence -> {
                    progress.evidence = evidence;
                    progress.recordLatency(STAGE_EVIDENCE, start);
                    return runAnalysis(progress, config);
                });
    }

    private CompletableFuture<ScanResult> runAnalysis(ScanProgress progress, ConfigSnapshot config) {
        progress.enter(STAGE_FEATURES);
        final long featuresStart = System.nanoTime();
        final var features = _features.extract(progress.request.url(), progress.reachability, progress.evidence,
                progress.intel);
        progress.features = features;
        progress.recordLatency(STAGE_FEATURES, featuresStart);

        final long checksStart = System.nanoTime();
        final var context = new CheckContext(progress.reachability, progress.intel, progress.evidence, features,
                config, _clock.instant());
        final var checks = progress.track(_checks.runAsync(context, _executor))
                .thenAccept(categories -> {
                    progress.categories = categories;
                    progress.recordLatency(STAGE_CHECKS, checksStart);
                });

        return runModels(progress, config, features)
                .thenCombine(checks, (verdict, ignored) -> assemble(progress, config));
    }

    private CompletableFuture<CalibratedVerdict> runModels(ScanProgress progress, ConfigSnapshot config,
                                                           FeatureVector features) {
        final var predictor = _predictors.forConfig(config);

        progress.enter(Stage1Ensemble.STAGE_NAME);
        final long stage1Start = System.nanoTime();
        return progress.track(_stage1.run(features, predictor, config))
                .thenCompose(stage1 -> {
                    progress.stage1 = stage1;
                    progress.recordLatency(Stage1Ensemble.STAGE_NAME, stage1Start);

                    final var skipReason = Stage2Ensemble.skipReason(stage1, features.branch(),
                            progress.request.options());
                    if (skipReason != null) {
                        Logger.trace("{}: Stage-2 skipped: {}", progress.request.url(), skipReason);
                        progress.stage2SkipReason = skipReason;
                        return CompletableFuture.completedFuture(combine(progress, config, stage1, null));
                    }

                    progress.enter(Stage2Ensemble.STAGE_NAME);
                    final long stage2Start = System.nanoTime();
                    return progress.track(_stage2.run(features, predictor, config))
                            .thenApply(stage2 -> {
                                progress.stage2 = stage2;
                                progress.recordLatency(Stage2Ensemble.STAGE_NAME, stage2Start);
                                return combine(progress, config, stage1, stage2);
                            });
                });
    }

    private CalibratedVerdict combine(ScanProgress progress, ConfigSnapshot config, StageResult stage1,
                                      @Nullable StageResult stage2) {
        progress.enter(STAGE_COMBINER);
        final long start = System.nanoTime();
        final var verdict = _combiner.combine(stage1, stage2, progress.features, config);
        progress.verdict = verdict;
        progress.recordLatency(STAGE_COMBINER, start);
        return verdict;
    }

    // --- Result assembly ---

    private ScanResult assemble(ScanProgress progress, ConfigSnapshot config) {
        final long start = System.nanoTime();
        final var reachability = progress.reachability;
        final var decision = _policy.evaluate(progress.features, progress.intel, reachability, config);
        final var outcome = _riskBands.resolve(decision, progress.verdict, reachability.status(), config);
        progress.recordLatency(STAGE_POLICY, start);

        final var categories = progress.categories;
        return new ScanResult(progress.request.scanId(), progress.request.url(), progress.request.hostname(),
                progress.startedAt, _clock.instant(), reachability, progress.intel, progress.evidence,
                progress.features, progress.stage1, progress.stage2, progress.stage2SkipReason, progress.verdict,
                decision, categories, CategorySummary.of(categories), outcome.level(), outcome.source(),
                false, false, null, RecommendedActions.of(decision, progress.verdict, outcome.level()),
                progress.latencies());
    }

    private ScanResult terminalResult(ScanProgress progress, PolicyDecision gate) {
        final var level = Objects.requireNonNull(gate.riskLevel());
        return new ScanResult(progress.request.scanId(), progress.request.url(), progress.request.hostname(),
                progress.startedAt, _clock.instant(), null, progress.intel, null, null, null, null,
                null, null, gate, List.of(), null, level, RiskSource.POLICY, true, false, null,
                RecommendedActions.of(gate, null, level), progress.latencies());
    }

    /**
     * Assembles the best available result of a scan that did not finish.
     */
    private ScanResult partialResult(ScanProgress progress, ConfigSnapshot config, String reason) {
        final var intel = progress.intel != null ? progress.intel : TISummary.empty();
        final var reachability = progress.reachability;
        final var verdict = progress.verdict;
        final var decision = _policy.evaluate(progress.features, intel, reachability, config);

        final RiskLevel level;
        final RiskSource source;
        if (decision.overridden()) {
            level = Objects.requireNonNull(decision.riskLevel());
            source = RiskSource.POLICY;
        } else if (verdict != null && reachability != null) {
            level = _riskBands.map(verdict.probability(), reachability.status(), config);
            source = RiskSource.CALIBRATED;
        } else if (progress.stage1 != null && reachability != null) {
            level = _riskBands.map(progress.stage1.probability(), reachability.status(), config);
            source = RiskSource.CALIBRATED;
        } else {
            level = INDETERMINATE_LEVEL;
            source = RiskSource.CALIBRATED;
        }

        final List<CategoryResult> categories = progress.categories != null ? progress.categories : List.of();
        return new ScanResult(progress.request.scanId(), progress.request.url(), progress.request.hostname(),
                progress.startedAt, _clock.instant(), reachability, intel, progress.evidence, progress.features,
                progress.stage1, progress.stage2, progress.stage2SkipReason, verdict, decision,
                categories, progress.categories == null ? null : CategorySummary.of(categories),
                level, source, false, true, reason, RecommendedActions.of(decision, verdict, level),
                progress.latencies());
    }

    /**
     * Creates the prober; replaced in tests to observe or stub the probing.
     */
    @FunctionalInterface
    public interface ProberFactory {
        ReachabilityProber create(DnsResolver resolver, ExecutorService executor);
    }

    /**
     * Collects the collaborators of an orchestrator.
     */
    public static class Builder {
        private final ConfigProvider _configProvider;
        private List<ThreatIntelSource> _intelSources = List.of();
        private @Nullable TombstoneStore _tombstones;
        private DnsResolver _dnsResolver;
        private DomainRegistryLookup _registry;
        private TlsInspector _tlsInspector;
        private PageRenderer _renderer;
        private @Nullable NetworkLookup _networkLookup;
        private PredictorRegistry _predictors = PredictorRegistry.heuristicOnly();
        private @Nullable CalibrationStore _calibration;
        private CategoryCheckEngine _checks;
        private ProberFactory _proberFactory = ReachabilityProber::new;
        private Clock _clock = Clock.systemUTC();

        private Builder(@NotNull ConfigProvider configProvider) {
            _configProvider = configProvider;
        }

        public Builder intelSources(@NotNull List<ThreatIntelSource> sources) {
            _intelSources = List.copyOf(sources);
            return this;
        }

        public Builder tombstones(@NotNull TombstoneStore tombstones) {
            _tombstones = tombstones;
            return this;
        }

        public Builder dnsResolver(@NotNull DnsResolver resolver) {
            _dnsResolver = resolver;
            return this;
        }

        public Builder registryLookup(@NotNull DomainRegistryLookup registry) {
            _registry = registry;
            return this;
        }

        public Builder tlsInspector(@NotNull TlsInspector inspector) {
            _tlsInspector = inspector;
            return this;
        }

        public Builder pageRenderer(@NotNull PageRenderer renderer) {
            _renderer = renderer;
            return this;
        }

        public Builder networkLookup(@Nullable NetworkLookup lookup) {
            _networkLookup = lookup;
            return this;
        }

        public Builder predictors(@NotNull PredictorRegistry predictors) {
            _predictors = predictors;
            return this;
        }

        public Builder calibration(@NotNull CalibrationStore store) {
            _calibration = store;
            return this;
        }

        public Builder checks(@NotNull CategoryCheckEngine checks) {
            _checks = checks;
            return this;
        }

        public Builder proberFactory(@NotNull ProberFactory factory) {
            _proberFactory = factory;
            return this;
        }

        public Builder clock(@NotNull Clock clock) {
            _clock = clock;
            return this;
        }

        /**
         * Builds the orchestrator and starts its executor, sized by the current configuration.
         *
         * @throws NullPointerException   if a required collaborator is missing
         * @throws ConfigurationException if the configured model variant has no registered predictor
         */
        public ScanOrchestrator build() {
            Objects.requireNonNull(_dnsResolver, "dnsResolver");
            Objects.requireNonNull(_registry, "registryLookup");
            Objects.requireNonNull(_tlsInspector, "tlsInspector");
            Objects.requireNonNull(_renderer, "pageRenderer");

            final var config = _configProvider.snapshot();
            _predictors.forConfig(config);
            if (_tombstones == null)
                _tombstones = new InMemoryTombstoneStore(config.tombstones());
            if (_calibration == null)
                _calibration = JsonCalibrationStore.load(config.calibrationDir());
            if (_checks == null)
                _checks = new CategoryCheckEngine();

            final var threadCounter = new AtomicInteger();
            final ExecutorService executor = Executors.newFixedThreadPool(config.executorThreads(), runnable -> {
                final var thread = new Thread(runnable, "scan-worker-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            Logger.info("Scan orchestrator started with {} worker threads", config.executorThreads());
            return new ScanOrchestrator(this, executor);
        }
    }
}
