package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.Futures;
import cz.vut.fit.urlradar.engine.config.StageSettings;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.ModelPrediction;
import cz.vut.fit.urlradar.models.ml.StageResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes the models of a stage concurrently under the stage budget and combines their predictions.
 * The probability is the weighted average of the model probabilities; the combined confidence is the
 * lowest model confidence. A model that fails or misses the budget contributes a neutral prediction with
 * zero confidence.
 *
 * @author URLRadar developers
 */
public class EnsembleStage {
    public static final String COMPONENT_NAME = "ensemble";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(EnsembleStage.class);

    private final String _name;

    public EnsembleStage(@NotNull String name) {
        _name = name;
    }

    public @NotNull String name() {
        return _name;
    }

    /**
     * Runs the stage.
     *
     * @param settings      The models, weights and budget of the stage.
     * @param predictor     The predictor variant.
     * @param features      The feature vector.
     * @param exitThreshold The confidence at or above which the stage sets {@code shouldExit}; values above 1
     *                      disable the exit.
     * @return A future that always completes normally with the stage result.
     */
    public @NotNull CompletableFuture<StageResult> run(@NotNull StageSettings settings,
                                                       @NotNull ModelPredictor predictor,
                                                       @NotNull FeatureVector features, double exitThreshold) {
        final long start = System.nanoTime();
        final long budgetMs = settings.budget().toMillis();
        final var models = settings.models();

        final var calls = new ArrayList<CompletableFuture<ModelPrediction>>(models.size());
        final boolean[] timedOut = new boolean[models.size()];
        for (int i = 0; i < models.size(); i++) {
            final int index = i;
            final var modelId = models.get(i);

            CompletableFuture<ModelPrediction> call;
            try {
                call = predictor.predict(modelId, features);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }

            calls.add(call
                    .orTimeout(budgetMs, TimeUnit.MILLISECONDS)
                    .handle((prediction, error) -> {
                        final long latency = elapsedMs(start);
                        if (error == null)
                            return prediction.withLatency(latency);

                        if (Futures.unwrap(error) instanceof TimeoutException)
                            timedOut[index] = true;
                        final var reason = Futures.describe(error);
                        Logger.debug("{} model {} failed: {}", _name, modelId, reason);
                        return ModelPrediction.failed(modelId, predictor.kind(), reason, latency);
                    }));
        }

        final var result = CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    final var predictions = new ArrayList<ModelPrediction>(calls.size());
                    for (var call : calls) {
                        predictions.add(call.join());
                    }
                    boolean anyTimedOut = false;
                    for (var flag : timedOut) {
                        anyTimedOut |= flag;
                    }
                    return combine(predictions, settings, exitThreshold, anyTimedOut, elapsedMs(start));
                });

        result.whenComplete((value, error) -> {
            if (result.isCancelled())
                Futures.cancelAll(calls);
        });
        return result;
    }

    /**
     * Combines the predictions of the stage.
     */
    @NotNull StageResult combine(@NotNull List<ModelPrediction> predictions, @NotNull StageSettings settings,
                                 double exitThreshold, boolean timedOut, long latencyMs) {
        double probability = 0.0;
        double confidence = predictions.isEmpty() ? 0.0 : 1.0;
        for (int i = 0; i < predictions.size(); i++) {
            final var prediction = predictions.get(i);
            probability += settings.weightOf(i) * prediction.probability();
            confidence = Math.min(confidence, prediction.confidence());
        }
        probability = Common.clamp01(probability);

        final boolean shouldExit = confidence >= exitThreshold;
        Logger.debug("{}: p={} c={} exit={} timedOut={}", _name, probability, confidence, shouldExit, timedOut);
        return new StageResult(_name, predictions, probability, confidence, shouldExit, timedOut, latencyMs);
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
