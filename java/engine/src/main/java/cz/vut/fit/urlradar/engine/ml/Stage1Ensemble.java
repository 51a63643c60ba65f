package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.StageResult;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * The fast path: lexical and tabular models. Sets {@code shouldExit} when the combined confidence reaches
 * the early-exit threshold.
 *
 * @author URLRadar developers
 */
public class Stage1Ensemble {
    public static final String STAGE_NAME = "stage1";

    private final EnsembleStage _stage = new EnsembleStage(STAGE_NAME);

    public @NotNull CompletableFuture<StageResult> run(@NotNull FeatureVector features,
                                                       @NotNull ModelPredictor predictor,
                                                       @NotNull ConfigSnapshot config) {
        return _stage.run(config.stage1(), predictor, features, config.earlyExitThreshold());
    }
}
