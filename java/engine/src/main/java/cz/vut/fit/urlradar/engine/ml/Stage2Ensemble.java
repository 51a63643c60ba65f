package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.ScanOptions;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.StageResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * The deep path: text persuasion and screenshot models. Runs only for online targets when the fast path
 * did not exit early.
 *
 * @author URLRadar developers
 */
public class Stage2Ensemble {
    public static final String STAGE_NAME = "stage2";

    private static final double NEVER_EXIT = 2.0;

    private final EnsembleStage _stage = new EnsembleStage(STAGE_NAME);

    /**
     * Returns why Stage-2 must not run, or null when it should run.
     */
    public static @Nullable String skipReason(@NotNull StageResult stage1, @NotNull ReachabilityStatus branch,
                                              @NotNull ScanOptions options) {
        if (stage1.shouldExit())
            return "Stage-1 confidence %.2f reached the early-exit threshold".formatted(stage1.confidence());
        if (branch != ReachabilityStatus.ONLINE)
            return "No page content for " + branch + " targets";
        if (options.skipStage2())
            return "Disabled by scan options";
        return null;
    }

    public @NotNull CompletableFuture<StageResult> run(@NotNull FeatureVector features,
                                                       @NotNull ModelPredictor predictor,
                                                       @NotNull ConfigSnapshot config) {
        return _stage.run(config.stage2(), predictor, features, NEVER_EXIT);
    }
}
