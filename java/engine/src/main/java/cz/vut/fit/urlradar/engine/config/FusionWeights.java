package cz.vut.fit.urlradar.engine.config;

/**
 * The weights of the fused probability. When Stage-2 did not run, {@code stage2} is zero.
 *
 * @param stage1 The weight of the Stage-1 probability.
 * @param stage2 The weight of the Stage-2 probability.
 * @param causal The weight of the causal contribution.
 */
public record FusionWeights(double stage1, double stage2, double causal) {
}
