package cz.vut.fit.urlradar.engine.calibration;

import cz.vut.fit.urlradar.Common;

/**
 * The fallback for branches without calibration data: a binomial margin
 * {@code sqrt(p(1 - p)) * sqrt(-2 ln alpha) * 0.5}, widest at p = 0.5 and zero at the extremes.
 *
 * @author URLRadar developers
 */
public class BinomialMarginCalibrator implements ConformalCalibrator {
    public static final String METHOD = "binomial-margin";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public double halfWidth(double probability, double alpha) {
        final double p = Common.clamp01(probability);
        return Math.sqrt(p * (1.0 - p)) * Math.sqrt(-2.0 * Math.log(alpha)) * 0.5;
    }
}
