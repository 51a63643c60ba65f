package cz.vut.fit.urlradar.engine.calibration;

/**
 * Derives the half-width of the prediction interval around a point estimate.
 */
public interface ConformalCalibrator {
    /**
     * The identifier reported as the calibration method of a verdict.
     */
    String method();

    /**
     * Returns the non-negative half-width of the interval for the given probability and miscoverage rate.
     */
    double halfWidth(double probability, double alpha);
}
