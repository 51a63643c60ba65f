package cz.vut.fit.urlradar.models.results;

/**
 * What determined the final risk level of a scan.
 *
 * @author URLRadar developers
 */
public enum RiskSource {
    /**
     * A policy rule overrode the ML verdict.
     */
    POLICY,
    /**
     * The calibrated probability was mapped through the branch thresholds.
     */
    CALIBRATED
}
