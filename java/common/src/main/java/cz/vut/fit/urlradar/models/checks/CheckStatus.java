package cz.vut.fit.urlradar.models.checks;

/**
 * The status of a single check.
 */
public enum CheckStatus {
    PASS,
    WARN,
    FAIL,
    /**
     * The check could not evaluate its subject because the evidence it needs is unavailable, or it reports
     * a neutral fact.
     */
    INFO
}
