package cz.vut.fit.urlradar.models.reachability;

/**
 * The stages of the reachability state machine, in execution order.
 */
public enum ProbeStage {
    DNS,
    TCP,
    HTTP
}
