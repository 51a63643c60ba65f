package cz.vut.fit.urlradar.models;

/**
 * The reachability branch of a scanned target. The branch gates the scope of evidence collection,
 * the category checks that can run and the risk thresholds.
 */
public enum ReachabilityStatus {
    /**
     * The target answered with a regular (2xx/3xx) HTTP response.
     */
    ONLINE,
    /**
     * DNS resolution or TCP connection failed, or the server answered with an error status.
     */
    OFFLINE,
    /**
     * The target serves a registrar or parking-service placeholder.
     */
    PARKED,
    /**
     * The target is hidden behind a bot challenge or a web application firewall.
     */
    WAF,
    /**
     * The target resolves to, or redirects to, known takedown infrastructure.
     */
    SINKHOLE
}
