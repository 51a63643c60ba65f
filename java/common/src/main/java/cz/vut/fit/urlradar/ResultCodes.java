package cz.vut.fit.urlradar;

/**
 * Status codes attached to the outcome of a collaborator call (threat-intel source, evidence
 * collector, model predictor).
 *
 * @author URLRadar developers
 */
public final class ResultCodes {
    private ResultCodes() {
    }

    /**
     * The operation was successful.
     */
    public static final int OK = 0;

    /**
     * The collaborator was not invoked because the current reachability branch or the scan options
     * exclude it.
     */
    public static final int SKIPPED = 1;

    /**
     * The collaborator is disabled (e.g. no access token configured).
     */
    public static final int DISABLED = 2;

    /**
     * A generic error not caused inside the scanning system.
     */
    public static final int OTHER_EXTERNAL_ERROR = 10;

    /**
     * A generic error caused inside the scanning system (e.g. invalid state).
     */
    public static final int INTERNAL_ERROR = 20;

    /**
     * Object does not exist.
     */
    public static final int NOT_FOUND = 30;

    /**
     * Invalid format of remote source's response.
     */
    public static final int INVALID_FORMAT = 40;

    /**
     * Error fetching from remote source.
     */
    public static final int CANNOT_FETCH = 50;

    /**
     * We are rate limited at the remote source.
     */
    public static final int RATE_LIMITED = 51;

    /**
     * The operation did not finish in its time budget.
     */
    public static final int TIMEOUT = 52;

    /**
     * The address cannot be processed by the collaborator (e.g. IPv6 not supported).
     */
    public static final int UNSUPPORTED_ADDRESS = 61;

    /**
     * Unexpected DNS error.
     */
    public static final int OTHER_DNS_ERROR = 70;

    /**
     * Returns a short name of the code, used in logs and human-readable reasons.
     *
     * @param code the code
     * @return the name
     */
    public static String nameOf(int code) {
        return switch (code) {
            case OK -> "ok";
            case SKIPPED -> "skipped";
            case DISABLED -> "disabled";
            case OTHER_EXTERNAL_ERROR -> "external error";
            case INTERNAL_ERROR -> "internal error";
            case NOT_FOUND -> "not found";
            case INVALID_FORMAT -> "invalid format";
            case CANNOT_FETCH -> "cannot fetch";
            case RATE_LIMITED -> "rate limited";
            case TIMEOUT -> "timeout";
            case UNSUPPORTED_ADDRESS -> "unsupported address";
            case OTHER_DNS_ERROR -> "dns error";
            default -> "code " + code;
        };
    }
}
