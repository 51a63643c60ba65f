package cz.vut.fit.urlradar.models.reachability;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The classification produced by the reachability prober. Produced once per scan.
 *
 * @param status        The reachability branch.
 * @param failureStage  The stage that failed, for OFFLINE results.
 * @param resolvedIp    The first resolved address of the host, if any.
 * @param httpStatus    The status of the last HTTP response, if any.
 * @param redirectChain The URLs visited, starting with the scanned URL.
 * @param finalUrl      The URL of the last response, if any.
 * @param signals       Human-readable evidence that led to a SINKHOLE, WAF or PARKED classification.
 * @param error         A description of the failure, for OFFLINE results.
 * @param latencyMs     The total time spent probing.
 */
public record ReachabilityResult(@NotNull ReachabilityStatus status,
                                 @Nullable ProbeStage failureStage,
                                 @Nullable String resolvedIp,
                                 @Nullable Integer httpStatus,
                                 @NotNull List<String> redirectChain,
                                 @Nullable String finalUrl,
                                 @NotNull List<String> signals,
                                 @Nullable String error,
                                 long latencyMs) {

    public ReachabilityResult {
        redirectChain = List.copyOf(redirectChain);
        signals = List.copyOf(signals);
    }

    /**
     * Creates an OFFLINE result for a failed stage.
     */
    public static ReachabilityResult offline(@NotNull ProbeStage stage, @Nullable String resolvedIp,
                                             @Nullable Integer httpStatus, @NotNull List<String> redirectChain,
                                             @Nullable String error, long latencyMs) {
        return new ReachabilityResult(ReachabilityStatus.OFFLINE, stage, resolvedIp, httpStatus,
                redirectChain, null, List.of(), error, latencyMs);
    }

    /**
     * Creates a synthetic result with the given status only. Used where no probe was performed
     * (e.g. the intel gate ended the scan) and in tests.
     */
    public static ReachabilityResult of(@NotNull ReachabilityStatus status) {
        return new ReachabilityResult(status, null, null, null, List.of(), null, List.of(),
                null, 0L);
    }

    /**
     * The number of redirects followed.
     */
    public int redirectCount() {
        return Math.max(0, redirectChain.size() - 1);
    }
}
