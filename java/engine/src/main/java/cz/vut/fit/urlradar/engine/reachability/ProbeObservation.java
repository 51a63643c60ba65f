package cz.vut.fit.urlradar.engine.reachability;

import cz.vut.fit.urlradar.models.reachability.ProbeStage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * What the prober observed before it stopped. The observation is built stage by stage; the last stage
 * reached is the one with a non-null error, or HTTP when the probe completed.
 *
 * @param hostname      The probed host.
 * @param addresses     The resolved addresses.
 * @param stage         The last stage reached.
 * @param error         The failure of the last stage, if it failed.
 * @param httpStatus    The status of the last response.
 * @param headers       The headers of the last response, names lower-cased.
 * @param body          The (capped) body of the last response.
 * @param redirectChain The visited URLs, starting with the probed one.
 * @param finalUrl      The URL of the last response.
 */
public record ProbeObservation(@NotNull String hostname,
                               @NotNull List<String> addresses,
                               @NotNull ProbeStage stage,
                               @Nullable String error,
                               @Nullable Integer httpStatus,
                               @NotNull Map<String, String> headers,
                               @Nullable String body,
                               @NotNull List<String> redirectChain,
                               @Nullable String finalUrl) {

    public ProbeObservation {
        addresses = List.copyOf(addresses);
        headers = Map.copyOf(headers);
        redirectChain = List.copyOf(redirectChain);
    }

    public static ProbeObservation dnsFailure(@NotNull String hostname, @NotNull String error) {
        return new ProbeObservation(hostname, List.of(), ProbeStage.DNS, error, null, Map.of(), null,
                List.of(), null);
    }

    public static ProbeObservation resolved(@NotNull String hostname, @NotNull List<String> addresses) {
        return new ProbeObservation(hostname, addresses, ProbeStage.DNS, null, null, Map.of(), null,
                List.of(), null);
    }

    public ProbeObservation tcpFailure(@NotNull String tcpError) {
        return new ProbeObservation(hostname, addresses, ProbeStage.TCP, tcpError, null, Map.of(), null,
                List.of(), null);
    }

    public ProbeObservation httpFailure(@NotNull String httpError, @NotNull List<String> chain) {
        return new ProbeObservation(hostname, addresses, ProbeStage.HTTP, httpError, null, Map.of(), null,
                chain, null);
    }

    public ProbeObservation httpResponse(int status, @NotNull Map<String, String> responseHeaders,
                                         @Nullable String responseBody, @NotNull List<String> chain,
                                         @NotNull String lastUrl) {
        return new ProbeObservation(hostname, addresses, ProbeStage.HTTP, null, status, responseHeaders,
                responseBody, chain, lastUrl);
    }

    public @Nullable String firstAddress() {
        return addresses.isEmpty() ? null : addresses.get(0);
    }

    public boolean failed() {
        return error != null;
    }
}
