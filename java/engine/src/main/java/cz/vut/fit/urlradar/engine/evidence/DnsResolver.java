package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.models.evidence.DnsEvidence;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Resolves host names and collects DNS records. Implementations must be safe to call concurrently.
 */
public interface DnsResolver {
    /**
     * Resolves the A and AAAA records of the host.
     *
     * @param hostname The host name.
     * @return The addresses, IPv4 first; never empty.
     * @throws CollaboratorException with {@code NOT_FOUND} for a non-existent name, or another code when the
     *                               resolution fails
     */
    @NotNull List<String> resolveAddresses(@NotNull String hostname) throws CollaboratorException;

    /**
     * Collects the A, AAAA, MX, NS, TXT, CAA and DMARC records of the host.
     *
     * @param hostname The host name.
     * @return The DNS evidence.
     * @throws CollaboratorException when the records cannot be collected
     */
    @NotNull DnsEvidence collect(@NotNull String hostname) throws CollaboratorException;
}
