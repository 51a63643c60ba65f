package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Registration data of the scanned domain.
 *
 * @param domainAgeDays    The age of the registration in days, if the creation date is known.
 * @param registrar        The registrar name, if known.
 * @param privacyProtected True if the registrant data is redacted or proxied.
 * @param createdAt        The registration date, if known.
 * @param expiresAt        The expiration date, if known.
 * @param nameServers      The delegated name servers.
 */
public record WhoisEvidence(@Nullable Integer domainAgeDays,
                            @Nullable String registrar,
                            boolean privacyProtected,
                            @Nullable Instant createdAt,
                            @Nullable Instant expiresAt,
                            @NotNull List<String> nameServers) {

    public WhoisEvidence {
        nameServers = List.copyOf(nameServers);
    }
}
