package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The TLS configuration and leaf certificate of the scanned host.
 *
 * @param valid           True if the chain validates against the platform trust store and the
 *                        certificate is within its validity period.
 * @param issuer          The issuer DN of the leaf certificate.
 * @param subject         The subject DN of the leaf certificate.
 * @param selfSigned      True if the leaf certificate is self-signed.
 * @param notBefore       Start of the validity period.
 * @param notAfter        End of the validity period.
 * @param protocol        The negotiated protocol (e.g. TLSv1.3).
 * @param cipherSuite     The negotiated cipher suite.
 * @param subjectAltNames The DNS names of the certificate.
 * @param hostnameMatches True if the certificate covers the scanned host name.
 */
public record TlsEvidence(boolean valid,
                          @Nullable String issuer,
                          @Nullable String subject,
                          boolean selfSigned,
                          @Nullable Instant notBefore,
                          @Nullable Instant notAfter,
                          @Nullable String protocol,
                          @Nullable String cipherSuite,
                          @NotNull List<String> subjectAltNames,
                          boolean hostnameMatches) {

    public TlsEvidence {
        subjectAltNames = List.copyOf(subjectAltNames);
    }

    /**
     * Returns the number of whole days until the certificate expires (negative when expired),
     * or null when the expiration is unknown.
     */
    public @Nullable Long daysUntilExpiry(@NotNull Instant now) {
        if (notAfter == null)
            return null;
        return Duration.between(now, notAfter).toDays();
    }

    /**
     * Computes the TLS score (0-100): 100, minus 50 for an invalid chain, minus 30 for a self-signed
     * certificate and minus 20 for a certificate expiring within 30 days.
     */
    public int score(@NotNull Instant now) {
        int score = 100;
        if (!valid) score -= 50;
        if (selfSigned) score -= 30;
        var days = daysUntilExpiry(now);
        if (days != null && days < 30) score -= 20;
        return Math.max(0, score);
    }

    /**
     * Returns true if the negotiated protocol is TLS 1.2 or newer.
     */
    public boolean modernProtocol() {
        return "TLSv1.3".equals(protocol) || "TLSv1.2".equals(protocol);
    }
}
