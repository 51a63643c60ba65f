package cz.vut.fit.urlradar.models.evidence;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * All evidence collected for a scan. Every sub-record may be null; a null sub-record means the evidence
 * was not collected (out of the branch's scope) or its collection failed, and the reason is recorded
 * in {@link #unavailable()}. A present sub-record with negative content is a real finding.
 *
 * @param branch      The reachability branch that scoped the collection.
 * @param whois       Registration data.
 * @param dns         DNS records.
 * @param tls         TLS data.
 * @param dom         Parsed HTML.
 * @param http        HTTP response metadata of the rendered page.
 * @param network     Network ownership data.
 * @param screenshot  Screenshot reference.
 * @param unavailable Reasons for the missing evidence kinds.
 */
public record EvidenceBundle(@NotNull ReachabilityStatus branch,
                             @Nullable WhoisEvidence whois,
                             @Nullable DnsEvidence dns,
                             @Nullable TlsEvidence tls,
                             @Nullable DomEvidence dom,
                             @Nullable HttpEvidence http,
                             @Nullable NetworkEvidence network,
                             @Nullable ScreenshotEvidence screenshot,
                             @NotNull Map<EvidenceKind, String> unavailable) {

    public EvidenceBundle {
        unavailable = Map.copyOf(unavailable);
    }

    /**
     * Creates a bundle with no evidence at all.
     */
    public static EvidenceBundle empty(@NotNull ReachabilityStatus branch, @NotNull Map<EvidenceKind, String> reasons) {
        return new EvidenceBundle(branch, null, null, null, null, null, null, null, reasons);
    }

    /**
     * Returns true if evidence of the given kind is present.
     */
    public boolean has(@NotNull EvidenceKind kind) {
        return switch (kind) {
            case WHOIS -> whois != null;
            case DNS -> dns != null;
            case TLS -> tls != null;
            case HTML -> dom != null;
            case SCREENSHOT -> screenshot != null;
            case NETWORK -> network != null;
        };
    }

    /**
     * Returns the recorded reason why the evidence of the given kind is missing.
     */
    public @Nullable String unavailableReason(@NotNull EvidenceKind kind) {
        return unavailable.get(kind);
    }
}
