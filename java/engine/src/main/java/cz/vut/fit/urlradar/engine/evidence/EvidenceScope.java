package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The evidence kinds each reachability branch collects.
 *
 * @author URLRadar developers
 */
public final class EvidenceScope {
    private EvidenceScope() {
    }

    public static @NotNull Set<EvidenceKind> kindsFor(@NotNull ReachabilityStatus branch) {
        final var kinds = switch (branch) {
            case ONLINE -> EnumSet.allOf(EvidenceKind.class);
            case OFFLINE, SINKHOLE, WAF -> EnumSet.of(EvidenceKind.WHOIS, EvidenceKind.DNS);
            case PARKED -> EnumSet.of(EvidenceKind.WHOIS, EvidenceKind.HTML);
        };
        return Collections.unmodifiableSet(kinds);
    }

    public static boolean includes(@NotNull ReachabilityStatus branch, @NotNull EvidenceKind kind) {
        return kindsFor(branch).contains(kind);
    }

    /**
     * Parked pages only get the template check, not the full DOM analysis.
     */
    public static boolean lightweightHtml(@NotNull ReachabilityStatus branch) {
        return branch == ReachabilityStatus.PARKED;
    }
}
