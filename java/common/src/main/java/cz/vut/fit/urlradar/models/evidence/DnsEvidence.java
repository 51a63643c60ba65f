package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * DNS records of the scanned host and the health derived from them.
 *
 * @param a            The A records.
 * @param aaaa         The AAAA records.
 * @param mx           The MX records.
 * @param ns           The NS records.
 * @param txt          The TXT records of the host.
 * @param caa          The CAA records.
 * @param spfPresent   True if a TXT record starts with {@code v=spf1}.
 * @param dmarcPresent True if a {@code _dmarc} TXT record starts with {@code v=DMARC1}.
 * @param dmarcPolicy  The {@code p=} tag of the DMARC record, if present.
 * @param healthScore  The DNS health score (0-100).
 */
public record DnsEvidence(@NotNull List<String> a,
                          @NotNull List<String> aaaa,
                          @NotNull List<String> mx,
                          @NotNull List<String> ns,
                          @NotNull List<String> txt,
                          @NotNull List<String> caa,
                          boolean spfPresent,
                          boolean dmarcPresent,
                          @Nullable String dmarcPolicy,
                          int healthScore) {

    public DnsEvidence {
        a = List.copyOf(a);
        aaaa = List.copyOf(aaaa);
        mx = List.copyOf(mx);
        ns = List.copyOf(ns);
        txt = List.copyOf(txt);
        caa = List.copyOf(caa);
    }

    /**
     * Builds the evidence from raw record sets, deriving SPF/DMARC presence and the health score.
     * The score starts at 100; missing address records cost 40 points, a missing MX, SPF or DMARC
     * record costs 20 points each.
     */
    public static DnsEvidence of(@NotNull List<String> a, @NotNull List<String> aaaa,
                                 @NotNull List<String> mx, @NotNull List<String> ns,
                                 @NotNull List<String> txt, @NotNull List<String> caa,
                                 @NotNull List<String> dmarcTxt) {
        final boolean spf = txt.stream()
                .anyMatch(t -> stripQuotes(t).toLowerCase(Locale.ROOT).startsWith("v=spf1"));

        String policy = null;
        boolean dmarc = false;
        for (var record : dmarcTxt) {
            var value = stripQuotes(record);
            if (value.toLowerCase(Locale.ROOT).startsWith("v=dmarc1")) {
                dmarc = true;
                policy = extractTag(value, "p");
                break;
            }
        }

        int score = 100;
        if (a.isEmpty() && aaaa.isEmpty()) score -= 40;
        if (mx.isEmpty()) score -= 20;
        if (!spf) score -= 20;
        if (!dmarc) score -= 20;

        return new DnsEvidence(a, aaaa, mx, ns, txt, caa, spf, dmarc, policy, Math.max(0, score));
    }

    private static String stripQuotes(String value) {
        var trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\""))
            return trimmed.substring(1, trimmed.length() - 1);
        return trimmed;
    }

    private static String extractTag(String record, String tag) {
        for (var part : record.split(";")) {
            var kv = part.trim().split("=", 2);
            if (kv.length == 2 && kv[0].trim().equalsIgnoreCase(tag))
                return kv[1].trim().toLowerCase(Locale.ROOT);
        }
        return null;
    }
}
