package cz.vut.fit.urlradar.engine.features;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.evidence.DomEvidence;
import cz.vut.fit.urlradar.models.evidence.EvidenceBundle;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.features.CausalSignals;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.features.LexicalFeatures;
import cz.vut.fit.urlradar.models.features.TabularFeatures;
import cz.vut.fit.urlradar.models.intel.TISummary;
import cz.vut.fit.urlradar.models.reachability.ReachabilityResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Derives the feature vector from the collected evidence and the threat-intel summary. The extraction is
 * deterministic and performs no I/O. Missing evidence is replaced with neutral values and recorded in
 * {@link FeatureVector#unavailableInputs()}.
 *
 * @author URLRadar developers
 */
public class FeatureExtractor {
    public static final String COMPONENT_NAME = "feature-extractor";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(FeatureExtractor.class);

    public static final int NEUTRAL_DOMAIN_AGE_DAYS = 365;
    public static final double NEUTRAL_SCORE = 50.0;
    public static final int MAX_PAGE_TEXT = 10_000;

    private final Clock _clock;

    public FeatureExtractor() {
        this(Clock.systemUTC());
    }

    public FeatureExtractor(@NotNull Clock clock) {
        _clock = clock;
    }

    /**
     * Extracts the features.
     *
     * @param url          The canonical URL.
     * @param reachability The reachability result.
     * @param evidence     The collected evidence.
     * @param intel        The threat-intel summary.
     * @return The feature vector.
     */
    public @NotNull FeatureVector extract(@NotNull String url, @NotNull ReachabilityResult reachability,
                                          @NotNull EvidenceBundle evidence, @NotNull TISummary intel) {
        final var uri = URI.create(url);
        final var host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        final var registrable = DomainNames.registrableDomain(host);
        final var tld = DomainNames.tld(host);

        final var unavailable = new ArrayList<String>();
        for (var kind : EvidenceKind.values()) {
            if (!evidence.has(kind))
                unavailable.add(kind.name().toLowerCase(Locale.ROOT));
        }
        if (!intel.unavailableSources().isEmpty())
            unavailable.add("intel");

        final var lexical = lexical(uri, host, registrable);
        final var tabular = tabular(reachability, evidence, intel, tld);
        final var causal = causal(reachability, evidence, intel, lexical, registrable, host);

        final var dom = evidence.dom();
        final var text = dom == null ? null : pageText(dom);
        final var screenshot = evidence.screenshot() == null ? null : evidence.screenshot().imageRef();

        Logger.trace("Features of {}: {} brand tokens, {} unavailable inputs, causal {}", url,
                lexical.brandTokens().size(), unavailable.size(), causal.active());

        return new FeatureVector(url, host, registrable, tld, reachability.status(), lexical, tabular, causal,
                FreeHostingProviders.match(host) != null, unavailable, text, screenshot);
    }

    private LexicalFeatures lexical(URI uri, String host, String registrable) {
        final var url = uri.toString();
        final var path = uri.getRawPath() == null ? "" : uri.getRawPath();
        final var query = uri.getRawQuery() == null ? "" : uri.getRawQuery();
        final var hostAndPath = (host + path).toLowerCase(Locale.ROOT);

        int digits = 0;
        int special = 0;
        for (int i = 0; i < url.length(); i++) {
            final char c = url.charAt(i);
            if (Character.isDigit(c)) digits++;
            else if (!Character.isLetter(c)) special++;
        }
        final double length = Math.max(1, url.length());

        final var subdomain = DomainNames.subdomainPart(host);
        final int depth = subdomain.isEmpty() ? 0 : subdomain.split("\\.").length;
        final int hyphens = (int) host.chars().filter(c -> c == '-').count();

        return new LexicalFeatures(url.length(), host.length(), path.length(), query.length(), depth, hyphens,
                digits / length, special / length,
                Common.shannonEntropy(host), Common.shannonEntropy(url), bigramDiversity(hostAndPath),
                DomainNames.isIpLiteral(host), host.contains("xn--"), Homoglyphs.contains(host),
                "https".equalsIgnoreCase(uri.getScheme()),
                UrlLexicon.brandsIn(hostAndPath), UrlLexicon.matches(UrlLexicon.ACTION_TOKENS, hostAndPath));
    }

    private TabularFeatures tabular(ReachabilityResult reachability, EvidenceBundle evidence, TISummary intel,
                                    String tld) {
        final var whois = evidence.whois();
        final int age = whois != null && whois.domainAgeDays() != null
                ? whois.domainAgeDays() : NEUTRAL_DOMAIN_AGE_DAYS;

        final var network = evidence.network();
        final double asnScore = network == null || network.asn() == null
                ? NEUTRAL_SCORE : (network.hosting() ? NEUTRAL_SCORE : 0.0);

        final double tlsScore = evidence.tls() == null ? NEUTRAL_SCORE : evidence.tls().score(_clock.instant());
        final double dnsScore = evidence.dns() == null ? NEUTRAL_SCORE : evidence.dns().healthScore();

        final var dom = evidence.dom();
        final int externalDomains = dom == null ? 0 : dom.externalDomains().size();
        final int forms = dom == null ? 0 : dom.forms().size();

        return new TabularFeatures(age, TldRisk.score(tld), asnScore, intel.totalHits(), intel.tier1Hits(),
                intel.tier2Hits(), tlsScore, dnsScore, externalDomains, forms, reachability.redirectCount());
    }

    private CausalSignals causal(ReachabilityResult reachability, EvidenceBundle evidence, TISummary intel,
                                 LexicalFeatures lexical, String registrable, String host) {
        final var dom = evidence.dom();
        final boolean formMismatch = dom != null && dom.formOriginMismatch();
        final boolean autoDownload = dom != null && dom.autoDownload();

        final var brands = new LinkedHashSet<>(lexical.brandTokens());
        if (dom != null && dom.title() != null && dom.logoImageCount() > 0)
            brands.addAll(UrlLexicon.brandsIn(dom.title()));
        final boolean divergence = !UrlLexicon.foreignBrands(List.copyOf(brands), registrable).isEmpty();

        return new CausalSignals(formMismatch, divergence, autoDownload, intel.tombstoned(),
                reachability.status() == ReachabilityStatus.SINKHOLE, intel.dualTier1(),
                redirectHomoglyph(reachability, evidence, host));
    }

    private static boolean redirectHomoglyph(ReachabilityResult reachability, EvidenceBundle evidence, String host) {
        final var chain = new ArrayList<>(reachability.redirectChain());
        if (evidence.http() != null)
            chain.addAll(evidence.http().redirectChain());

        final var seen = new HashSet<String>();
        seen.add(host);
        for (var hop : chain) {
            final var hopHost = DomainNames.hostOf(hop);
            if (hopHost == null || !seen.add(hopHost))
                continue;
            if (Homoglyphs.contains(hopHost))
                return true;
        }
        return false;
    }

    private static String pageText(@NotNull DomEvidence dom) {
        final var builder = new StringBuilder();
        if (dom.title() != null)
            builder.append(dom.title()).append('\n');
        builder.append(dom.text());
        return builder.length() > MAX_PAGE_TEXT ? builder.substring(0, MAX_PAGE_TEXT) : builder.toString();
    }

    /**
     * The ratio of distinct character bigrams to all bigrams of the text.
     */
    static double bigramDiversity(@Nullable String text) {
        if (text == null || text.length() < 2)
            return 0.0;

        final var bigrams = new HashSet<String>();
        final int total = text.length() - 1;
        for (int i = 0; i < total; i++) {
            bigrams.add(text.substring(i, i + 2));
        }
        return bigrams.size() / (double) total;
    }
}
