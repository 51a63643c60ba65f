package cz.vut.fit.urlradar.engine.ml;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.features.PersuasionTactics;
import cz.vut.fit.urlradar.engine.features.TldRisk;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.features.FeatureVector;
import cz.vut.fit.urlradar.models.ml.ModelExplanation;
import cz.vut.fit.urlradar.models.ml.ModelPrediction;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Rule-based stand-ins for the trained models. Each model sums the contributions of the rules that fire,
 * starting from a small floor. The confidence grows with the distance of the probability from 0.5 and
 * drops for every input of the model that was unavailable.
 *
 * @author URLRadar developers
 */
public class HeuristicModelPredictor implements ModelPredictor {
    public static final String COMPONENT_NAME = "heuristic-models";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(HeuristicModelPredictor.class);

    public static final String LEXICAL_A = "lexical-a";
    public static final String LEXICAL_B = "lexical-b";
    public static final String TABULAR = "tabular";
    public static final String TEXT_PERSUASION = "text-persuasion";
    public static final String SCREENSHOT = "screenshot";

    static final double FLOOR = 0.02;
    static final double MISSING_INPUT_PENALTY = 0.05;
    static final double STAGE2_CONFIDENCE_CAP = 0.6;

    private static final List<String> TABULAR_INPUTS = List.of("whois", "dns", "tls", "network", "intel");
    private static final List<String> TEXT_INPUTS = List.of("html");

    /**
     * Accumulates the contributions of the fired rules.
     */
    private static final class Score {
        private final Map<String, Double> _contributions = new LinkedHashMap<>();
        private double _total = FLOOR;

        void add(String feature, double contribution) {
            _contributions.merge(feature, contribution, Double::sum);
            _total += contribution;
        }

        double probability(double cap) {
            return Math.min(cap, Common.clamp01(_total));
        }

        Map<String, Double> contributions() {
            return _contributions;
        }
    }

    @Override
    public @NotNull PredictorKind kind() {
        return PredictorKind.HEURISTIC_FALLBACK;
    }

    @Override
    public @NotNull CompletableFuture<ModelPrediction> predict(@NotNull String modelId,
                                                               @NotNull FeatureVector features) {
        final ModelPrediction prediction;
        switch (modelId) {
            case LEXICAL_A -> prediction = lexicalA(features);
            case LEXICAL_B -> prediction = lexicalB(features);
            case TABULAR -> prediction = tabular(features);
            case TEXT_PERSUASION -> prediction = textPersuasion(features);
            case SCREENSHOT -> prediction = screenshot(features);
            default -> {
                return CompletableFuture.failedFuture(new CollaboratorException(ResultCodes.NOT_FOUND,
                        "Unknown heuristic model " + modelId));
            }
        }
        Logger.trace("{} on {}: p={} c={}", modelId, features.url(), prediction.probability(),
                prediction.confidence());
        return CompletableFuture.completedFuture(prediction);
    }

    /**
     * URL token patterns: brand and action tokens, risky TLDs, look-alike characters.
     */
    private ModelPrediction lexicalA(FeatureVector features) {
        final var lexical = features.lexical();
        final var score = new Score();

        final boolean foreignBrand = !UrlLexicon.foreignBrands(lexical.brandTokens(), features.registrableDomain())
                .isEmpty();
        final int actions = lexical.actionTokens().size();
        if (foreignBrand && actions > 0)
            score.add("brand_action", 0.40);
        else if (actions > 1)
            score.add("action_tokens", 0.25);
        else if (foreignBrand)
            score.add("brand_token", 0.15);

        if (features.tabular().tldRiskScore() >= TldRisk.HIGH)
            score.add("tld", 0.20);
        if (lexical.urlLength() > 100)
            score.add("url_length", 0.15);
        if (lexical.homoglyphs())
            score.add("homoglyphs", 0.20);
        else if (lexical.punycode())
            score.add("punycode", 0.10);
        if (lexical.ipLiteralHost())
            score.add("ip_host", 0.25);
        if (lexical.subdomainDepth() >= 3)
            score.add("subdomain_depth", 0.10);
        if (features.freeHosting())
            score.add("free_hosting", 0.10);

        return prediction(LEXICAL_A, score, 0.95, features, List.of(), List.of(), 1.0);
    }

    /**
     * Character statistics of the host and the URL.
     */
    private ModelPrediction lexicalB(FeatureVector features) {
        final var lexical = features.lexical();
        final var score = new Score();

        if (lexical.hostEntropy() > 4.0)
            score.add("host_entropy", 0.20);
        if (lexical.urlEntropy() > 5.0)
            score.add("url_entropy", 0.10);
        if (lexical.digitRatio() > 0.15)
            score.add("digit_ratio", 0.20);
        if (lexical.specialCharRatio() > 0.35)
            score.add("special_ratio", 0.10);
        if (lexical.hyphenCount() >= 3)
            score.add("hyphens", 0.15);
        if (lexical.hostLength() > 40)
            score.add("host_length", 0.10);
        if (!lexical.httpsScheme())
            score.add("plain_http", 0.10);

        return prediction(LEXICAL_B, score, 0.95, features, List.of(), List.of(), 1.0);
    }

    /**
     * Registration, reputation and infrastructure features.
     */
    private ModelPrediction tabular(FeatureVector features) {
        final var tabular = features.tabular();
        final var score = new Score();

        if (tabular.domainAgeDays() < 7)
            score.add("domain_age", 0.40);
        else if (tabular.domainAgeDays() < 30)
            score.add("domain_age", 0.25);
        else if (tabular.domainAgeDays() < 90)
            score.add("domain_age", 0.10);

        score.add("tld_risk", tabular.tldRiskScore() * 0.0015);
        if (tabular.tiTotalHits() > 0)
            score.add("ti_hits", tabular.tiTotalHits() * 0.10);
        if (tabular.tiTier1Hits() >= 2)
            score.add("ti_tier1", 0.50);
        if (tabular.tlsScore() < 50)
            score.add("tls_score", 0.20);
        if (tabular.dnsHealthScore() < 50)
            score.add("dns_health", 0.15);
        if (tabular.externalDomainCount() > 20)
            score.add("external_domains", 0.10);
        if (tabular.redirectCount() > 2)
            score.add("redirects", 0.10);

        return prediction(TABULAR, score, 1.0, features, TABULAR_INPUTS, List.of(), 1.0);
    }

    /**
     * Persuasion tactics and credential requests in the page text.
     */
    private ModelPrediction textPersuasion(FeatureVector features) {
        final var text = features.pageText();
        if (text == null || text.isBlank())
            return ModelPrediction.failed(TEXT_PERSUASION, kind(), "No page text", 0L);

        final var lower = text.toLowerCase(Locale.ROOT);
        final var tactics = PersuasionTactics.in(lower);
        final var score = new Score();
        if (!tactics.isEmpty())
            score.add("tactics", tactics.size() * 0.15);

        final long credentials = PersuasionTactics.CREDENTIAL_KEYWORDS.stream().filter(lower::contains).count();
        if (credentials > 0)
            score.add("credential_keywords", credentials * 0.10);

        final long letters = text.chars().filter(Character::isLetter).count();
        final long upper = text.chars().filter(Character::isUpperCase).count();
        if (letters > 0 && upper / (double) letters > 0.3)
            score.add("capitals", 0.15);

        return prediction(TEXT_PERSUASION, score, 1.0, features, TEXT_INPUTS, tactics, STAGE2_CONFIDENCE_CAP);
    }

    /**
     * Page layout signals standing in for a visual model: a credential form under a foreign brand.
     */
    private ModelPrediction screenshot(FeatureVector features) {
        if (features.screenshotRef() == null)
            return ModelPrediction.failed(SCREENSHOT, kind(), "No screenshot", 0L);

        final var score = new Score();
        final boolean form = features.tabular().formCount() > 0;
        if (form && features.causal().brandInfraDivergence())
            score.add("brand_login_layout", 0.65);
        else if (form)
            score.add("login_layout", 0.25);
        if (features.causal().autoDownload())
            score.add("download_prompt", 0.20);

        return prediction(SCREENSHOT, score, 1.0, features, List.of("screenshot"), List.of(), STAGE2_CONFIDENCE_CAP);
    }

    /**
     * The confidence of a heuristic probability.
     */
    static double confidence(double probability, int missingInputs, double cap) {
        final double raw = Math.abs(probability - 0.5) * 2.0 - missingInputs * MISSING_INPUT_PENALTY;
        return Math.min(cap, Common.clamp01(raw));
    }

    private ModelPrediction prediction(String modelId, Score score, double probabilityCap, FeatureVector features,
                                       List<String> inputs, List<String> tactics, double confidenceCap) {
        final double probability = score.probability(probabilityCap);
        final int missing = (int) inputs.stream().filter(features::unavailable).count();
        return new ModelPrediction(modelId, kind(), probability, confidence(probability, missing, confidenceCap),
                new ModelExplanation(score.contributions(), tactics), 0L, null);
    }
}
