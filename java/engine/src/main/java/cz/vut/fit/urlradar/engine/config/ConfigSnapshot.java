package cz.vut.fit.urlradar.engine.config;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.engine.risk.BranchThresholds;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.features.CausalSignal;
import cz.vut.fit.urlradar.models.ml.PredictorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import static cz.vut.fit.urlradar.ScannerConfig.*;

/**
 * An immutable, validated view of the scanner configuration. All values are parsed and checked when the
 * snapshot is created; invalid configuration raises a {@link ConfigurationException} here and never
 * later during a scan.
 *
 * @author URLRadar developers
 */
public final class ConfigSnapshot {
    private static final double WEIGHT_EPSILON = 1e-6;

    private static final Map<CausalSignal, Double> DEFAULT_CAUSAL_WEIGHTS;
    private static final Map<ReachabilityStatus, Double> DEFAULT_BRANCH_CORRECTIONS;

    static {
        var causal = new EnumMap<CausalSignal, Double>(CausalSignal.class);
        causal.put(CausalSignal.FORM_ORIGIN_MISMATCH, 0.35);
        causal.put(CausalSignal.BRAND_INFRA_DIVERGENCE, 0.30);
        causal.put(CausalSignal.AUTO_DOWNLOAD, 0.45);
        causal.put(CausalSignal.TOMBSTONE, 1.0);
        causal.put(CausalSignal.SINKHOLE, 0.50);
        causal.put(CausalSignal.DUAL_TIER1, 1.0);
        causal.put(CausalSignal.REDIRECT_HOMOGLYPH, 0.40);
        DEFAULT_CAUSAL_WEIGHTS = Collections.unmodifiableMap(causal);

        var corrections = new EnumMap<ReachabilityStatus, Double>(ReachabilityStatus.class);
        corrections.put(ReachabilityStatus.ONLINE, 0.0);
        corrections.put(ReachabilityStatus.OFFLINE, -0.10);
        corrections.put(ReachabilityStatus.WAF, -0.05);
        corrections.put(ReachabilityStatus.PARKED, -0.15);
        corrections.put(ReachabilityStatus.SINKHOLE, 0.40);
        DEFAULT_BRANCH_CORRECTIONS = Collections.unmodifiableMap(corrections);
    }

    private final Map<String, String> _properties;

    private final Duration _scanDeadline;
    private final int _executorThreads;
    private final Duration _intelSourceTimeout;
    private final List<String> _tombstones;

    private final Duration _dnsTimeout;
    private final Duration _tcpTimeout;
    private final Duration _httpTimeout;
    private final int _maxRedirects;
    private final int _maxBodyBytes;
    private final List<String> _sinkholeIps;
    private final List<String> _sinkholeKeywords;
    private final List<String> _wafVendors;
    private final List<String> _wafChallenges;
    private final List<String> _parkedIndicators;

    private final Map<EvidenceKind, Duration> _evidenceTimeouts;

    private final StageSettings _stage1;
    private final StageSettings _stage2;
    private final double _earlyExitThreshold;
    private final PredictorKind _predictorKind;
    private final String _modelsEndpoint;
    private final String _modelsToken;
    private final Duration _modelsTimeout;

    private final FusionWeights _weightsWithStage2;
    private final FusionWeights _weightsWithoutStage2;
    private final Map<CausalSignal, Double> _causalWeights;
    private final Map<ReachabilityStatus, Double> _branchCorrections;
    private final int _establishedDomainDays;
    private final double _calibrationAlpha;
    private final String _calibrationDir;

    private final int _youngDomainDays;
    private final int _recencyWindowDays;
    private final double _highRiskTldScore;
    private final Map<String, Boolean> _policyRuleEnabled;
    private final Map<String, RiskLevel> _policyRuleLevels;

    private final Map<ReachabilityStatus, BranchThresholds> _thresholds;
    private final Map<String, Double> _categoryWeights;
    private final Map<String, Boolean> _categoryEnabled;
    private final Map<String, Boolean> _checkEnabled;

    private ConfigSnapshot(Properties properties) {
        final var copy = new TreeMap<String, String>();
        for (var name : properties.stringPropertyNames()) {
            copy.put(name, properties.getProperty(name).trim());
        }
        _properties = Collections.unmodifiableMap(copy);

        _scanDeadline = millis(SCAN_DEADLINE_MS_CONFIG, SCAN_DEADLINE_MS_DEFAULT);
        _executorThreads = positiveInt(SCAN_THREADS_CONFIG, SCAN_THREADS_DEFAULT);
        _intelSourceTimeout = millis(INTEL_SOURCE_TIMEOUT_MS_CONFIG, INTEL_SOURCE_TIMEOUT_MS_DEFAULT);
        _tombstones = List.copyOf(Common.splitList(value(INTEL_TOMBSTONES_CONFIG, INTEL_TOMBSTONES_DEFAULT)));

        _dnsTimeout = millis(REACH_DNS_TIMEOUT_MS_CONFIG, REACH_DNS_TIMEOUT_MS_DEFAULT);
        _tcpTimeout = millis(REACH_TCP_TIMEOUT_MS_CONFIG, REACH_TCP_TIMEOUT_MS_DEFAULT);
        _httpTimeout = millis(REACH_HTTP_TIMEOUT_MS_CONFIG, REACH_HTTP_TIMEOUT_MS_DEFAULT);
        _maxRedirects = nonNegativeInt(REACH_MAX_REDIRECTS_CONFIG, REACH_MAX_REDIRECTS_DEFAULT);
        _maxBodyBytes = positiveInt(REACH_MAX_BODY_BYTES_CONFIG, REACH_MAX_BODY_BYTES_DEFAULT);
        _sinkholeIps = lowerCaseList(REACH_SINKHOLE_IPS_CONFIG, REACH_SINKHOLE_IPS_DEFAULT);
        _sinkholeKeywords = lowerCaseList(REACH_SINKHOLE_KEYWORDS_CONFIG, REACH_SINKHOLE_KEYWORDS_DEFAULT);
        _wafVendors = lowerCaseList(REACH_WAF_VENDORS_CONFIG, REACH_WAF_VENDORS_DEFAULT);
        _wafChallenges = lowerCaseList(REACH_WAF_CHALLENGES_CONFIG, REACH_WAF_CHALLENGES_DEFAULT);
        _parkedIndicators = lowerCaseList(REACH_PARKED_INDICATORS_CONFIG, REACH_PARKED_INDICATORS_DEFAULT);

        final var timeouts = new EnumMap<EvidenceKind, Duration>(EvidenceKind.class);
        timeouts.put(EvidenceKind.WHOIS, millis(EVIDENCE_WHOIS_TIMEOUT_MS_CONFIG, EVIDENCE_WHOIS_TIMEOUT_MS_DEFAULT));
        timeouts.put(EvidenceKind.DNS, millis(EVIDENCE_DNS_TIMEOUT_MS_CONFIG, EVIDENCE_DNS_TIMEOUT_MS_DEFAULT));
        timeouts.put(EvidenceKind.TLS, millis(EVIDENCE_TLS_TIMEOUT_MS_CONFIG, EVIDENCE_TLS_TIMEOUT_MS_DEFAULT));
        timeouts.put(EvidenceKind.HTML, millis(EVIDENCE_HTML_TIMEOUT_MS_CONFIG, EVIDENCE_HTML_TIMEOUT_MS_DEFAULT));
        timeouts.put(EvidenceKind.SCREENSHOT,
                millis(EVIDENCE_SCREENSHOT_TIMEOUT_MS_CONFIG, EVIDENCE_SCREENSHOT_TIMEOUT_MS_DEFAULT));
        timeouts.put(EvidenceKind.NETWORK,
                millis(EVIDENCE_NETWORK_TIMEOUT_MS_CONFIG, EVIDENCE_NETWORK_TIMEOUT_MS_DEFAULT));
        _evidenceTimeouts = Collections.unmodifiableMap(timeouts);

        _stage1 = stage(STAGE1_MODELS_CONFIG, STAGE1_MODELS_DEFAULT, STAGE1_WEIGHTS_CONFIG, STAGE1_WEIGHTS_DEFAULT,
                STAGE1_BUDGET_MS_CONFIG, STAGE1_BUDGET_MS_DEFAULT);
        _stage2 = stage(STAGE2_MODELS_CONFIG, STAGE2_MODELS_DEFAULT, STAGE2_WEIGHTS_CONFIG, STAGE2_WEIGHTS_DEFAULT,
                STAGE2_BUDGET_MS_CONFIG, STAGE2_BUDGET_MS_DEFAULT);
        _earlyExitThreshold = unitDouble(STAGE1_EARLY_EXIT_CONFIG, STAGE1_EARLY_EXIT_DEFAULT);

        try {
            _predictorKind = PredictorKind.fromConfig(value(MODELS_MODE_CONFIG, MODELS_MODE_DEFAULT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        _modelsEndpoint = value(MODELS_ENDPOINT_CONFIG, MODELS_ENDPOINT_DEFAULT);
        _modelsToken = value(MODELS_TOKEN_CONFIG, MODELS_TOKEN_DEFAULT);
        _modelsTimeout = millis(MODELS_TIMEOUT_MS_CONFIG, MODELS_TIMEOUT_MS_DEFAULT);
        if (_predictorKind == PredictorKind.TRAINED && _modelsEndpoint.isBlank())
            throw new ConfigurationException("The '" + PredictorKind.TRAINED.configName()
                    + "' predictor variant requires " + MODELS_ENDPOINT_CONFIG);

        final var full = weights(COMBINER_WEIGHTS_FULL_CONFIG, COMBINER_WEIGHTS_FULL_DEFAULT, 3);
        _weightsWithStage2 = new FusionWeights(full.get(0), full.get(1), full.get(2));
        final var fast = weights(COMBINER_WEIGHTS_FAST_CONFIG, COMBINER_WEIGHTS_FAST_DEFAULT, 2);
        _weightsWithoutStage2 = new FusionWeights(fast.get(0), 0.0, fast.get(1));

        final var causal = new EnumMap<CausalSignal, Double>(CausalSignal.class);
        for (var signal : CausalSignal.values()) {
            causal.put(signal, unitDouble(COMBINER_CAUSAL_WEIGHT_PREFIX + signal.key(),
                    String.valueOf(DEFAULT_CAUSAL_WEIGHTS.get(signal))));
        }
        _causalWeights = Collections.unmodifiableMap(causal);

        final var corrections = new EnumMap<ReachabilityStatus, Double>(ReachabilityStatus.class);
        for (var branch : ReachabilityStatus.values()) {
            var key = COMBINER_BRANCH_CORRECTION_PREFIX + branchKey(branch);
            var correction = doubleValue(key, String.valueOf(DEFAULT_BRANCH_CORRECTIONS.get(branch)));
            if (correction < -1.0 || correction > 1.0)
                throw new ConfigurationException(key + " must be within [-1, 1]: " + correction);
            corrections.put(branch, correction);
        }
        _branchCorrections = Collections.unmodifiableMap(corrections);
        _establishedDomainDays = nonNegativeInt(COMBINER_ESTABLISHED_DAYS_CONFIG, COMBINER_ESTABLISHED_DAYS_DEFAULT);

        _calibrationAlpha = doubleValue(CALIBRATION_ALPHA_CONFIG, CALIBRATION_ALPHA_DEFAULT);
        if (_calibrationAlpha <= 0.0 || _calibrationAlpha >= 1.0)
            throw new ConfigurationException(CALIBRATION_ALPHA_CONFIG + " must be within (0, 1): " + _calibrationAlpha);
        _calibrationDir = value(CALIBRATION_DIR_CONFIG, CALIBRATION_DIR_DEFAULT);

        _youngDomainDays = nonNegativeInt(POLICY_YOUNG_DOMAIN_DAYS_CONFIG, POLICY_YOUNG_DOMAIN_DAYS_DEFAULT);
        _recencyWindowDays = nonNegativeInt(POLICY_RECENCY_WINDOW_DAYS_CONFIG, POLICY_RECENCY_WINDOW_DAYS_DEFAULT);
        _highRiskTldScore = doubleValue(POLICY_HIGH_RISK_TLD_SCORE_CONFIG, POLICY_HIGH_RISK_TLD_SCORE_DEFAULT);

        final var ruleEnabled = new HashMap<String, Boolean>();
        final var ruleLevels = new HashMap<String, RiskLevel>();
        for (var entry : _properties.entrySet()) {
            var key = entry.getKey();
            if (!key.startsWith(POLICY_RULE_PREFIX))
                continue;

            if (key.endsWith(POLICY_RULE_ENABLED_SUFFIX)) {
                ruleEnabled.put(itemId(key, POLICY_RULE_PREFIX, POLICY_RULE_ENABLED_SUFFIX), bool(key, "true"));
            } else if (key.endsWith(POLICY_RULE_LEVEL_SUFFIX)) {
                ruleLevels.put(itemId(key, POLICY_RULE_PREFIX, POLICY_RULE_LEVEL_SUFFIX),
                        riskLevel(key, entry.getValue()));
            }
        }
        _policyRuleEnabled = Collections.unmodifiableMap(ruleEnabled);
        _policyRuleLevels = Collections.unmodifiableMap(ruleLevels);

        final var thresholds = new EnumMap<ReachabilityStatus, BranchThresholds>(ReachabilityStatus.class);
        for (var branch : ReachabilityStatus.values()) {
            var key = RISK_THRESHOLDS_PREFIX + branchKey(branch);
            var raw = _properties.get(key);
            if (raw == null) {
                thresholds.put(branch, BranchThresholds.defaults(branch));
                continue;
            }
            try {
                thresholds.put(branch, BranchThresholds.parse(raw));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid " + key + ": " + e.getMessage(), e);
            }
        }
        _thresholds = Collections.unmodifiableMap(thresholds);

        final var categoryWeights = new HashMap<String, Double>();
        final var categoryEnabled = new HashMap<String, Boolean>();
        final var checkEnabled = new HashMap<String, Boolean>();
        for (var key : _properties.keySet()) {
            if (key.startsWith(CATEGORY_PREFIX) && key.endsWith(CATEGORY_WEIGHT_SUFFIX)) {
                var weight = doubleValue(key, "1");
                if (weight < 0.0)
                    throw new ConfigurationException(key + " must not be negative: " + weight);
                categoryWeights.put(itemId(key, CATEGORY_PREFIX, CATEGORY_WEIGHT_SUFFIX), weight);
            } else if (key.startsWith(CATEGORY_PREFIX) && key.endsWith(CATEGORY_ENABLED_SUFFIX)) {
                categoryEnabled.put(itemId(key, CATEGORY_PREFIX, CATEGORY_ENABLED_SUFFIX), bool(key, "true"));
            } else if (key.startsWith(CHECK_PREFIX) && key.endsWith(CHECK_ENABLED_SUFFIX)) {
                checkEnabled.put(itemId(key, CHECK_PREFIX, CHECK_ENABLED_SUFFIX), bool(key, "true"));
            }
        }
        _categoryWeights = Collections.unmodifiableMap(categoryWeights);
        _categoryEnabled = Collections.unmodifiableMap(categoryEnabled);
        _checkEnabled = Collections.unmodifiableMap(checkEnabled);
    }

    /**
     * Creates a snapshot of the built-in defaults.
     */
    public static ConfigSnapshot defaults() {
        return new ConfigSnapshot(new Properties());
    }

    /**
     * Creates a snapshot from the given properties; missing keys take their default values.
     *
     * @throws ConfigurationException if a value is invalid
     */
    public static ConfigSnapshot fromProperties(@NotNull Properties properties) {
        return new ConfigSnapshot(properties);
    }

    /**
     * Returns a copy of the properties this snapshot was created from.
     */
    public Properties toProperties() {
        final var properties = new Properties();
        properties.putAll(_properties);
        return properties;
    }

    /**
     * Returns a raw property value. Used by the collaborator adapters for their own keys.
     */
    public @NotNull String property(@NotNull String key, @NotNull String defaultValue) {
        return value(key, defaultValue);
    }

    // General

    public Duration scanDeadline() {
        return _scanDeadline;
    }

    public int executorThreads() {
        return _executorThreads;
    }

    public Duration intelSourceTimeout() {
        return _intelSourceTimeout;
    }

    public List<String> tombstones() {
        return _tombstones;
    }

    // Reachability

    public Duration dnsTimeout() {
        return _dnsTimeout;
    }

    public Duration tcpTimeout() {
        return _tcpTimeout;
    }

    public Duration httpTimeout() {
        return _httpTimeout;
    }

    public int maxRedirects() {
        return _maxRedirects;
    }

    public int maxBodyBytes() {
        return _maxBodyBytes;
    }

    public List<String> sinkholeIps() {
        return _sinkholeIps;
    }

    public List<String> sinkholeKeywords() {
        return _sinkholeKeywords;
    }

    public List<String> wafVendors() {
        return _wafVendors;
    }

    public List<String> wafChallenges() {
        return _wafChallenges;
    }

    public List<String> parkedIndicators() {
        return _parkedIndicators;
    }

    // Evidence

    public Duration evidenceTimeout(@NotNull EvidenceKind kind) {
        return _evidenceTimeouts.get(kind);
    }

    // Models

    public StageSettings stage1() {
        return _stage1;
    }

    public StageSettings stage2() {
        return _stage2;
    }

    public double earlyExitThreshold() {
        return _earlyExitThreshold;
    }

    public PredictorKind predictorKind() {
        return _predictorKind;
    }

    public String modelsEndpoint() {
        return _modelsEndpoint;
    }

    public String modelsToken() {
        return _modelsToken;
    }

    public Duration modelsTimeout() {
        return _modelsTimeout;
    }

    // Combiner and calibration

    public FusionWeights fusionWeights(boolean stage2Present) {
        return stage2Present ? _weightsWithStage2 : _weightsWithoutStage2;
    }

    public double causalWeight(@NotNull CausalSignal signal) {
        return _causalWeights.get(signal);
    }

    public double branchCorrection(@NotNull ReachabilityStatus branch) {
        return _branchCorrections.get(branch);
    }

    public int establishedDomainDays() {
        return _establishedDomainDays;
    }

    public double calibrationAlpha() {
        return _calibrationAlpha;
    }

    public String calibrationDir() {
        return _calibrationDir;
    }

    // Policy

    public int youngDomainDays() {
        return _youngDomainDays;
    }

    public int recencyWindowDays() {
        return _recencyWindowDays;
    }

    public double highRiskTldScore() {
        return _highRiskTldScore;
    }

    /**
     * Returns whether the policy rule is enabled. Rules are enabled unless configured otherwise.
     */
    public boolean policyRuleEnabled(@NotNull String ruleId) {
        return _policyRuleEnabled.getOrDefault(ruleId.toLowerCase(Locale.ROOT), true);
    }

    /**
     * Returns the configured override level of the policy rule, or the rule's own default.
     */
    public RiskLevel policyRuleLevel(@NotNull String ruleId, @NotNull RiskLevel defaultLevel) {
        return _policyRuleLevels.getOrDefault(ruleId.toLowerCase(Locale.ROOT), defaultLevel);
    }

    // Risk bands and categories

    public BranchThresholds thresholds(@NotNull ReachabilityStatus branch) {
        return _thresholds.get(branch);
    }

    public double categoryWeight(@NotNull String categoryId) {
        return _categoryWeights.getOrDefault(categoryId, 1.0);
    }

    public boolean categoryEnabled(@NotNull String categoryId) {
        return _categoryEnabled.getOrDefault(categoryId, true);
    }

    public boolean checkEnabled(@NotNull String checkId) {
        return _checkEnabled.getOrDefault(checkId, true);
    }

    // Parsing helpers

    private String value(String key, String defaultValue) {
        final var value = _properties.get(key);
        return value == null ? defaultValue : value;
    }

    private Duration millis(String key, String defaultValue) {
        final long ms = longValue(key, defaultValue);
        if (ms <= 0)
            throw new ConfigurationException(key + " must be positive: " + ms);
        return Duration.ofMillis(ms);
    }

    private long longValue(String key, String defaultValue) {
        final var raw = value(key, defaultValue);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer value of " + key + ": " + raw, e);
        }
    }

    private int positiveInt(String key, String defaultValue) {
        final int value = nonNegativeInt(key, defaultValue);
        if (value == 0)
            throw new ConfigurationException(key + " must be positive");
        return value;
    }

    private int nonNegativeInt(String key, String defaultValue) {
        final long value = longValue(key, defaultValue);
        if (value < 0 || value > Integer.MAX_VALUE)
            throw new ConfigurationException(key + " is out of range: " + value);
        return (int) value;
    }

    private double doubleValue(String key, String defaultValue) {
        final var raw = value(key, defaultValue);
        try {
            final double value = Double.parseDouble(raw);
            if (Double.isNaN(value) || Double.isInfinite(value))
                throw new ConfigurationException("Invalid numeric value of " + key + ": " + raw);
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid numeric value of " + key + ": " + raw, e);
        }
    }

    private double unitDouble(String key, String defaultValue) {
        final double value = doubleValue(key, defaultValue);
        if (value < 0.0 || value > 1.0)
            throw new ConfigurationException(key + " must be within [0, 1]: " + value);
        return value;
    }

    private boolean bool(String key, String defaultValue) {
        final var raw = value(key, defaultValue).toLowerCase(Locale.ROOT);
        if (raw.equals("true"))
            return true;
        if (raw.equals("false"))
            return false;
        throw new ConfigurationException("Invalid boolean value of " + key + ": " + raw);
    }

    private List<String> lowerCaseList(String key, String defaultValue) {
        return Common.splitList(value(key, defaultValue)).stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    private List<Double> weights(String key, String defaultValue, int expectedCount) {
        final var parts = Common.splitList(value(key, defaultValue));
        if (expectedCount > 0 && parts.size() != expectedCount)
            throw new ConfigurationException(key + " must contain " + expectedCount + " weights, got " + parts.size());

        final var result = new ArrayList<Double>(parts.size());
        double sum = 0.0;
        for (var part : parts) {
            final double weight;
            try {
                weight = Double.parseDouble(part);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid weight in " + key + ": " + part, e);
            }
            if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0)
                throw new ConfigurationException("Weights in " + key + " must be within [0, 1]: " + part);
            result.add(weight);
            sum += weight;
        }

        if (Math.abs(sum - 1.0) > WEIGHT_EPSILON)
            throw new ConfigurationException("Weights in " + key + " must sum to 1, got " + sum);
        return result;
    }

    private StageSettings stage(String modelsKey, String modelsDefault, String weightsKey, String weightsDefault,
                                String budgetKey, String budgetDefault) {
        final var models = Common.splitList(value(modelsKey, modelsDefault));
        if (models.isEmpty())
            throw new ConfigurationException(modelsKey + " must name at least one model");

        final var weights = weights(weightsKey, weightsDefault, models.size());
        return new StageSettings(models, weights, millis(budgetKey, budgetDefault));
    }

    private static RiskLevel riskLevel(String key, @Nullable String value) {
        try {
            return RiskLevel.valueOf(value == null ? "" : value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid risk level of " + key + ": " + value, e);
        }
    }

    private static String itemId(String key, String prefix, String suffix) {
        return key.substring(prefix.length(), key.length() - suffix.length()).toLowerCase(Locale.ROOT);
    }

    private static String branchKey(ReachabilityStatus branch) {
        return branch.name().toLowerCase(Locale.ROOT);
    }
}
