package cz.vut.fit.urlradar;

/**
 * The configuration keys, descriptions and default values for the scan engine and its collaborators.
 * <p>
 * Keys with a {@code <branch>}, {@code <rule>}, {@code <category>}, {@code <check>} or {@code <signal>}
 * placeholder are prefixes; the placeholder is replaced with the lower-case identifier of the item.
 *
 * @author URLRadar developers
 */
@SuppressWarnings("ALL")
public class ScannerConfig {
    /* --- General --- */
    public static final String SCAN_DEADLINE_MS_CONFIG = "scan.deadline.ms";
    public static final String SCAN_DEADLINE_MS_DOC = "The overall per-scan deadline (milliseconds).";
    public static final String SCAN_DEADLINE_MS_DEFAULT = "15000";

    public static final String SCAN_THREADS_CONFIG = "scan.executor.threads";
    public static final String SCAN_THREADS_DOC = "The number of worker threads shared by the sub-tasks of all scans.";
    public static final String SCAN_THREADS_DEFAULT = "32";

    /* --- Threat intelligence --- */
    public static final String INTEL_SOURCE_TIMEOUT_MS_CONFIG = "intel.source.timeout.ms";
    public static final String INTEL_SOURCE_TIMEOUT_MS_DOC = "The time budget of a single threat-intel source query (milliseconds).";
    public static final String INTEL_SOURCE_TIMEOUT_MS_DEFAULT = "2000";

    public static final String INTEL_TOMBSTONES_CONFIG = "intel.tombstones";
    public static final String INTEL_TOMBSTONES_DOC = "Comma-separated URLs or host names previously confirmed malicious and taken down.";
    public static final String INTEL_TOMBSTONES_DEFAULT = "";

    /* --- Reachability --- */
    public static final String REACH_DNS_TIMEOUT_MS_CONFIG = "reachability.dns.timeout.ms";
    public static final String REACH_DNS_TIMEOUT_MS_DOC = "The DNS resolution stage timeout (milliseconds).";
    public static final String REACH_DNS_TIMEOUT_MS_DEFAULT = "1500";

    public static final String REACH_TCP_TIMEOUT_MS_CONFIG = "reachability.tcp.timeout.ms";
    public static final String REACH_TCP_TIMEOUT_MS_DOC = "The TCP connect stage timeout (milliseconds).";
    public static final String REACH_TCP_TIMEOUT_MS_DEFAULT = "2500";

    public static final String REACH_HTTP_TIMEOUT_MS_CONFIG = "reachability.http.timeout.ms";
    public static final String REACH_HTTP_TIMEOUT_MS_DOC = "The HTTP probe stage timeout (milliseconds), covering all redirects.";
    public static final String REACH_HTTP_TIMEOUT_MS_DEFAULT = "5000";

    public static final String REACH_MAX_REDIRECTS_CONFIG = "reachability.max.redirects";
    public static final String REACH_MAX_REDIRECTS_DOC = "The maximum number of HTTP redirects to follow.";
    public static final String REACH_MAX_REDIRECTS_DEFAULT = "10";

    public static final String REACH_MAX_BODY_BYTES_CONFIG = "reachability.max.body.bytes";
    public static final String REACH_MAX_BODY_BYTES_DOC = "The maximum number of body bytes inspected by the HTTP probe.";
    public static final String REACH_MAX_BODY_BYTES_DEFAULT = "102400";

    public static final String REACH_SINKHOLE_IPS_CONFIG = "reachability.sinkhole.ips";
    public static final String REACH_SINKHOLE_IPS_DOC = "Comma-separated IP addresses of known sinkholes.";
    public static final String REACH_SINKHOLE_IPS_DEFAULT =
            "0.0.0.0,127.0.0.1,127.0.0.2,127.0.0.3,146.112.61.106,149.112.112.112";

    public static final String REACH_SINKHOLE_KEYWORDS_CONFIG = "reachability.sinkhole.keywords";
    public static final String REACH_SINKHOLE_KEYWORDS_DOC = "Comma-separated takedown indicators matched in the final host, redirect chain and body.";
    public static final String REACH_SINKHOLE_KEYWORDS_DEFAULT =
            "sinkhole,blackhole,abuse.ch,this domain has been seized,domain has been suspended";

    public static final String REACH_WAF_VENDORS_CONFIG = "reachability.waf.vendors";
    public static final String REACH_WAF_VENDORS_DOC = "Comma-separated WAF vendor markers matched in the response headers.";
    public static final String REACH_WAF_VENDORS_DEFAULT =
            "cloudflare,akamai,incapsula,sucuri,barracuda,f5,imperva,fortiweb";

    public static final String REACH_WAF_CHALLENGES_CONFIG = "reachability.waf.challenges";
    public static final String REACH_WAF_CHALLENGES_DOC = "Comma-separated bot-challenge markers matched in the response body.";
    public static final String REACH_WAF_CHALLENGES_DEFAULT =
            "captcha,checking your browser,attention required,access denied,ray id,ddos protection by";

    public static final String REACH_PARKED_INDICATORS_CONFIG = "reachability.parked.indicators";
    public static final String REACH_PARKED_INDICATORS_DOC = "Comma-separated parking-page phrases matched in the response body.";
    public static final String REACH_PARKED_INDICATORS_DEFAULT =
            "this domain is parked,domain for sale,buy this domain,sedo.com,godaddy.com/domainfind,"
                    + "underconstruction,coming soon,this domain may be for sale,parkingcrew,bodis.com";

    /* --- Evidence collection --- */
    public static final String EVIDENCE_WHOIS_TIMEOUT_MS_CONFIG = "evidence.whois.timeout.ms";
    public static final String EVIDENCE_WHOIS_TIMEOUT_MS_DOC = "The WHOIS/RDAP lookup timeout (milliseconds).";
    public static final String EVIDENCE_WHOIS_TIMEOUT_MS_DEFAULT = "3000";

    public static final String EVIDENCE_DNS_TIMEOUT_MS_CONFIG = "evidence.dns.timeout.ms";
    public static final String EVIDENCE_DNS_TIMEOUT_MS_DOC = "The DNS record collection timeout (milliseconds).";
    public static final String EVIDENCE_DNS_TIMEOUT_MS_DEFAULT = "2000";

    public static final String EVIDENCE_TLS_TIMEOUT_MS_CONFIG = "evidence.tls.timeout.ms";
    public static final String EVIDENCE_TLS_TIMEOUT_MS_DOC = "The TLS inspection timeout (milliseconds).";
    public static final String EVIDENCE_TLS_TIMEOUT_MS_DEFAULT = "3000";

    public static final String EVIDENCE_HTML_TIMEOUT_MS_CONFIG = "evidence.html.timeout.ms";
    public static final String EVIDENCE_HTML_TIMEOUT_MS_DOC = "The page rendering timeout (milliseconds).";
    public static final String EVIDENCE_HTML_TIMEOUT_MS_DEFAULT = "6000";

    public static final String EVIDENCE_SCREENSHOT_TIMEOUT_MS_CONFIG = "evidence.screenshot.timeout.ms";
    public static final String EVIDENCE_SCREENSHOT_TIMEOUT_MS_DOC = "The screenshot capture timeout (milliseconds).";
    public static final String EVIDENCE_SCREENSHOT_TIMEOUT_MS_DEFAULT = "8000";

    public static final String EVIDENCE_NETWORK_TIMEOUT_MS_CONFIG = "evidence.network.timeout.ms";
    public static final String EVIDENCE_NETWORK_TIMEOUT_MS_DOC = "The ASN lookup timeout (milliseconds).";
    public static final String EVIDENCE_NETWORK_TIMEOUT_MS_DEFAULT = "1000";

    /* --- Stage-1 / Stage-2 ensembles --- */
    public static final String STAGE1_MODELS_CONFIG = "stage1.models";
    public static final String STAGE1_MODELS_DOC = "Comma-separated identifiers of the Stage-1 models.";
    public static final String STAGE1_MODELS_DEFAULT = "lexical-a,lexical-b,tabular";

    public static final String STAGE1_WEIGHTS_CONFIG = "stage1.weights";
    public static final String STAGE1_WEIGHTS_DOC = "Comma-separated Stage-1 model weights (same order as the models, summing to 1).";
    public static final String STAGE1_WEIGHTS_DEFAULT = "0.35,0.25,0.40";

    public static final String STAGE1_BUDGET_MS_CONFIG = "stage1.budget.ms";
    public static final String STAGE1_BUDGET_MS_DOC = "The Stage-1 time budget (milliseconds).";
    public static final String STAGE1_BUDGET_MS_DEFAULT = "2000";

    public static final String STAGE1_EARLY_EXIT_CONFIG = "stage1.early.exit.threshold";
    public static final String STAGE1_EARLY_EXIT_DOC = "The Stage-1 combined confidence at or above which Stage-2 is skipped.";
    public static final String STAGE1_EARLY_EXIT_DEFAULT = "0.85";

    public static final String STAGE2_MODELS_CONFIG = "stage2.models";
    public static final String STAGE2_MODELS_DOC = "Comma-separated identifiers of the Stage-2 models.";
    public static final String STAGE2_MODELS_DEFAULT = "text-persuasion,screenshot";

    public static final String STAGE2_WEIGHTS_CONFIG = "stage2.weights";
    public static final String STAGE2_WEIGHTS_DOC = "Comma-separated Stage-2 model weights (same order as the models, summing to 1).";
    public static final String STAGE2_WEIGHTS_DEFAULT = "0.6,0.4";

    public static final String STAGE2_BUDGET_MS_CONFIG = "stage2.budget.ms";
    public static final String STAGE2_BUDGET_MS_DOC = "The Stage-2 time budget (milliseconds).";
    public static final String STAGE2_BUDGET_MS_DEFAULT = "5000";

    /* --- Model predictors --- */
    public static final String MODELS_MODE_CONFIG = "models.mode";
    public static final String MODELS_MODE_DOC = "The model predictor variant: 'trained' or 'heuristic-fallback'.";
    public static final String MODELS_MODE_DEFAULT = "heuristic-fallback";

    public static final String MODELS_ENDPOINT_CONFIG = "models.endpoint";
    public static final String MODELS_ENDPOINT_DOC = "The base URL of the model serving endpoint (trained variant only).";
    public static final String MODELS_ENDPOINT_DEFAULT = "";

    public static final String MODELS_TOKEN_CONFIG = "models.token";
    public static final String MODELS_TOKEN_DOC = "The bearer token of the model serving endpoint.";
    public static final String MODELS_TOKEN_DEFAULT = "";

    public static final String MODELS_TIMEOUT_MS_CONFIG = "models.timeout.ms";
    public static final String MODELS_TIMEOUT_MS_DOC = "The timeout of a single model prediction request (milliseconds).";
    public static final String MODELS_TIMEOUT_MS_DEFAULT = "1500";

    /* --- Combiner / calibration --- */
    public static final String COMBINER_WEIGHTS_FULL_CONFIG = "combiner.weights.with.stage2";
    public static final String COMBINER_WEIGHTS_FULL_DOC = "Comma-separated fused weights of Stage-1, Stage-2 and the causal contribution.";
    public static final String COMBINER_WEIGHTS_FULL_DEFAULT = "0.30,0.50,0.20";

    public static final String COMBINER_WEIGHTS_FAST_CONFIG = "combiner.weights.without.stage2";
    public static final String COMBINER_WEIGHTS_FAST_DOC = "Comma-separated fused weights of Stage-1 and the causal contribution.";
    public static final String COMBINER_WEIGHTS_FAST_DEFAULT = "0.80,0.20";

    public static final String COMBINER_CAUSAL_WEIGHT_PREFIX = "combiner.causal.weight.";
    public static final String COMBINER_CAUSAL_WEIGHT_DOC = "The weight of a causal signal in the causal contribution (0-1).";

    public static final String COMBINER_BRANCH_CORRECTION_PREFIX = "combiner.branch.correction.";
    public static final String COMBINER_BRANCH_CORRECTION_DOC = "The additive probability correction for a reachability branch.";

    public static final String COMBINER_ESTABLISHED_DAYS_CONFIG = "combiner.established.domain.days";
    public static final String COMBINER_ESTABLISHED_DAYS_DOC = "Domains older than this (days) receive an established-domain discount; 0 disables it.";
    public static final String COMBINER_ESTABLISHED_DAYS_DEFAULT = "1825";

    public static final String CALIBRATION_ALPHA_CONFIG = "calibration.alpha";
    public static final String CALIBRATION_ALPHA_DOC = "The miscoverage rate of the conformal interval.";
    public static final String CALIBRATION_ALPHA_DEFAULT = "0.1";

    public static final String CALIBRATION_DIR_CONFIG = "calibration.dir";
    public static final String CALIBRATION_DIR_DOC = "A directory with per-branch calibration files; the bundled data is used when empty.";
    public static final String CALIBRATION_DIR_DEFAULT = "";

    /* --- Policy --- */
    public static final String POLICY_YOUNG_DOMAIN_DAYS_CONFIG = "policy.young.domain.days";
    public static final String POLICY_YOUNG_DOMAIN_DAYS_DOC = "Domains younger than this (days) are considered young.";
    public static final String POLICY_YOUNG_DOMAIN_DAYS_DEFAULT = "30";

    public static final String POLICY_RECENCY_WINDOW_DAYS_CONFIG = "policy.recency.window.days";
    public static final String POLICY_RECENCY_WINDOW_DAYS_DOC = "A threat-intel hit last seen within this window (days) is a recent historical hit.";
    public static final String POLICY_RECENCY_WINDOW_DAYS_DEFAULT = "90";

    public static final String POLICY_HIGH_RISK_TLD_SCORE_CONFIG = "policy.high.risk.tld.score";
    public static final String POLICY_HIGH_RISK_TLD_SCORE_DOC = "The minimum TLD risk score (0-100) of a high-risk TLD.";
    public static final String POLICY_HIGH_RISK_TLD_SCORE_DEFAULT = "60";

    public static final String POLICY_RULE_PREFIX = "policy.rule.";
    public static final String POLICY_RULE_ENABLED_SUFFIX = ".enabled";
    public static final String POLICY_RULE_LEVEL_SUFFIX = ".level";
    public static final String POLICY_RULE_DOC = "Enables a policy rule / sets the risk level it overrides to.";

    /* --- Risk bands --- */
    public static final String RISK_THRESHOLDS_PREFIX = "risk.thresholds.";
    public static final String RISK_THRESHOLDS_DOC = "Comma-separated safe, low, medium, high and critical thresholds of a branch.";

    /* --- Category checks --- */
    public static final String CATEGORY_PREFIX = "categories.";
    public static final String CATEGORY_WEIGHT_SUFFIX = ".weight";
    public static final String CATEGORY_ENABLED_SUFFIX = ".enabled";
    public static final String CATEGORY_DOC = "The weight of a category in the weighted risk factor / enables the category.";

    public static final String CHECK_PREFIX = "checks.";
    public static final String CHECK_ENABLED_SUFFIX = ".enabled";
    public static final String CHECK_DOC = "Enables a single check.";

    /* --- Collector adapters --- */
    public static final String GOOGLESAFEBROWSING_TOKEN_CONFIG = "collectors.googlesafebrowsing.token";
    public static final String GOOGLESAFEBROWSING_TOKEN_DOC = "The Google Safe Browsing API key.";
    public static final String GOOGLESAFEBROWSING_TOKEN_DEFAULT = "";

    public static final String VIRUSTOTAL_TOKEN_CONFIG = "collectors.virustotal.token";
    public static final String VIRUSTOTAL_TOKEN_DOC = "The VirusTotal access token.";
    public static final String VIRUSTOTAL_TOKEN_DEFAULT = "";

    public static final String VIRUSTOTAL_MIN_DETECTIONS_CONFIG = "collectors.virustotal.min.detections";
    public static final String VIRUSTOTAL_MIN_DETECTIONS_DOC = "The minimum number of malicious engine verdicts reported as a finding.";
    public static final String VIRUSTOTAL_MIN_DETECTIONS_DEFAULT = "2";

    public static final String RDAP_BASE_URL_CONFIG = "collectors.rdap.base.url";
    public static final String RDAP_BASE_URL_DOC = "The RDAP bootstrap service base URL.";
    public static final String RDAP_BASE_URL_DEFAULT = "https://rdap.org/domain/";

    public static final String DNS_SERVERS_CONFIG = "collectors.dns.servers";
    public static final String DNS_SERVERS_DOC = "Comma-separated DNS servers used by the resolver; the system resolvers are used when empty.";
    public static final String DNS_SERVERS_DEFAULT = "";

    public static final String GEOIP_ASN_DB_CONFIG = "collectors.geoip.asndb";
    public static final String GEOIP_ASN_DB_DOC = "The path to the GeoLite2 ASN database; the ASN lookup is disabled when empty.";
    public static final String GEOIP_ASN_DB_DEFAULT = "";

    public static final String RENDER_USER_AGENT_CONFIG = "collectors.render.user.agent";
    public static final String RENDER_USER_AGENT_DOC = "The User-Agent header sent by the page renderer and the HTTP probe.";
    public static final String RENDER_USER_AGENT_DEFAULT =
            "Mozilla/5.0 (X11; Linux x86_64; rv:131.0) Gecko/20100101 Firefox/131.0";
}
