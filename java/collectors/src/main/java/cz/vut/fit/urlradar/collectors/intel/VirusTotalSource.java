package cz.vut.fit.urlradar.collectors.intel;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ScannerConfig;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.intel.Severity;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import cz.vut.fit.urlradar.models.intel.repsystems.VirusTotalData;
import org.jetbrains.annotations.NotNull;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * A tier-1 source that reads the last VirusTotal analysis of the URL. A finding is reported once the number
 * of malicious verdicts reaches the configured minimum.
 *
 * @author URLRadar developers
 */
public class VirusTotalSource extends BaseReputationSource<VirusTotalData> {
    public static final String NAME = "virustotal";
    public static final String COMPONENT_NAME = "source-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(VirusTotalSource.class);

    private static final String VIRUSTOTAL_BASE_URL = "https://www.virustotal.com/api/v3/urls/";

    /**
     * The number of malicious verdicts from which a finding is critical.
     */
    static final int CRITICAL_DETECTIONS = 10;

    private final int _minDetections;

    public VirusTotalSource(@NotNull ConfigSnapshot config, @NotNull Clock clock) {
        this(new ReputationApiClient<>(config.property(ScannerConfig.VIRUSTOTAL_TOKEN_CONFIG,
                        ScannerConfig.VIRUSTOTAL_TOKEN_DEFAULT), config.intelSourceTimeout()),
                Integer.parseInt(config.property(ScannerConfig.VIRUSTOTAL_MIN_DETECTIONS_CONFIG,
                        ScannerConfig.VIRUSTOTAL_MIN_DETECTIONS_DEFAULT)),
                clock);
    }

    public VirusTotalSource(@NotNull ReputationApiClient<VirusTotalData> client, int minDetections,
                            @NotNull Clock clock) {
        super(client, clock);
        _minDetections = minDetections;
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    protected org.slf4j.Logger getLogger() {
        return Logger;
    }

    /**
     * VirusTotal identifies a URL by its unpadded URL-safe Base64 encoding.
     */
    static String urlIdentifier(@NotNull String url) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(url.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected String getRequestUrl(@NotNull String url) {
        return VIRUSTOTAL_BASE_URL + urlIdentifier(url);
    }

    @Override
    protected String getAuthTokenHeaderName() {
        return "x-apikey";
    }

    @Override
    protected VirusTotalData mapResponseToData(@NotNull JSONObject jsonResponse) {
        final var attributes = jsonResponse.getJSONObject("data").getJSONObject("attributes");
        final var lastStats = attributes.getJSONObject("last_analysis_stats");

        final var threatNames = new ArrayList<String>();
        final var names = attributes.optJSONArray("threat_names");
        if (names != null) {
            for (int i = 0; i < names.length(); i++) {
                final var name = names.optString(i, "");
                if (!name.isBlank())
                    threatNames.add(name);
            }
        }

        return new VirusTotalData(lastStats.optInt("malicious", 0), lastStats.optInt("suspicious", 0),
                lastStats.optInt("harmless", 0), lastStats.optInt("undetected", 0),
                attributes.optInt("reputation", 0), threatNames);
    }

    @Override
    protected @NotNull List<TIFinding> toFindings(@NotNull VirusTotalData data) {
        final var threatName = data.primaryThreatName();
        if (data.malicious() >= CRITICAL_DETECTIONS)
            return List.of(finding(Severity.CRITICAL, threatName != null ? threatName : "malicious"));
        if (data.malicious() >= _minDetections)
            return List.of(finding(Severity.HIGH, threatName != null ? threatName : "malicious"));
        if (data.flagged() >= _minDetections)
            return List.of(finding(Severity.MEDIUM, "suspicious"));
        return List.of();
    }
}
