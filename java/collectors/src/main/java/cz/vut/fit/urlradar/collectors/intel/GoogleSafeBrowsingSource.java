package cz.vut.fit.urlradar.collectors.intel;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ScannerConfig;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.intel.Severity;
import cz.vut.fit.urlradar.models.intel.TIFinding;
import cz.vut.fit.urlradar.models.intel.repsystems.GoogleSafeBrowsingData;
import org.jetbrains.annotations.NotNull;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * A tier-1 source that looks the URL up in the Google Safe Browsing v4 Lookup API.
 *
 * @author URLRadar developers
 */
public class GoogleSafeBrowsingSource extends BaseReputationSource<GoogleSafeBrowsingData> {
    public static final String NAME = "google-safe-browsing";
    public static final String COMPONENT_NAME = "source-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(GoogleSafeBrowsingSource.class);

    private static final String GOOGLE_SAFE_BROWSING_BASE =
            "https://safebrowsing.googleapis.com/v4/threatMatches:find?key=";

    private static final List<String> THREAT_TYPES = List.of("THREAT_TYPE_UNSPECIFIED", "MALWARE",
            "SOCIAL_ENGINEERING", "UNWANTED_SOFTWARE", "POTENTIALLY_HARMFUL_APPLICATION");

    public GoogleSafeBrowsingSource(@NotNull ConfigSnapshot config, @NotNull Clock clock) {
        this(new ReputationApiClient<>(config.property(ScannerConfig.GOOGLESAFEBROWSING_TOKEN_CONFIG,
                ScannerConfig.GOOGLESAFEBROWSING_TOKEN_DEFAULT), config.intelSourceTimeout()), clock);
    }

    public GoogleSafeBrowsingSource(@NotNull ReputationApiClient<GoogleSafeBrowsingData> client,
                                    @NotNull Clock clock) {
        super(client, clock);
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    protected org.slf4j.Logger getLogger() {
        return Logger;
    }

    @Override
    protected String getRequestUrl(@NotNull String url) {
        return GOOGLE_SAFE_BROWSING_BASE + URLEncoder.encode(client.getToken(), StandardCharsets.UTF_8);
    }

    @Override
    protected String getAuthTokenHeaderName() {
        return null;
    }

    @Override
    protected String getPOSTData(@NotNull String url) {
        final var threatInfo = new JSONObject()
                .put("threatTypes", new JSONArray(THREAT_TYPES))
                .put("platformTypes", new JSONArray(List.of("ANY_PLATFORM")))
                .put("threatEntryTypes", new JSONArray(List.of("URL")))
                .put("threatEntries", new JSONArray().put(new JSONObject().put("url", url)));

        return new JSONObject()
                .put("client", new JSONObject()
                        .put("clientId", "urlradar")
                        .put("clientVersion", "1.0"))
                .put("threatInfo", threatInfo)
                .toString();
    }

    @Override
    protected GoogleSafeBrowsingData mapResponseToData(@NotNull JSONObject jsonResponse) {
        int unspecifiedCnt = 0;
        int malwareCnt = 0;
        int socialEngineeringCnt = 0;
        int unwantedSoftwareCnt = 0;
        int potentiallyHarmfulCnt = 0;

        // An empty object means no match
        if (jsonResponse.has("matches")) {
            final var matches = jsonResponse.getJSONArray("matches");

            for (int i = 0; i < matches.length(); i++) {
                final var threatType = matches.getJSONObject(i).getString("threatType");

                switch (threatType) {
                    case "MALWARE" -> malwareCnt++;
                    case "SOCIAL_ENGINEERING" -> socialEngineeringCnt++;
                    case "UNWANTED_SOFTWARE" -> unwantedSoftwareCnt++;
                    case "POTENTIALLY_HARMFUL_APPLICATION" -> potentiallyHarmfulCnt++;
                    default -> unspecifiedCnt++;
                }
            }
        }

        return new GoogleSafeBrowsingData(unspecifiedCnt, malwareCnt, socialEngineeringCnt, unwantedSoftwareCnt,
                potentiallyHarmfulCnt);
    }

    @Override
    protected @NotNull List<TIFinding> toFindings(@NotNull GoogleSafeBrowsingData data) {
        final var findings = new ArrayList<TIFinding>();
        if (data.malwareCnt() > 0)
            findings.add(finding(Severity.HIGH, "MALWARE"));
        if (data.socialEngineeringCnt() > 0)
            findings.add(finding(Severity.HIGH, "SOCIAL_ENGINEERING"));
        if (data.unwantedSoftwareCnt() > 0)
            findings.add(finding(Severity.MEDIUM, "UNWANTED_SOFTWARE"));
        if (data.potentiallyHarmfulApplicationCnt() > 0)
            findings.add(finding(Severity.MEDIUM, "POTENTIALLY_HARMFUL_APPLICATION"));
        if (data.threatTypeUnspecifiedCnt() > 0)
            findings.add(finding(Severity.LOW, null));
        return findings;
    }
}
