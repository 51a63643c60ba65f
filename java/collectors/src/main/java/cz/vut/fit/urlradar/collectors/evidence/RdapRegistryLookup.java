package cz.vut.fit.urlradar.collectors.evidence;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.ScannerConfig;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.engine.evidence.DomainRegistryLookup;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import cz.vut.fit.urlradar.models.evidence.WhoisEvidence;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Looks up domain registration data over RDAP. The base URL is expected to redirect to the authoritative
 * RDAP server of the TLD (e.g. the rdap.org bootstrap service).
 *
 * @author URLRadar developers
 */
public class RdapRegistryLookup implements DomainRegistryLookup {
    public static final String COMPONENT_NAME = "rdap";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RdapRegistryLookup.class);

    private static final List<String> PRIVACY_MARKERS = List.of("redacted", "privacy", "proxy",
            "withheld", "not disclosed", "data protected");

    private final String _baseUrl;
    private final Duration _timeout;
    private final HttpClient _client;
    private final Clock _clock;

    public RdapRegistryLookup(@NotNull ConfigSnapshot config, @NotNull Clock clock) {
        this(config.property(ScannerConfig.RDAP_BASE_URL_CONFIG, ScannerConfig.RDAP_BASE_URL_DEFAULT),
                config.evidenceTimeout(EvidenceKind.WHOIS), clock);
    }

    public RdapRegistryLookup(@NotNull String baseUrl, @NotNull Duration timeout, @NotNull Clock clock) {
        _baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        _timeout = timeout;
        _clock = clock;
        _client = this.buildHttpClient();
    }

    protected HttpClient buildHttpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(_timeout)
                .build();
    }

    @Override
    public @NotNull WhoisEvidence lookup(@NotNull String registrableDomain) throws CollaboratorException {
        final var request = HttpRequest.newBuilder()
                .uri(URI.create(_baseUrl + registrableDomain.toLowerCase(Locale.ROOT)))
                .timeout(_timeout)
                .header("Accept", "application/rdap+json, application/json")
                .GET()
                .build();

        final HttpResponse<String> response;
        try {
            Logger.trace("[{}] Querying RDAP", registrableDomain);
            response = _client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new CollaboratorException(ResultCodes.TIMEOUT,
                    "RDAP request timed out (%d ms)".formatted(_timeout.toMillis()), e);
        } catch (IOException e) {
            Logger.debug("[{}] RDAP request failed: {}", registrableDomain, e.getMessage());
            throw new CollaboratorException(ResultCodes.CANNOT_FETCH, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(ResultCodes.INTERNAL_ERROR, "Interrupted", e);
        }

        final var status = response.statusCode();
        if (status == 404)
            throw new CollaboratorException(ResultCodes.NOT_FOUND, "No RDAP record for " + registrableDomain);
        if (status == 429)
            throw new CollaboratorException(ResultCodes.RATE_LIMITED, "RDAP server is rate limited");
        if (status != 200)
            throw new CollaboratorException(ResultCodes.CANNOT_FETCH, "RDAP response " + status);

        try {
            return parse(new JSONObject(response.body()), _clock.instant());
        } catch (JSONException e) {
            throw new CollaboratorException(ResultCodes.INVALID_FORMAT, "Invalid RDAP response: " + e.getMessage(), e);
        }
    }

    /**
     * Maps an RDAP domain object to the registration evidence.
     */
    static WhoisEvidence parse(@NotNull JSONObject domain, @NotNull Instant now) {
        Instant created = null;
        Instant expires = null;
        final var events = domain.optJSONArray("events");
        if (events != null) {
            for (int i = 0; i < events.length(); i++) {
                final var event = events.optJSONObject(i);
                if (event == null)
                    continue;
                final var action = event.optString("eventAction", "");
                final var date = parseDate(event.optString("eventDate", null));
                if (action.equals("registration"))
                    created = date;
                else if (action.equals("expiration"))
                    expires = date;
            }
        }

        final var nameServers = new ArrayList<String>();
        final var nsArray = domain.optJSONArray("nameservers");
        if (nsArray != null) {
            for (int i = 0; i < nsArray.length(); i++) {
                final var ns = nsArray.optJSONObject(i);
                if (ns != null && ns.has("ldhName"))
                    nameServers.add(ns.getString("ldhName").toLowerCase(Locale.ROOT));
            }
        }

        Integer ageDays = null;
        if (created != null)
            ageDays = (int) Math.max(0, Duration.between(created, now).toDays());

        return new WhoisEvidence(ageDays, registrarName(domain.optJSONArray("entities")),
                isPrivacyProtected(domain), created, expires, nameServers);
    }

    private static @Nullable String registrarName(@Nullable JSONArray entities) {
        if (entities == null)
            return null;

        for (int i = 0; i < entities.length(); i++) {
            final var entity = entities.optJSONObject(i);
            if (entity == null || !hasRole(entity, "registrar"))
                continue;

            final var name = vcardValue(entity, "fn");
            if (name != null)
                return name;
        }
        return null;
    }

    private static boolean isPrivacyProtected(JSONObject domain) {
        // RFC 9537 redaction markers
        final var redacted = domain.optJSONArray("redacted");
        if (redacted != null && !redacted.isEmpty())
            return true;

        if (containsPrivacyMarker(domain.optJSONArray("remarks")))
            return true;

        final var entities = domain.optJSONArray("entities");
        if (entities == null)
            return false;

        for (int i = 0; i < entities.length(); i++) {
            final var entity = entities.optJSONObject(i);
            if (entity == null || !hasRole(entity, "registrant"))
                continue;

            if (containsPrivacyMarker(entity.optJSONArray("remarks")))
                return true;
            final var name = vcardValue(entity, "fn");
            if (name != null && containsMarker(name))
                return true;
            final var org = vcardValue(entity, "org");
            if (org != null && containsMarker(org))
                return true;
        }
        return false;
    }

    private static boolean containsPrivacyMarker(@Nullable JSONArray remarks) {
        if (remarks == null)
            return false;

        for (int i = 0; i < remarks.length(); i++) {
            final var remark = remarks.optJSONObject(i);
            if (remark == null)
                continue;
            if (containsMarker(remark.optString("title", "")))
                return true;
            final var description = remark.optJSONArray("description");
            if (description != null && containsMarker(description.join(" ")))
                return true;
        }
        return false;
    }

    private static boolean containsMarker(String text) {
        final var lower = text.toLowerCase(Locale.ROOT);
        return PRIVACY_MARKERS.stream().anyMatch(lower::contains);
    }

    private static boolean hasRole(JSONObject entity, String role) {
        final var roles = entity.optJSONArray("roles");
        if (roles == null)
            return false;
        for (int i = 0; i < roles.length(); i++) {
            if (role.equalsIgnoreCase(roles.optString(i)))
                return true;
        }
        return false;
    }

    /**
     * Reads a text property of a jCard ({@code ["vcard", [[name, params, type, value], ...]]}).
     */
    private static @Nullable String vcardValue(JSONObject entity, String property) {
        final var vcard = entity.optJSONArray("vcardArray");
        if (vcard == null || vcard.length() < 2)
            return null;
        final var properties = vcard.optJSONArray(1);
        if (properties == null)
            return null;

        for (int i = 0; i < properties.length(); i++) {
            final var prop = properties.optJSONArray(i);
            if (prop == null || prop.length() < 4 || !property.equals(prop.optString(0)))
                continue;
            final var value = prop.get(3);
            final var text = value instanceof JSONArray array ? array.join(" ").replace("\"", "") : value.toString();
            if (!text.isBlank())
                return text.trim();
        }
        return null;
    }

    private static @Nullable Instant parseDate(@Nullable String value) {
        if (value == null || value.isBlank())
            return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            Logger.debug("Cannot parse RDAP date: {}", value);
            return null;
        }
    }
}
