package cz.vut.fit.urlradar.collectors.evidence;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RdapRegistryLookupTest {
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final String EXAMPLE_DOMAIN = """
            {
              "objectClassName": "domain",
              "ldhName": "EXAMPLE.COM",
              "events": [
                {"eventAction": "registration", "eventDate": "1995-08-14T04:00:00Z"},
                {"eventAction": "expiration", "eventDate": "2025-08-13T04:00:00Z"},
                {"eventAction": "last changed", "eventDate": "2024-08-14T07:01:34Z"}
              ],
              "entities": [
                {"objectClassName": "entity", "roles": ["registrar"],
                 "vcardArray": ["vcard", [["version", {}, "text", "4.0"], ["fn", {}, "text", "RESERVED-Internet Assigned Numbers Authority"]]]}
              ],
              "nameservers": [
                {"objectClassName": "nameserver", "ldhName": "A.IANA-SERVERS.NET"},
                {"objectClassName": "nameserver", "ldhName": "B.IANA-SERVERS.NET"}
              ]
            }
            """;

    private static final String YOUNG_REDACTED_DOMAIN = """
            {
              "ldhName": "paypal-verify-account.xyz",
              "events": [{"eventAction": "registration", "eventDate": "2024-04-28T10:15:00.000+00:00"}],
              "entities": [
                {"roles": ["registrant"],
                 "vcardArray": ["vcard", [["version", {}, "text", "4.0"], ["fn", {}, "text", ""]]],
                 "remarks": [{"title": "REDACTED FOR PRIVACY", "description": ["Some of the data has been redacted."]}]},
                {"roles": ["registrar"],
                 "vcardArray": ["vcard", [["fn", {}, "text", "NameSilo, LLC"]]]}
              ]
            }
            """;

    @Test
    void parsesAnEstablishedDomain() {
        var evidence = RdapRegistryLookup.parse(new JSONObject(EXAMPLE_DOMAIN), NOW);

        assertEquals(Instant.parse("1995-08-14T04:00:00Z"), evidence.createdAt());
        assertEquals(Instant.parse("2025-08-13T04:00:00Z"), evidence.expiresAt());
        assertTrue(evidence.domainAgeDays() > 10_000);
        assertEquals("RESERVED-Internet Assigned Numbers Authority", evidence.registrar());
        assertEquals(List.of("a.iana-servers.net", "b.iana-servers.net"), evidence.nameServers());
        assertFalse(evidence.privacyProtected());
    }

    @Test
    void detectsRedactedRegistrantOfAYoungDomain() {
        var evidence = RdapRegistryLookup.parse(new JSONObject(YOUNG_REDACTED_DOMAIN), NOW);

        assertEquals(2, evidence.domainAgeDays());
        assertEquals("NameSilo, LLC", evidence.registrar());
        assertTrue(evidence.privacyProtected());
        assertNull(evidence.expiresAt());
        assertTrue(evidence.nameServers().isEmpty());
    }

    @Test
    void missingEventsLeaveTheAgeUnknown() {
        var evidence = RdapRegistryLookup.parse(new JSONObject("{\"ldhName\": \"example.dev\"}"), NOW);

        assertNull(evidence.domainAgeDays());
        assertNull(evidence.createdAt());
        assertNull(evidence.registrar());
    }

    private static RdapRegistryLookup lookupAnswering(HttpClient client) {
        return new RdapRegistryLookup("https://rdap.example/domain", Duration.ofSeconds(1), CLOCK) {
            @Override
            protected HttpClient buildHttpClient() {
                return client;
            }
        };
    }

    @Test
    @SuppressWarnings("unchecked")
    void queriesTheBaseUrl() throws Exception {
        var client = mock(HttpClient.class);
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(EXAMPLE_DOMAIN);
        when(client.<String>send(any(HttpRequest.class), any())).thenReturn(response);

        var evidence = lookupAnswering(client).lookup("Example.com");

        assertEquals("RESERVED-Internet Assigned Numbers Authority", evidence.registrar());
        verify(client).send(argThat(request -> request.uri().toString()
                .equals("https://rdap.example/domain/example.com")), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void unknownDomainIsNotFound() throws Exception {
        var client = mock(HttpClient.class);
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(404);
        when(client.<String>send(any(HttpRequest.class), any())).thenReturn(response);

        var error = assertThrows(CollaboratorException.class, () -> lookupAnswering(client).lookup("nope.example"));
        assertEquals(ResultCodes.NOT_FOUND, error.getCode());
    }

    @Test
    void requestTimeoutIsReportedAsTimeout() throws Exception {
        var client = mock(HttpClient.class);
        when(client.send(any(HttpRequest.class), any())).thenThrow(new HttpTimeoutException("request timed out"));

        var error = assertThrows(CollaboratorException.class, () -> lookupAnswering(client).lookup("example.com"));
        assertEquals(ResultCodes.TIMEOUT, error.getCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void garbageBodyIsInvalidFormat() throws Exception {
        var client = mock(HttpClient.class);
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("<html>Not RDAP</html>");
        when(client.<String>send(any(HttpRequest.class), any())).thenReturn(response);

        var error = assertThrows(CollaboratorException.class, () -> lookupAnswering(client).lookup("example.com"));
        assertEquals(ResultCodes.INVALID_FORMAT, error.getCode());
    }
}
