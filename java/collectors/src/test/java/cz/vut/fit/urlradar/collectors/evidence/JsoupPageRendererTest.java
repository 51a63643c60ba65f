package cz.vut.fit.urlradar.collectors.evidence;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.evidence.PageRenderer;
import org.jsoup.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JsoupPageRendererTest {
    private static final PageRenderer.RenderOptions OPTIONS =
            new PageRenderer.RenderOptions(true, Duration.ofSeconds(5), 102_400);

    private Map<String, Connection> connections;
    private JsoupPageRenderer renderer;

    @BeforeEach
    void setUp() {
        connections = new HashMap<>();
        renderer = new JsoupPageRenderer("urlradar-test", 3) {
            @Override
            protected Connection connect(String url) {
                var connection = connections.get(url);
                assertNotNull(connection, "Unexpected request to " + url);
                return connection;
            }
        };
    }

    private void serve(String url, int status, Map<String, List<String>> headers, String body)
            throws IOException {
        var response = mock(Connection.Response.class);
        when(response.statusCode()).thenReturn(status);
        when(response.multiHeaders()).thenReturn(headers);
        when(response.header(anyString())).thenAnswer(invocation -> {
            var values = headers.get(invocation.<String>getArgument(0));
            return values == null ? null : values.get(0);
        });
        when(response.headers("Set-Cookie")).thenReturn(headers.getOrDefault("Set-Cookie", List.of()));
        when(response.body()).thenReturn(body);

        var connection = mock(Connection.class, RETURNS_SELF);
        when(connection.execute()).thenReturn(response);
        connections.put(url, connection);
    }

    @Test
    void followsRedirectsAndReportsTheChain() throws Exception {
        serve("http://example.com/", 301, Map.of("Location", List.of("https://example.com/")), "");
        serve("https://example.com/", 302, Map.of("Location", List.of("/login?next=home")), "");
        serve("https://example.com/login?next=home", 200,
                Map.of("Content-Type", List.of("text/html; charset=utf-8"),
                        "Set-Cookie", List.of("sid=abc; Secure; HttpOnly", "lang=en")),
                "<html><title>Sign in</title></html>");

        var page = renderer.render("http://example.com/", OPTIONS);

        assertEquals("<html><title>Sign in</title></html>", page.html());
        assertEquals("https://example.com/login?next=home", page.http().finalUrl());
        assertEquals(200, page.http().statusCode());
        assertEquals(List.of("http://example.com/", "https://example.com/", "https://example.com/login?next=home"),
                page.http().redirectChain());
        assertEquals("text/html; charset=utf-8", page.http().header("content-type"));
        assertEquals(2, page.http().cookies().size());
        assertNull(page.screenshot());
    }

    @Test
    void stopsAtTheRedirectLimit() throws Exception {
        serve("https://loop.example/a", 302, Map.of("Location", List.of("/b")), "");
        serve("https://loop.example/b", 302, Map.of("Location", List.of("/a")), "");

        var page = renderer.render("https://loop.example/a", OPTIONS);

        assertEquals(302, page.http().statusCode());
        assertEquals(4, page.http().redirectChain().size());
    }

    @Test
    void errorStatusIsReturnedNotThrown() throws Exception {
        serve("https://example.com/gone", 404, Map.of(), "Not found");

        var page = renderer.render("https://example.com/gone", OPTIONS);

        assertEquals(404, page.http().statusCode());
        assertEquals("Not found", page.html());
    }

    @Test
    void readTimeoutIsReportedAsTimeout() throws Exception {
        var connection = mock(Connection.class, RETURNS_SELF);
        when(connection.execute()).thenThrow(new SocketTimeoutException("Read timed out"));
        connections.put("https://slow.example/", connection);

        var error = assertThrows(CollaboratorException.class, () -> renderer.render("https://slow.example/", OPTIONS));
        assertEquals(ResultCodes.TIMEOUT, error.getCode());
    }

    @Test
    void bodyIsCappedByTheOptions() throws Exception {
        serve("https://example.com/", 200, Map.of(), "<html></html>");
        var connection = connections.get("https://example.com/");

        renderer.render("https://example.com/", new PageRenderer.RenderOptions(false, Duration.ofSeconds(2), 4096));

        verify(connection).maxBodySize(4096);
        verify(connection).followRedirects(false);
        verify(connection).userAgent("urlradar-test");
    }
}
