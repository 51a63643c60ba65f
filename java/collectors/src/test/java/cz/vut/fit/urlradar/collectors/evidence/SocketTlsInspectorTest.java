package cz.vut.fit.urlradar.collectors.evidence;

import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import javax.net.ssl.X509TrustManager;
import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.net.ConnectException;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SocketTlsInspectorTest {
    private static final Instant NOT_BEFORE = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NOT_AFTER = Instant.parse("2024-12-31T23:59:59Z");

    private X509TrustManager platformTrust;
    private SocketTlsInspector inspector;

    @BeforeEach
    void setUp() {
        platformTrust = mock(X509TrustManager.class);
        inspector = new SocketTlsInspector(Duration.ofSeconds(1), platformTrust);
    }

    private static X509Certificate certificate(String subject, String issuer, String... dnsNames) throws Exception {
        var certificate = mock(X509Certificate.class);
        when(certificate.getSubjectX500Principal()).thenReturn(new X500Principal(subject));
        when(certificate.getIssuerX500Principal()).thenReturn(new X500Principal(issuer));
        when(certificate.getNotBefore()).thenReturn(Date.from(NOT_BEFORE));
        when(certificate.getNotAfter()).thenReturn(Date.from(NOT_AFTER));
        if (dnsNames.length > 0) {
            var entries = Arrays.stream(dnsNames)
                    .map(name -> List.<Object>of(2, name))
                    .toList();
            doReturn(entries).when(certificate).getSubjectAlternativeNames();
        }
        return certificate;
    }

    @ParameterizedTest
    @CsvSource({
            "www.example.com, www.example.com, true",
            "WWW.Example.com, www.example.com, true",
            "login.example.com, *.example.com, true",
            "example.com, *.example.com, false",
            "a.b.example.com, *.example.com, false",
            "example.com.evil.net, example.com, false"
    })
    void wildcardCoversExactlyOneLabel(String host, String certName, boolean expected) {
        assertEquals(expected, SocketTlsInspector.hostnameMatches(host, certName));
    }

    @Test
    void trustedChainIsValid() throws Exception {
        var leaf = certificate("CN=shop.example.com", "CN=R11, O=Let's Encrypt, C=US",
                "shop.example.com", "www.shop.example.com");

        var evidence = inspector.describe("shop.example.com", new X509Certificate[]{leaf}, "TLSv1.3",
                "TLS_AES_128_GCM_SHA256");

        assertTrue(evidence.valid());
        assertFalse(evidence.selfSigned());
        assertTrue(evidence.hostnameMatches());
        assertEquals(List.of("shop.example.com", "www.shop.example.com"), evidence.subjectAltNames());
        assertEquals(NOT_AFTER, evidence.notAfter());
        assertTrue(evidence.modernProtocol());
    }

    @Test
    void untrustedSelfSignedCertificateIsReportedNotThrown() throws Exception {
        var leaf = certificate("CN=paypal-secure.xyz", "CN=paypal-secure.xyz");
        doThrow(new CertificateException("PKIX path building failed"))
                .when(platformTrust).checkServerTrusted(any(), anyString());

        var evidence = inspector.describe("login.paypal-secure.xyz", new X509Certificate[]{leaf}, "TLSv1.2",
                "TLS_ECDHE_RSA_WITH_AES_128_GCM_SHA256");

        assertFalse(evidence.valid());
        assertTrue(evidence.selfSigned());
        // No SAN: the CN is used
        assertFalse(evidence.hostnameMatches());
        assertTrue(evidence.subjectAltNames().isEmpty());
    }

    @Test
    void expiredCertificateIsInvalid() throws Exception {
        var leaf = certificate("CN=example.org", "CN=Some CA", "example.org");
        doThrow(new CertificateExpiredException("expired")).when(leaf).checkValidity();

        var evidence = inspector.describe("example.org", new X509Certificate[]{leaf}, "TLSv1.3", "TLS_AES_256_GCM_SHA384");

        assertFalse(evidence.valid());
        assertTrue(evidence.hostnameMatches());
    }

    @Test
    void connectTimeoutIsReportedAsTimeout() {
        var timingOut = new SocketTlsInspector(Duration.ofMillis(100), platformTrust) {
            @Override
            protected Socket buildSocket() {
                return new Socket() {
                    @Override
                    public void connect(SocketAddress endpoint, int timeout) throws IOException {
                        throw new SocketTimeoutException("connect timed out");
                    }
                };
            }
        };

        var error = assertThrows(CollaboratorException.class, () -> timingOut.inspect("example.com", 443));
        assertEquals(ResultCodes.TIMEOUT, error.getCode());
    }

    @Test
    void refusedConnectionCannotBeFetched() {
        var refusing = new SocketTlsInspector(Duration.ofMillis(100), platformTrust) {
            @Override
            protected Socket buildSocket() {
                return new Socket() {
                    @Override
                    public void connect(SocketAddress endpoint, int timeout) throws IOException {
                        throw new ConnectException("Connection refused");
                    }
                };
            }
        };

        var error = assertThrows(CollaboratorException.class, () -> refusing.inspect("example.com", 443));
        assertEquals(ResultCodes.CANNOT_FETCH, error.getCode());
    }
}
