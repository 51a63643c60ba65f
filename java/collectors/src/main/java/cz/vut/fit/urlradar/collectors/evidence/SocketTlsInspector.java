package cz.vut.fit.urlradar.collectors.evidence;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.engine.evidence.TlsInspector;
import cz.vut.fit.urlradar.models.evidence.TlsEvidence;
import org.jetbrains.annotations.NotNull;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.security.KeyManagementException;
import java.security.KeyStore;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Connects to the host, performs a TLS handshake that accepts any certificate and validates the presented
 * chain against the platform trust store separately, so that untrusted certificates can still be described.
 *
 * @author URLRadar developers
 */
public class SocketTlsInspector implements TlsInspector {
    public static final String COMPONENT_NAME = "tls";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(SocketTlsInspector.class);

    private static final int SAN_DNS_NAME = 2;

    private final int _timeoutMs;
    private final X509TrustManager _platformTrust;

    public SocketTlsInspector(@NotNull Duration timeout) {
        this(timeout, defaultTrustManager());
    }

    public SocketTlsInspector(@NotNull Duration timeout, @NotNull X509TrustManager platformTrust) {
        _timeoutMs = (int) timeout.toMillis();
        _platformTrust = platformTrust;
    }

    protected SSLContext buildSSLContext() throws NoSuchAlgorithmException, KeyManagementException {
        final var context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{new AcceptingTrustManager()}, null);
        return context;
    }

    protected Socket buildSocket() throws IOException {
        return new Socket();
    }

    @Override
    public @NotNull TlsEvidence inspect(@NotNull String hostname, int port) throws CollaboratorException {
        SSLContext context;
        try {
            context = this.buildSSLContext();
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            Logger.error("[{}] TLS context error", hostname, e);
            throw new CollaboratorException(ResultCodes.INTERNAL_ERROR, e.getMessage(), e);
        }

        try (var rawSocket = this.buildSocket()) {
            try {
                Logger.trace("[{}] Connecting to port {}", hostname, port);
                rawSocket.connect(new InetSocketAddress(hostname, port), _timeoutMs);
            } catch (SocketTimeoutException e) {
                Logger.debug("[{}] Connection timed out", hostname);
                throw new CollaboratorException(ResultCodes.TIMEOUT,
                        "Connection timed out (%d ms)".formatted(_timeoutMs), e);
            }

            final var factory = context.getSocketFactory();
            try (var socket = (SSLSocket) factory.createSocket(rawSocket, hostname, port, false)) {
                socket.setSoTimeout(_timeoutMs);

                final var sslParams = new SSLParameters();
                sslParams.setServerNames(List.of(new SNIHostName(hostname)));
                socket.setSSLParameters(sslParams);

                socket.startHandshake();
                final var session = socket.getSession();

                final var chain = Arrays.stream(session.getPeerCertificates())
                        .filter(X509Certificate.class::isInstance)
                        .map(X509Certificate.class::cast)
                        .toArray(X509Certificate[]::new);
                if (chain.length == 0)
                    throw new CollaboratorException(ResultCodes.INVALID_FORMAT, "No X.509 certificate presented");

                return describe(hostname, chain, session.getProtocol(), session.getCipherSuite());
            } catch (SocketTimeoutException e) {
                Logger.debug("[{}] Socket read timed out", hostname);
                throw new CollaboratorException(ResultCodes.TIMEOUT,
                        "Socket read timed out (%d ms)".formatted(_timeoutMs), e);
            } catch (SSLHandshakeException e) {
                Logger.debug("[{}] TLS handshake error: {}", hostname, e.getMessage());
                throw new CollaboratorException(ResultCodes.CANNOT_FETCH, "Handshake error: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            Logger.debug("[{}] Cannot connect: {}", hostname, e.getMessage());
            throw new CollaboratorException(ResultCodes.CANNOT_FETCH, e.getMessage(), e);
        }
    }

    /**
     * Describes the presented chain. The first certificate is the leaf.
     */
    TlsEvidence describe(@NotNull String hostname, @NotNull X509Certificate[] chain,
                         String protocol, String cipherSuite) {
        final var leaf = chain[0];
        final var subject = leaf.getSubjectX500Principal().getName();
        final var issuer = leaf.getIssuerX500Principal().getName();
        final var names = subjectAltNames(leaf);

        return new TlsEvidence(isTrusted(hostname, chain), issuer, subject, subject.equals(issuer),
                leaf.getNotBefore().toInstant(), leaf.getNotAfter().toInstant(),
                protocol, cipherSuite, names, matchesAny(hostname, names, subject));
    }

    private boolean isTrusted(String hostname, X509Certificate[] chain) {
        try {
            _platformTrust.checkServerTrusted(chain, "UNKNOWN");
            chain[0].checkValidity();
            return true;
        } catch (CertificateException e) {
            Logger.debug("[{}] Untrusted certificate: {}", hostname, e.getMessage());
            return false;
        }
    }

    static List<String> subjectAltNames(@NotNull X509Certificate certificate) {
        final var result = new ArrayList<String>();
        try {
            final var entries = certificate.getSubjectAlternativeNames();
            if (entries == null)
                return result;

            for (var entry : entries) {
                if (entry.size() >= 2 && entry.get(0) instanceof Integer type && type == SAN_DNS_NAME)
                    result.add(entry.get(1).toString().toLowerCase(Locale.ROOT));
            }
        } catch (CertificateParsingException e) {
            Logger.debug("Cannot parse the SAN extension: {}", e.getMessage());
        }
        return result;
    }

    private static boolean matchesAny(String hostname, List<String> names, String subjectDn) {
        if (names.isEmpty()) {
            // Legacy certificates carry the host only in the CN
            for (var part : subjectDn.split(",")) {
                final var trimmed = part.trim();
                if (trimmed.regionMatches(true, 0, "CN=", 0, 3))
                    return hostnameMatches(hostname, trimmed.substring(3));
            }
            return false;
        }
        return names.stream().anyMatch(name -> hostnameMatches(hostname, name));
    }

    /**
     * Matches a host name against a certificate name. A leading wildcard covers exactly one label.
     */
    static boolean hostnameMatches(@NotNull String hostname, @NotNull String certName) {
        final var host = hostname.toLowerCase(Locale.ROOT);
        final var pattern = certName.toLowerCase(Locale.ROOT);

        if (!pattern.startsWith("*."))
            return host.equals(pattern);

        final var suffix = pattern.substring(1);
        if (!host.endsWith(suffix))
            return false;
        final var label = host.substring(0, host.length() - suffix.length());
        return !label.isEmpty() && !label.contains(".");
    }

    private static X509TrustManager defaultTrustManager() {
        try {
            final var factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init((KeyStore) null);
            for (var manager : factory.getTrustManagers()) {
                if (manager instanceof X509TrustManager x509)
                    return x509;
            }
            throw new IllegalStateException("No X.509 trust manager available");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot initialize the platform trust store", e);
        }
    }

    /**
     * Accepts every certificate so that the handshake completes; trust is evaluated afterwards.
     */
    static class AcceptingTrustManager implements X509TrustManager {
        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // Accept all
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // Not used
        }
    }
}
