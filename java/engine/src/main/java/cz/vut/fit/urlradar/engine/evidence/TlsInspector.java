package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.models.evidence.TlsEvidence;
import org.jetbrains.annotations.NotNull;

/**
 * Performs a TLS handshake with the host and reports the negotiated parameters and the leaf certificate.
 */
public interface TlsInspector {
    /**
     * @param hostname The host name, also sent as SNI.
     * @param port     The port.
     * @return The TLS evidence; an untrusted certificate is reported with {@code valid=false}, not thrown.
     * @throws CollaboratorException when no handshake could be performed
     */
    @NotNull TlsEvidence inspect(@NotNull String hostname, int port) throws CollaboratorException;
}
