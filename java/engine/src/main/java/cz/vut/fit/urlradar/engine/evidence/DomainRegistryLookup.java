package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.models.evidence.WhoisEvidence;
import org.jetbrains.annotations.NotNull;

/**
 * Looks up the registration data (WHOIS/RDAP) of a registrable domain.
 */
public interface DomainRegistryLookup {
    @NotNull WhoisEvidence lookup(@NotNull String registrableDomain) throws CollaboratorException;
}
