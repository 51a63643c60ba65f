package cz.vut.fit.urlradar.engine.evidence;

import cz.vut.fit.urlradar.engine.CollaboratorException;
import cz.vut.fit.urlradar.models.evidence.NetworkEvidence;
import org.jetbrains.annotations.NotNull;

/**
 * Maps an IP address to the autonomous system that announces it.
 */
public interface NetworkLookup {
    @NotNull NetworkEvidence lookup(@NotNull String ip) throws CollaboratorException;
}
