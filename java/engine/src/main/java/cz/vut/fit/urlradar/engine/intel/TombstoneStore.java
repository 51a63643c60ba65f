package cz.vut.fit.urlradar.engine.intel;

import org.jetbrains.annotations.NotNull;

/**
 * Remembers targets that were confirmed malicious and later taken down.
 */
public interface TombstoneStore {
    /**
     * Returns true if the URL (or its host) carries a tombstone.
     */
    boolean isTombstoned(@NotNull String url);

    /**
     * A store without any tombstones.
     */
    static TombstoneStore none() {
        return url -> false;
    }
}
