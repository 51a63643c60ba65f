package cz.vut.fit.urlradar.engine.checks;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A group of related checks reported as one category result.
 */
public interface Category {
    /**
     * The identifier, also used in the configuration keys of the category.
     */
    @NotNull String id();

    @NotNull String name();

    @NotNull List<Check> checks();
}
