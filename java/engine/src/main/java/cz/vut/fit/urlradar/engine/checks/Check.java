package cz.vut.fit.urlradar.engine.checks;

import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A single check: its identity, its maximum points, the evidence it needs and its evaluation logic.
 * A check without requirements inspects only the URL and the threat-intel summary and runs on every branch.
 *
 * @author URLRadar developers
 */
public final class Check {
    /**
     * The evaluation logic. Called only when all required evidence is present.
     */
    @FunctionalInterface
    public interface Evaluator {
        @NotNull CheckOutcome evaluate(@NotNull CheckContext context);
    }

    private final String _id;
    private final String _name;
    private final int _maxPoints;
    private final Set<EvidenceKind> _requires;
    private final boolean _fullPage;
    private final Evaluator _evaluator;

    Check(@NotNull String id, @NotNull String name, int maxPoints, @NotNull Set<EvidenceKind> requires,
          boolean fullPage, @NotNull Evaluator evaluator) {
        if (maxPoints <= 0)
            throw new IllegalArgumentException("Check " + id + " must have positive maximum points");
        _id = id;
        _name = name;
        _maxPoints = maxPoints;
        _requires = requires.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(requires));
        _fullPage = fullPage;
        _evaluator = evaluator;
    }

    public @NotNull String id() {
        return _id;
    }

    public @NotNull String name() {
        return _name;
    }

    public int maxPoints() {
        return _maxPoints;
    }

    public @NotNull Set<EvidenceKind> requires() {
        return _requires;
    }

    /**
     * True if the check needs the fully parsed page and cannot use the lightweight template check.
     */
    public boolean fullPage() {
        return _fullPage;
    }

    public boolean urlOnly() {
        return _requires.isEmpty();
    }

    @NotNull CheckOutcome evaluate(@NotNull CheckContext context) {
        return _evaluator.evaluate(context);
    }
}
