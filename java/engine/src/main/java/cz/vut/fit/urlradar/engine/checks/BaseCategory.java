package cz.vut.fit.urlradar.engine.checks;

import cz.vut.fit.urlradar.models.evidence.EvidenceKind;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/**
 * Base class of the built-in categories. Subclasses declare their checks in the constructor.
 *
 * @author URLRadar developers
 */
public abstract class BaseCategory implements Category {
    private final String _id;
    private final String _name;
    private final List<Check> _checks = new ArrayList<>();

    protected BaseCategory(@NotNull String id, @NotNull String name) {
        _id = id;
        _name = name;
    }

    @Override
    public @NotNull String id() {
        return _id;
    }

    @Override
    public @NotNull String name() {
        return _name;
    }

    @Override
    public @NotNull List<Check> checks() {
        return Collections.unmodifiableList(_checks);
    }

    /**
     * Declares a check that inspects only the URL and the threat-intel summary.
     */
    protected final void urlCheck(@NotNull String id, @NotNull String name, int maxPoints,
                                  @NotNull Check.Evaluator evaluator) {
        _checks.add(new Check(id, name, maxPoints, EnumSet.noneOf(EvidenceKind.class), false, evaluator));
    }

    /**
     * Declares a check that needs the given evidence kinds.
     */
    protected final void check(@NotNull String id, @NotNull String name, int maxPoints,
                               @NotNull Check.Evaluator evaluator, @NotNull EvidenceKind first,
                               @NotNull EvidenceKind... rest) {
        _checks.add(new Check(id, name, maxPoints, EnumSet.of(first, rest), false, evaluator));
    }

    /**
     * Declares a check that needs the fully parsed page.
     */
    protected final void pageCheck(@NotNull String id, @NotNull String name, int maxPoints,
                                   @NotNull Check.Evaluator evaluator) {
        _checks.add(new Check(id, name, maxPoints, EnumSet.of(EvidenceKind.HTML), true, evaluator));
    }

    /**
     * Grades a count of findings: none passes, fewer than {@code failAt} warns with the given points,
     * anything else fails.
     */
    protected static CheckOutcome graded(int count, int failAt, int warnPoints, @NotNull String passDescription,
                                         @NotNull String findingDescription) {
        if (count == 0)
            return CheckOutcome.pass(passDescription);
        if (count < failAt)
            return CheckOutcome.warn(warnPoints, findingDescription);
        return CheckOutcome.fail(findingDescription);
    }
}
