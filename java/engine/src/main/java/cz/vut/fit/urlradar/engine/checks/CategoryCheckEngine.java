package cz.vut.fit.urlradar.engine.checks;

import cz.vut.fit.urlradar.Common;
import cz.vut.fit.urlradar.ResultCodes;
import cz.vut.fit.urlradar.engine.evidence.EvidenceScope;
import cz.vut.fit.urlradar.models.checks.CategoryResult;
import cz.vut.fit.urlradar.models.checks.CheckResult;
import cz.vut.fit.urlradar.models.checks.CheckStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the enabled categories against the evidence of a scan.
 * <p>
 * A category is skipped when the evidence scope of the reachability branch excludes every requirement of
 * every enabled check. Within a running category, a check whose evidence is absent is reported as
 * {@link CheckStatus#INFO} with {@code skipped=true}, scoring 0 of 0; it never reports a false PASS or FAIL.
 *
 * @author URLRadar developers
 */
public class CategoryCheckEngine {
    public static final String COMPONENT_NAME = "checks";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(CategoryCheckEngine.class);

    private final List<Category> _categories;

    public CategoryCheckEngine() {
        this(CategoryRegistry.defaults());
    }

    public CategoryCheckEngine(@NotNull List<Category> categories) {
        _categories = List.copyOf(categories);
    }

    public @NotNull List<Category> categories() {
        return _categories;
    }

    public @NotNull CompletableFuture<List<CategoryResult>> runAsync(@NotNull CheckContext context,
                                                                    @NotNull Executor executor) {
        return CompletableFuture.supplyAsync(() -> run(context), executor);
    }

    /**
     * Runs all enabled categories, in registration order.
     */
    public @NotNull List<CategoryResult> run(@NotNull CheckContext context) {
        final var config = context.config();
        final var results = new ArrayList<CategoryResult>(_categories.size());

        for (var category : _categories) {
            if (!config.categoryEnabled(category.id())) {
                Logger.trace("Category {} disabled", category.id());
                continue;
            }
            results.add(runCategory(category, context));
        }

        Logger.debug("{}: {} categories evaluated", context.url(), results.size());
        return results;
    }

    CategoryResult runCategory(Category category, CheckContext context) {
        final var config = context.config();
        final double weight = config.categoryWeight(category.id());
        final var enabled = category.checks().stream()
                .filter(check -> config.checkEnabled(check.id()))
                .toList();

        if (!enabled.isEmpty() && enabled.stream().allMatch(check -> outOfScope(check, context))) {
            final var reason = "Not applicable to " + context.branch() + " targets";
            Logger.trace("Category {} skipped: {}", category.id(), reason);
            return CategoryResult.skipped(category.id(), category.name(), weight, reason);
        }

        final var checks = new ArrayList<CheckResult>(enabled.size());
        for (var check : enabled) {
            checks.add(runCheck(category, check, context));
        }
        return CategoryResult.of(category.id(), category.name(), weight, checks);
    }

    CheckResult runCheck(Category category, Check check, CheckContext context) {
        final var missing = missingEvidence(check, context);
        if (missing != null)
            return skippedCheck(category, check, missing);

        final var outcome = check.evaluate(context);
        if (!outcome.evaluated())
            return skippedCheck(category, check, outcome.description());

        final int max = check.maxPoints();
        final int points = outcome.points() == null ? max : Math.max(0, Math.min(max, outcome.points()));
        return new CheckResult(check.id(), check.name(), category.id(), outcome.status(), points, max,
                outcome.description(), false, null, outcome.evidence());
    }

    private static boolean outOfScope(Check check, CheckContext context) {
        if (check.urlOnly())
            return false;
        final var scope = EvidenceScope.kindsFor(context.branch());
        return check.requires().stream().noneMatch(scope::contains);
    }

    /**
     * Returns why the evidence required by the check is absent, or null when it is present.
     */
    private static @Nullable String missingEvidence(Check check, CheckContext context) {
        final var evidence = context.evidence();
        for (var kind : check.requires()) {
            if (evidence.has(kind))
                continue;

            final var reason = evidence.unavailableReason(kind);
            final var label = kind.name().toLowerCase(Locale.ROOT);
            return reason == null
                    ? label + " evidence unavailable"
                    : label + " evidence unavailable (" + reason + ")";
        }

        final var dom = evidence.dom();
        if (check.fullPage() && dom != null && dom.lightweight())
            return ResultCodes.nameOf(ResultCodes.SKIPPED) + ": only the page template was inspected";
        return null;
    }

    private static CheckResult skippedCheck(Category category, Check check, String reason) {
        return new CheckResult(check.id(), check.name(), category.id(), CheckStatus.INFO, 0, 0,
                "Not evaluated: " + reason, true, reason, Map.of());
    }
}
