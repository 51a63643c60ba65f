package cz.vut.fit.urlradar.engine.checks.categories;

import cz.vut.fit.urlradar.engine.checks.BaseCategory;
import cz.vut.fit.urlradar.engine.checks.CheckContext;
import cz.vut.fit.urlradar.engine.checks.CheckOutcome;
import cz.vut.fit.urlradar.engine.features.PersuasionTactics;
import cz.vut.fit.urlradar.engine.features.UrlLexicon;
import cz.vut.fit.urlradar.models.evidence.EvidenceKind;

public class SocialEngineeringCategory extends BaseCategory {
    public static final String ID = "social_engineering";

    public SocialEngineeringCategory() {
        super(ID, "Social Engineering");
        check("social_persuasion_tactics", "Persuasion Tactics", 15, SocialEngineeringCategory::tactics,
                EvidenceKind.HTML);
        check("social_reward_bait", "Lures and Pressure Words", 15, SocialEngineeringCategory::bait,
                EvidenceKind.HTML);
    }

    private static CheckOutcome tactics(CheckContext context) {
        final var tactics = PersuasionTactics.in(context.pageText());
        return graded(tactics.size(), 2, 8, "No persuasion tactics detected",
                "Persuasion tactics: " + String.join(", ", tactics))
                .with("tactics", tactics);
    }

    private static CheckOutcome bait(CheckContext context) {
        final var words = UrlLexicon.matches(UrlLexicon.SOCIAL_ENGINEERING_KEYWORDS, context.pageText());
        final CheckOutcome outcome;
        if (words.size() >= 4)
            outcome = CheckOutcome.fail(words.size() + " pressure or lure words");
        else if (words.size() >= 2)
            outcome = CheckOutcome.warn(8, words.size() + " pressure or lure words");
        else
            outcome = CheckOutcome.pass("No significant pressure wording");
        return outcome.with("keywords", words);
    }
}
