package cz.vut.fit.urlradar.engine.features;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Persuasion tactics recognised in page text, shared by the text model and the social-engineering checks.
 *
 * @author URLRadar developers
 */
public final class PersuasionTactics {
    public static final String URGENCY = "urgency";
    public static final String AUTHORITY = "authority";
    public static final String FEAR = "fear";
    public static final String REWARD = "reward";
    public static final String TRUST_EXPLOITATION = "trust_exploitation";

    private static final Map<String, Pattern> TACTICS;

    static {
        final var tactics = new LinkedHashMap<String, Pattern>();
        tactics.put(URGENCY, Pattern.compile("urgent|act now|limited time|expire|hurry|immediate"));
        tactics.put(AUTHORITY, Pattern.compile("verify|confirm|account|suspended|locked|security"));
        tactics.put(FEAR, Pattern.compile("warning|alert|danger|risk|threat|compromised"));
        tactics.put(REWARD, Pattern.compile("\\bwin\\b|prize|reward|bonus|free|gift|claim"));
        tactics.put(TRUST_EXPLOITATION, Pattern.compile("official|legitimate|secure|trusted|certified"));
        TACTICS = Collections.unmodifiableMap(tactics);
    }

    public static final List<String> CREDENTIAL_KEYWORDS = List.of("password", "login", "username", "email",
            "phone", "credit card", "ssn", "account number", "pin");

    private PersuasionTactics() {
    }

    /**
     * Returns the tactics found in the text, in declaration order.
     */
    public static @NotNull List<String> in(@Nullable String text) {
        final var result = new ArrayList<String>();
        if (text == null || text.isEmpty())
            return result;

        final var lower = text.toLowerCase(Locale.ROOT);
        for (var entry : TACTICS.entrySet()) {
            if (entry.getValue().matcher(lower).find())
                result.add(entry.getKey());
        }
        return result;
    }
}
