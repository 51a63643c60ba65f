package cz.vut.fit.urlradar.engine.features;

import org.jetbrains.annotations.Nullable;

import java.net.IDN;
import java.util.Locale;

/**
 * Detection of look-alike characters in host names.
 *
 * @author URLRadar developers
 */
public final class Homoglyphs {
    private static final String LOOKALIKES = "аеорсухіјѕԁɡһԛԝаАЕРОСУХΑΒΕΗΙΚΜΝΟΡΤΧΥΖοαν";

    private Homoglyphs() {
    }

    /**
     * Returns true if the host (in Unicode or punycode form) contains characters that imitate Latin letters.
     */
    public static boolean contains(@Nullable String host) {
        if (host == null || host.isEmpty())
            return false;

        String unicode = host;
        if (host.toLowerCase(Locale.ROOT).contains("xn--")) {
            try {
                unicode = IDN.toUnicode(host, IDN.ALLOW_UNASSIGNED);
            } catch (IllegalArgumentException e) {
                // malformed punycode is suspicious by itself
                return true;
            }
        }

        for (int i = 0; i < unicode.length(); i++) {
            if (LOOKALIKES.indexOf(unicode.charAt(i)) >= 0)
                return true;
        }
        return false;
    }
}
