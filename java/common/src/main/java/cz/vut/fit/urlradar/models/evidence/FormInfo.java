package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A form found in the page DOM.
 *
 * @param action            The raw action attribute.
 * @param method            The upper-case submission method.
 * @param targetHost        The host the form submits to, after resolving the action against the page URL.
 * @param submitsToExternal True if the target origin differs from the page origin.
 * @param hasPasswordField  True if the form contains a password input.
 * @param inputTypes        The types of the form inputs.
 * @param inputNames        The names of the form inputs.
 */
public record FormInfo(@Nullable String action,
                       @NotNull String method,
                       @Nullable String targetHost,
                       boolean submitsToExternal,
                       boolean hasPasswordField,
                       @NotNull List<String> inputTypes,
                       @NotNull List<String> inputNames) {

    public FormInfo {
        inputTypes = List.copyOf(inputTypes);
        inputNames = List.copyOf(inputNames);
    }
}
