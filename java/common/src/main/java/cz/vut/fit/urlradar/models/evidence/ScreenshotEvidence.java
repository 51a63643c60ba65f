package cz.vut.fit.urlradar.models.evidence;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * A reference to a captured screenshot and flags derived from it by the renderer.
 *
 * @param imageRef  An opaque reference to the stored image.
 * @param mediaType The media type of the image.
 * @param flags     Derived flags (e.g. {@code loginFormVisible}, {@code brandLogoVisible}).
 */
public record ScreenshotEvidence(@NotNull String imageRef,
                                 @Nullable String mediaType,
                                 @NotNull Map<String, Boolean> flags) {

    public ScreenshotEvidence {
        flags = Map.copyOf(flags);
    }

    public boolean flag(@NotNull String name) {
        return Boolean.TRUE.equals(flags.get(name));
    }
}
