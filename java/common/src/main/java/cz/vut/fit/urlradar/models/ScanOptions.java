package cz.vut.fit.urlradar.models;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * Per-scan option flags.
 *
 * @param skipScreenshot If true, the screenshot collector and the visual model are not used.
 * @param skipStage2     If true, the deep Stage-2 ensemble is never invoked.
 * @param deadline       The overall deadline of the scan; the configured default is used when null.
 */
public record ScanOptions(boolean skipScreenshot,
                          boolean skipStage2,
                          @Nullable Duration deadline) {

    public static ScanOptions defaults() {
        return new ScanOptions(false, false, null);
    }

    public ScanOptions withDeadline(Duration newDeadline) {
        return new ScanOptions(skipScreenshot, skipStage2, newDeadline);
    }
}
