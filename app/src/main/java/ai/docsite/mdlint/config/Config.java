package ai.docsite.mdlint.config;

import ai.docsite.mdlint.rule.LineLengthConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 *
 * @param files Markdown files to check, in the order given
 * @param fix   whether files are rewritten with the reflowed text
 */
public record Config(
        List<Path> files,
        LineLengthConfig lineLength,
        boolean fix,
        boolean verbose,
        LogFormat logFormat
) {

    public Config {
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        Objects.requireNonNull(lineLength, "lineLength");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }
}
