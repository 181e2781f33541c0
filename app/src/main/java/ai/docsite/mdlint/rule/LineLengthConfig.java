package ai.docsite.mdlint.rule;

import ai.docsite.mdlint.reflow.ReflowOptions;
import ai.docsite.mdlint.reflow.width.LengthMode;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings of the line-length rule.
 *
 * @param codeBlocks whether lines of code blocks are checked
 * @param tables     whether table rows are checked
 * @param strict     when off, a line whose overflow is a single unbreakable word is accepted
 * @param reflow     whether {@link LineLengthRule#fix(String)} rewrites the document
 */
public record LineLengthConfig(
        int lineLength,
        boolean codeBlocks,
        boolean tables,
        boolean headings,
        boolean paragraphs,
        boolean strict,
        boolean reflow,
        ReflowMode reflowMode,
        LengthMode lengthMode,
        Set<String> abbreviations
) {

    public LineLengthConfig {
        if (lineLength < 0) {
            throw new IllegalArgumentException("lineLength must be zero or greater");
        }
        reflowMode = reflowMode == null ? ReflowMode.DEFAULT : reflowMode;
        lengthMode = lengthMode == null ? LengthMode.CHARS : lengthMode;
        abbreviations = abbreviations == null
                ? Set.of()
                : abbreviations.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static LineLengthConfig defaults() {
        return new LineLengthConfig(ReflowOptions.DEFAULT_LINE_LENGTH, true, false, true, true, false, false,
                ReflowMode.DEFAULT, LengthMode.CHARS, Set.of());
    }

    public LineLengthConfig withReflow(boolean enabled, ReflowMode mode) {
        return new LineLengthConfig(lineLength, codeBlocks, tables, headings, paragraphs, strict, enabled,
                Objects.requireNonNull(mode, "mode"), lengthMode, abbreviations);
    }

    /**
     * Engine options for the configured reflow mode.
     */
    public ReflowOptions toReflowOptions() {
        ReflowOptions options = ReflowOptions.defaults()
                .withLineLength(lineLength)
                .withLengthMode(lengthMode)
                .withAbbreviations(abbreviations);
        return switch (reflowMode) {
            case DEFAULT -> options.withPreserveBreaks(true);
            case NORMALIZE -> options;
            case SENTENCE_PER_LINE -> options.withSentencePerLine(true);
            case SEMANTIC_LINE_BREAKS -> options.withSemanticLineBreaks(true);
        };
    }
}
