package ai.docsite.mdlint.reflow;

import ai.docsite.mdlint.reflow.width.LengthMode;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of one reflow invocation.
 *
 * @param lineLength      target width, 0 for unlimited
 * @param abbreviations   extra abbreviations merged with the built-in ones; matched
 *                        case-insensitively, the trailing period is optional
 */
public record ReflowOptions(
        int lineLength,
        boolean breakOnSentences,
        boolean preserveBreaks,
        boolean sentencePerLine,
        boolean semanticLineBreaks,
        Set<String> abbreviations,
        LengthMode lengthMode
) {

    public static final int DEFAULT_LINE_LENGTH = 80;

    public ReflowOptions {
        if (lineLength < 0) {
            throw new IllegalArgumentException("lineLength must be zero or greater");
        }
        abbreviations = Set.copyOf(Objects.requireNonNull(abbreviations, "abbreviations"));
        Objects.requireNonNull(lengthMode, "lengthMode");
    }

    public static ReflowOptions defaults() {
        return new ReflowOptions(DEFAULT_LINE_LENGTH, true, false, false, false, Set.of(), LengthMode.CHARS);
    }

    public ReflowOptions withLineLength(int value) {
        return new ReflowOptions(value, breakOnSentences, preserveBreaks, sentencePerLine, semanticLineBreaks,
                abbreviations, lengthMode);
    }

    public ReflowOptions withBreakOnSentences(boolean value) {
        return new ReflowOptions(lineLength, value, preserveBreaks, sentencePerLine, semanticLineBreaks,
                abbreviations, lengthMode);
    }

    public ReflowOptions withPreserveBreaks(boolean value) {
        return new ReflowOptions(lineLength, breakOnSentences, value, sentencePerLine, semanticLineBreaks,
                abbreviations, lengthMode);
    }

    public ReflowOptions withSentencePerLine(boolean value) {
        return new ReflowOptions(lineLength, breakOnSentences, preserveBreaks, value, semanticLineBreaks,
                abbreviations, lengthMode);
    }

    public ReflowOptions withSemanticLineBreaks(boolean value) {
        return new ReflowOptions(lineLength, breakOnSentences, preserveBreaks, sentencePerLine, value,
                abbreviations, lengthMode);
    }

    public ReflowOptions withAbbreviations(Set<String> value) {
        return new ReflowOptions(lineLength, breakOnSentences, preserveBreaks, sentencePerLine, semanticLineBreaks,
                value, lengthMode);
    }

    public ReflowOptions withLengthMode(LengthMode value) {
        return new ReflowOptions(lineLength, breakOnSentences, preserveBreaks, sentencePerLine, semanticLineBreaks,
                abbreviations, value);
    }

    /**
     * Whether paragraphs are laid out one sentence per line rather than wrapped to the width.
     */
    public boolean sentenceMode() {
        return (sentencePerLine || semanticLineBreaks) && breakOnSentences;
    }
}
