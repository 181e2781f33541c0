package ai.docsite.mdlint.rule;

import java.util.Locale;

/**
 * How the line-length autofix rewraps paragraphs.
 */
public enum ReflowMode {
    /** Only lines over the limit are rewrapped; existing line breaks are kept. */
    DEFAULT,
    /** Every paragraph is rewrapped to fill the limit. */
    NORMALIZE,
    SENTENCE_PER_LINE,
    /** One sentence per line, long sentences wrapped at the limit. */
    SEMANTIC_LINE_BREAKS;

    public static ReflowMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ReflowMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported reflow mode: " + raw);
    }
}
