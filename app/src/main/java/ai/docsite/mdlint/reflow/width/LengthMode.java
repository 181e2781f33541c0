package ai.docsite.mdlint.reflow.width;

import java.util.Locale;

/**
 * How the length of a line is counted.
 */
public enum LengthMode {
    /** Unicode code points. */
    CHARS,
    /** Terminal columns: wide characters count 2, combining marks 0. */
    VISUAL,
    /** UTF-8 encoded bytes. */
    BYTES;

    public static LengthMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Length mode must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "chars", "characters" -> CHARS;
            case "visual", "display", "visual_width" -> VISUAL;
            case "bytes" -> BYTES;
            default -> throw new IllegalArgumentException("Unsupported length mode: " + raw);
        };
    }
}
