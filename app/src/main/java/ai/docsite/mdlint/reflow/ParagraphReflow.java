package ai.docsite.mdlint.reflow;

import java.util.Objects;

/**
 * Replacement for the source range {@code [start, end)} of a single reflowed block. The text ends
 * with a line terminator exactly when the range does.
 */
public record ParagraphReflow(int start, int end, String text) {

    public ParagraphReflow {
        Objects.requireNonNull(text, "text");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range: [" + start + ", " + end + ")");
        }
    }
}
