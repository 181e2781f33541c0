package ai.docsite.mdlint.reflow.sentence;

/**
 * A {@code [start, end)} range of one sentence. Whitespace between sentences belongs to neither.
 */
public record Sentence(int start, int end) {

    public Sentence {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid sentence boundaries: [" + start + ", " + end + ")");
        }
    }

    public String text(CharSequence source) {
        return source.subSequence(start, end).toString();
    }
}
