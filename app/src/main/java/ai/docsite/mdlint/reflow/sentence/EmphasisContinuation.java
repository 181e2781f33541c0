package ai.docsite.mdlint.reflow.sentence;

import ai.docsite.mdlint.reflow.span.ProtectedSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Re-wraps an emphasis span that holds several sentences so that each sentence carries its own
 * copy of the delimiter: {@code *One. Two.*} becomes {@code *One.*} and {@code *Two.*}.
 */
public final class EmphasisContinuation {

    private final SentenceSplitter splitter;

    public EmphasisContinuation(SentenceSplitter splitter) {
        this.splitter = Objects.requireNonNull(splitter, "splitter");
    }

    /**
     * Returns one string per sentence of the interior, or the span text unchanged when the interior
     * is a single sentence.
     */
    public List<String> wrap(String text, ProtectedSpan emphasis) {
        Objects.requireNonNull(text, "text");
        if (emphasis == null || !emphasis.isEmphasis()) {
            throw new IllegalArgumentException("An emphasis span is required");
        }
        List<Sentence> sentences = splitter.split(text, emphasis.contentStart(), emphasis.contentEnd(), emphasis.children());
        if (sentences.size() < 2) {
            return List.of(emphasis.text(text));
        }
        String delimiter = emphasis.marker().delimiter();
        List<String> pieces = new ArrayList<>(sentences.size());
        for (Sentence sentence : sentences) {
            pieces.add(delimiter + sentence.text(text) + delimiter);
        }
        return pieces;
    }
}
