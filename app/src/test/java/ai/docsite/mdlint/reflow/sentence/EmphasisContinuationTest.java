package ai.docsite.mdlint.reflow.sentence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.mdlint.reflow.span.DefaultAtomicSpanScanner;
import ai.docsite.mdlint.reflow.span.ProtectedSpan;
import ai.docsite.mdlint.reflow.span.SpanKind;
import org.junit.jupiter.api.Test;

class EmphasisContinuationTest {

    private final EmphasisContinuation continuation =
            new EmphasisContinuation(new SentenceSplitter(AbbreviationTable.defaults()));
    private final DefaultAtomicSpanScanner scanner = new DefaultAtomicSpanScanner();

    @Test
    void repeatsDelimiterAroundEachSentence() {
        String text = "*First sentence. Second sentence.*";

        assertThat(continuation.wrap(text, scanner.scan(text).get(0)))
                .containsExactly("*First sentence.*", "*Second sentence.*");
    }

    @Test
    void keepsBoldDelimiterLength() {
        String text = "**Keep going. Almost there. Done.**";

        assertThat(continuation.wrap(text, scanner.scan(text).get(0)))
                .containsExactly("**Keep going.**", "**Almost there.**", "**Done.**");
    }

    @Test
    void leavesSingleSentenceUntouched() {
        String text = "**Only one sentence.**";

        assertThat(continuation.wrap(text, scanner.scan(text).get(0))).containsExactly(text);
    }

    @Test
    void rejectsNonEmphasisSpans() {
        assertThatThrownBy(() -> continuation.wrap("`x`", ProtectedSpan.leaf(SpanKind.INLINE_CODE, 0, 3)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
