package ai.docsite.mdlint.reflow.span;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultAtomicSpanScannerTest {

    private final AtomicSpanScanner scanner = new DefaultAtomicSpanScanner();

    @Test
    void findsCodeLinksAndImages() {
        String text = "Use `code` with [link](https://x.io) and ![img](a.png).";

        List<ProtectedSpan> spans = scanner.scan(text);

        assertThat(spans)
                .extracting(ProtectedSpan::kind, span -> span.text(text))
                .containsExactly(
                        tuple(SpanKind.INLINE_CODE, "`code`"),
                        tuple(SpanKind.INLINE_LINK, "[link](https://x.io)"),
                        tuple(SpanKind.INLINE_IMAGE, "![img](a.png)"));
    }

    @Test
    void recognizesAllFourLinkedImageShapes() {
        assertThat(single("[![CI](https://ci/badge.svg)](https://ci)")).isEqualTo(SpanKind.LINKED_IMAGE_INLINE_INLINE);
        assertThat(single("[![CI][badge]](https://ci)")).isEqualTo(SpanKind.LINKED_IMAGE_REFERENCE_INLINE);
        assertThat(single("[![CI](badge.svg)][ci]")).isEqualTo(SpanKind.LINKED_IMAGE_INLINE_REFERENCE);
        assertThat(single("[![CI][badge]][ci]")).isEqualTo(SpanKind.LINKED_IMAGE_REFERENCE_REFERENCE);
        assertThat(SpanKind.LINKED_IMAGE_REFERENCE_REFERENCE.category()).isEqualTo(SpanCategory.LINKED_IMAGE);
    }

    @Test
    void distinguishesReferenceLinkForms() {
        assertThat(single("[link][ref]")).isEqualTo(SpanKind.REFERENCE_LINK);
        assertThat(single("[example.com][]")).isEqualTo(SpanKind.COLLAPSED_REFERENCE_LINK);
        assertThat(single("[link]")).isEqualTo(SpanKind.SHORTCUT_REFERENCE_LINK);
        assertThat(single("[[Wiki Page]]")).isEqualTo(SpanKind.WIKI_LINK);
        assertThat(single("![logo][brand]")).isEqualTo(SpanKind.REFERENCE_IMAGE);
    }

    @Test
    void recognizesFootnotes() {
        assertThat(single("[^1]")).isEqualTo(SpanKind.NUMERIC_FOOTNOTE);
        assertThat(single("[^note]")).isEqualTo(SpanKind.NAMED_FOOTNOTE);
        assertThat(single("^[an inline note]")).isEqualTo(SpanKind.INLINE_FOOTNOTE);
    }

    @Test
    void separatesAutolinksFromHtmlTags() {
        assertThat(single("<https://example.com/path>")).isEqualTo(SpanKind.AUTOLINK);
        assertThat(single("<user@example.com>")).isEqualTo(SpanKind.AUTOLINK);
        assertThat(single("<span class=\"x\">")).isEqualTo(SpanKind.HTML_TAG);
        assertThat(single("<!-- note -->")).isEqualTo(SpanKind.HTML_TAG);
        assertThat(single("&nbsp;")).isEqualTo(SpanKind.HTML_ENTITY);
        assertThat(single("&#169;")).isEqualTo(SpanKind.HTML_ENTITY);
    }

    @Test
    void recognizesShortcodesMathAndEmoji() {
        assertThat(single("{{< figure src=\"a.png\" >}}")).isEqualTo(SpanKind.SHORTCODE);
        assertThat(single("{{% notice %}}")).isEqualTo(SpanKind.SHORTCODE);
        assertThat(single("$x^2$")).isEqualTo(SpanKind.INLINE_MATH);
        assertThat(single("$$a + b$$")).isEqualTo(SpanKind.DISPLAY_MATH);
        assertThat(single(":smile:")).isEqualTo(SpanKind.EMOJI_SHORTCODE);
    }

    @Test
    void leavesCurrencyTimesAndIdentifiersAlone() {
        assertThat(scanner.scan("It costs $5 and $10 today.")).isEmpty();
        assertThat(scanner.scan("Meet at 10:30:45 sharp.")).isEmpty();
        assertThat(scanner.scan("call snake_case_name here")).isEmpty();
        assertThat(scanner.scan("2 * 3 * 4")).isEmpty();
    }

    @Test
    void ignoresDelimitersThatDoNotFlankText() {
        assertThat(scanner.scan("Price*, terms apply. See conditions* for details.")).isEmpty();
        assertThat(scanner.scan("foo**, bar**")).isEmpty();
        assertThat(scanner.scan("em*) Why? em*")).isEmpty();
    }

    @Test
    void matchesEmphasisNextToPunctuation() {
        assertThat(scanner.scan("see (*note*) here"))
                .extracting(span -> span.text("see (*note*) here"))
                .containsExactly("*note*");
        assertThat(scanner.scan("**Note:** read this"))
                .extracting(span -> span.text("**Note:** read this"))
                .containsExactly("**Note:**");
        assertThat(single("*`code`*")).isEqualTo(SpanKind.EMPHASIS);
    }

    @Test
    void nestsEmphasisAsTree() {
        String text = "*one **two** three*";

        List<ProtectedSpan> spans = scanner.scan(text);

        assertThat(spans).hasSize(1);
        ProtectedSpan outer = spans.get(0);
        assertThat(outer.isEmphasis()).isTrue();
        assertThat(outer.marker().style()).isEqualTo(EmphasisStyle.ITALIC);
        assertThat(outer.children()).hasSize(1);
        ProtectedSpan inner = outer.children().get(0);
        assertThat(inner.text(text)).isEqualTo("**two**");
        assertThat(inner.marker().style()).isEqualTo(EmphasisStyle.BOLD);
        assertThat(text.substring(outer.contentStart(), outer.contentEnd())).isEqualTo("one **two** three");
    }

    @Test
    void keepsAuthorsMarkerCharacter() {
        String text = "_italic_ and ~~gone~~";

        List<ProtectedSpan> spans = scanner.scan(text);

        assertThat(spans).extracting(span -> span.marker().delimiter()).containsExactly("_", "~~");
        assertThat(spans.get(1).marker().style()).isEqualTo(EmphasisStyle.STRIKETHROUGH);
    }

    @Test
    void ignoresEscapedAndUnbalancedDelimiters() {
        assertThat(scanner.scan("\\*not emphasis\\*")).isEmpty();
        assertThat(scanner.scan("[unclosed and *open")).isEmpty();
        assertThat(scanner.scan("")).isEmpty();
    }

    @Test
    void codeSpanHidesMarkupInside() {
        String text = "`[not a link](x)` and ``a ` b``";

        assertThat(scanner.scan(text))
                .extracting(ProtectedSpan::kind, span -> span.text(text))
                .containsExactly(
                        tuple(SpanKind.INLINE_CODE, "`[not a link](x)`"),
                        tuple(SpanKind.INLINE_CODE, "``a ` b``"));
    }

    private SpanKind single(String text) {
        List<ProtectedSpan> spans = scanner.scan(text);
        assertThat(spans).as("spans of %s", text).hasSize(1);
        assertThat(spans.get(0).start()).isZero();
        assertThat(spans.get(0).end()).isEqualTo(text.length());
        return spans.get(0).kind();
    }
}
