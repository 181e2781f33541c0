package ai.docsite.mdlint.reflow.span;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProtectedSpanTest {

    @Test
    void rejectsEmptyRangesAndMisplacedMarkers() {
        assertThatThrownBy(() -> ProtectedSpan.leaf(SpanKind.INLINE_CODE, 3, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProtectedSpan.emphasis(null, 0, 4, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProtectedSpan(SpanKind.INLINE_LINK, 0, 5, null,
                List.of(ProtectedSpan.leaf(SpanKind.INLINE_CODE, 1, 3))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exposesEmphasisInterior() {
        ProtectedSpan span = ProtectedSpan.emphasis(new EmphasisMarker('*', 2), 0, 8, List.of());

        assertThat(span.contentStart()).isEqualTo(2);
        assertThat(span.contentEnd()).isEqualTo(6);
        assertThat(span.length()).isEqualTo(8);
        assertThat(span.text("**bold** rest")).isEqualTo("**bold**");
    }

    @Test
    void mapsMarkersToStyles() {
        assertThat(new EmphasisMarker('_', 3).style()).isEqualTo(EmphasisStyle.BOLD_ITALIC);
        assertThat(new EmphasisMarker('~', 1).style()).isEqualTo(EmphasisStyle.SUBSCRIPT);
        assertThat(new EmphasisMarker('^', 1).style()).isEqualTo(EmphasisStyle.SUPERSCRIPT);
        assertThat(new EmphasisMarker('=', 2).style()).isEqualTo(EmphasisStyle.HIGHLIGHT);
        assertThat(new EmphasisMarker('=', 2).delimiter()).isEqualTo("==");
        assertThat(EmphasisMarker.isSupportedRun('~', 3)).isFalse();
        assertThatThrownBy(() -> new EmphasisMarker('#', 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EmphasisMarker('*', 4)).isInstanceOf(IllegalArgumentException.class);
    }
}
