package ai.docsite.mdlint.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ReflowModeTest {

    @Test
    void parsesDashedAndMixedCaseNames() {
        assertThat(ReflowMode.from("sentence-per-line")).isEqualTo(ReflowMode.SENTENCE_PER_LINE);
        assertThat(ReflowMode.from(" Normalize ")).isEqualTo(ReflowMode.NORMALIZE);
        assertThat(ReflowMode.from("SEMANTIC_LINE_BREAKS")).isEqualTo(ReflowMode.SEMANTIC_LINE_BREAKS);
        assertThat(ReflowMode.from(null)).isEqualTo(ReflowMode.DEFAULT);
        assertThat(ReflowMode.from(" ")).isEqualTo(ReflowMode.DEFAULT);
    }

    @Test
    void rejectsUnknownMode() {
        assertThatThrownBy(() -> ReflowMode.from("wrap-everything"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("wrap-everything");
    }

    @Test
    void warningRequiresOverflow() {
        assertThatThrownBy(() -> new LineLengthWarning(1, 20, 20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LineLengthWarning(0, 21, 20)).isInstanceOf(IllegalArgumentException.class);
    }
}
