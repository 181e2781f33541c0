package ai.docsite.mdlint.reflow.sentence;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class AbbreviationTableTest {

    @Test
    void matchesWholeWordsIgnoringCase() {
        AbbreviationTable table = AbbreviationTable.defaults();

        assertThat(table.contains("Dr")).isTrue();
        assertThat(table.contains("MRS")).isTrue();
        assertThat(table.contains("e.g")).isTrue();
        assertThat(table.contains("paradigms")).isFalse();
        assertThat(table.contains("")).isFalse();
        assertThat(table.contains(null)).isFalse();
    }

    @Test
    void wordAlreadyEndingInPeriodIsNotAnAbbreviation() {
        AbbreviationTable table = AbbreviationTable.defaults();

        assertThat(table.contains("Mr.")).isFalse();
        assertThat(table.contains("i.e.")).isFalse();
    }

    @Test
    void extendsBuiltInsWithCustomEntries() {
        AbbreviationTable table = AbbreviationTable.withCustom(List.of("etc.", " Fig ", ""));

        assertThat(table.contains("etc")).isTrue();
        assertThat(table.contains("fig")).isTrue();
        assertThat(table.contains("Dr")).isTrue();
        assertThat(AbbreviationTable.defaults().contains("etc")).isFalse();
        assertThat(AbbreviationTable.withCustom(List.of())).isSameAs(AbbreviationTable.defaults());
    }
}
