package ai.docsite.mdlint.reflow.pack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.mdlint.reflow.width.LengthMode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LinePackerTest {

    private final LinePacker packer = new LinePacker(LengthMode.CHARS);

    @Test
    void packsGreedily() {
        assertThat(packer.pack(words("aaa bbb ccc ddd"), 7, "")).containsExactly("aaa bbb", "ccc ddd");
    }

    @Test
    void countsPrefixesTowardWidth() {
        assertThat(packer.pack(words("alpha beta gamma"), 10, "- ", "  "))
                .containsExactly("- alpha", "  beta", "  gamma");
    }

    @Test
    void placesOverlongTokenAlone() {
        assertThat(packer.pack(words("a verylongword b"), 5, "")).containsExactly("a", "verylongword", "b");
    }

    @Test
    void zeroWidthMeansOneLine() {
        assertThat(packer.pack(words("one two three four"), 0, "")).containsExactly("one two three four");
        assertThat(packer.pack(List.of(), 10, "")).isEmpty();
    }

    @Test
    void keepsBlockStartingTokensOnPreviousLine() {
        assertThat(packer.pack(words("some text - more"), 10, "")).containsExactly("some text -", "more");
        assertThat(packer.pack(words("items total 1. thing"), 11, "")).containsExactly("items total 1.", "thing");
    }

    @Test
    void neverEndsLineOnTrailingBackslash() {
        assertThat(packer.pack(words("into C:\\ then run"), 9, "")).containsExactly("into C:\\ then", "run");
        assertThat(packer.pack(words("into C:\\\\ then"), 9, "")).containsExactly("into C:\\\\", "then");
    }

    @Test
    void breaksAfterEverySentence() {
        List<Token> tokens = List.of(
                new Token("One.", 4, false, true),
                new Token("Two", 3, false, false),
                new Token("words.", 6, false, true));

        assertThat(packer.packSentences(tokens, 0, "> ", "> ")).containsExactly("> One.", "> Two words.");
    }

    @Test
    void joinsSentenceThatWouldOpenBlock() {
        List<Token> tokens = List.of(
                new Token("Done.", 5, false, true),
                new Token("#", 1, false, false),
                new Token("tag", 3, false, false));

        assertThat(packer.packSentences(tokens, 0, "", "")).containsExactly("Done. # tag");
    }

    @Test
    void wrapsLongSentencesAtWidth() {
        List<Token> tokens = new ArrayList<>(words("aaa bbb ccc"));
        tokens.set(2, tokens.get(2).endingSentence());
        tokens.addAll(words("ddd"));

        assertThat(packer.packSentences(tokens, 7, "", "")).containsExactly("aaa bbb", "ccc", "ddd");
    }

    @Test
    void rejectsNegativeWidth() {
        assertThatThrownBy(() -> packer.pack(words("a"), -1, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Token> words(String text) {
        List<Token> tokens = new ArrayList<>();
        for (String word : text.split(" ")) {
            tokens.add(new Token(word, word.length(), false, false));
        }
        return tokens;
    }
}
