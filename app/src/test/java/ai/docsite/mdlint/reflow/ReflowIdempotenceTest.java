package ai.docsite.mdlint.reflow;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReflowIdempotenceTest {

    private static final String DOCUMENT = String.join("\n",
            "Intro paragraph with a [link](https://example.com/path) and `inline code`, plus some more words"
                    + " to wrap. It also has a second sentence - with a dash - and 1. a number.",
            "",
            "- First item that is long enough to wrap at forty columns for sure.",
            "- Second item with **bold text** and a hard break  ",
            "  after the break we continue writing.",
            "",
            "> Quoted text that also needs wrapping because it is rather long. Another sentence follows.",
            "",
            "1. Numbered item with enough words to wrap at the configured width.",
            "",
            "Term",
            ": Definition that is long enough to be wrapped at forty columns.",
            "",
            "*Emphasized opening sentence. Emphasized closing sentence.* Plain tail # not a heading.",
            "");

    private final DefaultReflower reflower = new DefaultReflower();

    @Test
    void widthReflowIsStable() {
        assertStable(ReflowOptions.defaults().withLineLength(40));
        assertStable(ReflowOptions.defaults().withLineLength(20));
    }

    @Test
    void sentenceReflowIsStable() {
        assertStable(ReflowOptions.defaults().withSentencePerLine(true));
        assertStable(ReflowOptions.defaults().withSemanticLineBreaks(true).withLineLength(40));
    }

    @Test
    void preservedBreaksAreStable() {
        assertStable(ReflowOptions.defaults().withLineLength(30).withPreserveBreaks(true));
    }

    private void assertStable(ReflowOptions options) {
        String once = reflower.reflowMarkdown(DOCUMENT, options);
        String twice = reflower.reflowMarkdown(once, options);

        assertThat(twice).as("second pass with %s", options).isEqualTo(once);
    }
}
