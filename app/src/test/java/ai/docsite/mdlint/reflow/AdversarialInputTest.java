package ai.docsite.mdlint.reflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class AdversarialInputTest {

    private static final int SIZE = 100_000;
    private static final Duration LIMIT = Duration.ofSeconds(2);

    private final DefaultReflower reflower = new DefaultReflower();

    @Test
    void punctuationRunsStayLinear() {
        assertCompletes(".".repeat(SIZE));
        assertCompletes(". ".repeat(SIZE / 2));
        assertCompletes("( ".repeat(SIZE / 2));
        assertCompletes("A. ".repeat(SIZE / 3));
        assertCompletes("!".repeat(SIZE / 2) + "'".repeat(SIZE / 2) + " Next.");
    }

    @Test
    void unbalancedDelimitersStayLinear() {
        assertCompletes("[".repeat(SIZE));
        assertCompletes("[".repeat(SIZE / 2) + "]".repeat(SIZE / 2));
        assertCompletes("*a ".repeat(SIZE / 3));
        assertCompletes("x " + "`".repeat(SIZE));
        assertCompletes("$ ".repeat(SIZE / 2));
        assertCompletes("x " + "<a ".repeat(SIZE / 3));
        assertCompletes("{{ ".repeat(SIZE / 3));
        assertCompletes("&".repeat(SIZE));
        assertCompletes(":a".repeat(SIZE / 2));
    }

    @Test
    void deepStructuresStayLinear() {
        assertCompletes("> ".repeat(SIZE / 2) + "text");
        assertCompletes("- item\n".repeat(SIZE / 7));
        assertCompletes("1. ".repeat(SIZE / 3));
        assertCompletes("\u200B\u0007".repeat(SIZE / 2));
    }

    @Test
    void sentenceModeStaysLinear() {
        ReflowOptions options = ReflowOptions.defaults().withSentencePerLine(true);

        String emphasis = "*" + "One. ".repeat(SIZE / 5) + "End.*";
        String result = assertTimeout(LIMIT, () -> reflower.reflowMarkdown(emphasis, options));

        assertThat(result).startsWith("*One.*\n");
        assertTimeout(LIMIT, () -> reflower.reflowMarkdown("Dr. ".repeat(SIZE / 4), options));
    }

    private void assertCompletes(String input) {
        String result = assertTimeout(LIMIT, () -> reflower.reflowMarkdown(input, ReflowOptions.defaults().withLineLength(40)));
        assertThat(result).isNotNull();
    }
}
