package ai.docsite.mdlint.reflow.pack;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineStartGuardTest {

    @Test
    void flagsBlockOpeningTokens() {
        for (String token : new String[] {"-", "*", "+", "#", "######", "1.", "12)", ">", ">quote", "|", "```js",
                "~~~", ":", "===", "---", "___", "[id]:", "<div>", "</p>", "<!--", "<?php"}) {
            assertThat(LineStartGuard.wouldStartBlock(token)).as(token).isTrue();
        }
    }

    @Test
    void allowsOrdinaryTokens() {
        for (String token : new String[] {"word", "#######", "-foo", "1234567890.", "1.5", "[link]", "<3",
                "<https://example.com>", "<user@example.com>", "a:", ""}) {
            assertThat(LineStartGuard.wouldStartBlock(token)).as(token).isFalse();
        }
    }

    @Test
    void detectsOddTrailingBackslashes() {
        assertThat(LineStartGuard.wouldEndInHardBreak("C:\\")).isTrue();
        assertThat(LineStartGuard.wouldEndInHardBreak("a\\\\\\")).isTrue();
        assertThat(LineStartGuard.wouldEndInHardBreak("a\\\\")).isFalse();
        assertThat(LineStartGuard.wouldEndInHardBreak("word")).isFalse();
        assertThat(LineStartGuard.wouldEndInHardBreak("")).isFalse();
    }
}
