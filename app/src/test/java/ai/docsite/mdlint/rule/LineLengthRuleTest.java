package ai.docsite.mdlint.rule;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.mdlint.reflow.DefaultReflower;
import ai.docsite.mdlint.reflow.block.DefaultBlockClassifier;
import ai.docsite.mdlint.reflow.width.LengthMode;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LineLengthRuleTest {

    private static final String LONG_LINE = "this line is definitely longer than twenty";

    @Test
    void reportsLinesOverTheLimit() {
        List<LineLengthWarning> warnings = rule(config(20)).check("short\n" + LONG_LINE + "\n");

        assertThat(warnings).containsExactly(new LineLengthWarning(2, 42, 20));
        assertThat(warnings.get(0).message()).isEqualTo("Line length (42/20)");
        assertThat(rule(config(20)).id()).isEqualTo("MD013");
    }

    @Test
    void acceptsSingleUnbreakableWordUnlessStrict() {
        String content = "see https://example.com/a/very/long/url/path\n";
        LineLengthConfig strict = new LineLengthConfig(20, true, false, true, true, true, false,
                ReflowMode.DEFAULT, LengthMode.CHARS, Set.of());

        assertThat(rule(config(20)).check(content)).isEmpty();
        assertThat(rule(strict).check(content)).extracting(LineLengthWarning::line).containsExactly(1);
    }

    @Test
    void followsBlockKindSwitches() {
        String content = "```\naaa bbb ccc ddd eee fff ggg\n```\n\n| aaa bbb ccc ddd eee fff ggg |\n\n"
                + "# aaa bbb ccc ddd eee fff ggg\n";
        LineLengthConfig nothingButTables = new LineLengthConfig(20, false, true, false, true, false, false,
                ReflowMode.DEFAULT, LengthMode.CHARS, Set.of());

        assertThat(rule(config(20)).check(content)).extracting(LineLengthWarning::line).containsExactly(2, 7);
        assertThat(rule(nothingButTables).check(content)).extracting(LineLengthWarning::line).containsExactly(5);
    }

    @Test
    void skipsFrontMatterAndLinkDefinitions() {
        String content = "---\ntitle: aaa bbb ccc ddd eee fff ggg\n---\n[ref]: https://example.com aaa bbb ccc ddd\n";

        assertThat(rule(config(20)).check(content)).isEmpty();
    }

    @Test
    void ignoresHardBreakMarkersWhenMeasuring() {
        assertThat(rule(config(20)).check("abcd efgh ijkl mnopq  \nnext\n")).isEmpty();
        assertThat(rule(config(20)).check("abcd efgh ijkl mnopq\\\nnext\n")).isEmpty();
    }

    @Test
    void zeroLimitDisablesChecks() {
        assertThat(rule(config(0)).check(LONG_LINE.repeat(10))).isEmpty();
    }

    @Test
    void measuresInConfiguredLengthMode() {
        String content = "漢字漢字漢字漢字漢字漢字 x\n";
        LineLengthConfig visual = new LineLengthConfig(20, true, false, true, true, false, false,
                ReflowMode.DEFAULT, LengthMode.VISUAL, Set.of());

        assertThat(rule(config(20)).check(content)).isEmpty();
        assertThat(rule(visual).check(content)).containsExactly(new LineLengthWarning(1, 26, 20));
    }

    @Test
    void fixLeavesContentAloneWhenReflowIsOff() {
        String content = LONG_LINE + "\n";

        assertThat(rule(config(20)).fix(content)).isEqualTo(content);
    }

    @Test
    void defaultModeOnlyTouchesDocumentsWithWarnings() {
        LineLengthRule rule = rule(config(20).withReflow(true, ReflowMode.DEFAULT));

        assertThat(rule.fix("short\nlines\n")).isEqualTo("short\nlines\n");
        assertThat(rule.fix("short line\n" + LONG_LINE + "\n"))
                .isEqualTo("short line\nthis line is\ndefinitely longer\nthan twenty\n");
    }

    @Test
    void otherModesRewrapEveryParagraph() {
        assertThat(rule(config(20).withReflow(true, ReflowMode.NORMALIZE)).fix("short\nlines\n"))
                .isEqualTo("short lines\n");
        assertThat(rule(config(80).withReflow(true, ReflowMode.SENTENCE_PER_LINE)).fix("One here. Two here.\n"))
                .isEqualTo("One here.\nTwo here.\n");
        assertThat(rule(config(20).withReflow(true, ReflowMode.SEMANTIC_LINE_BREAKS))
                .fix("First sentence is fairly long. Short.\n"))
                .isEqualTo("First sentence is\nfairly long.\nShort.\n");
    }

    @Test
    void fixLineRewrapsOnlyThatParagraph() {
        String content = "# T\n\nalpha beta gamma delta\nepsilon\n\nshort\nlines\n";
        LineLengthRule rule = rule(config(12));

        assertThat(rule.fixLine(content, 3)).isEqualTo("# T\n\nalpha beta\ngamma delta\nepsilon\n\nshort\nlines\n");
        assertThat(rule.fixLine(content, 1)).isEqualTo(content);
    }

    private static LineLengthRule rule(LineLengthConfig config) {
        return new LineLengthRule(config, new DefaultBlockClassifier(), new DefaultReflower());
    }

    private static LineLengthConfig config(int lineLength) {
        return new LineLengthConfig(lineLength, true, false, true, true, false, false,
                ReflowMode.DEFAULT, LengthMode.CHARS, Set.of());
    }
}
