package ai.docsite.mdlint.rule;

import ai.docsite.mdlint.reflow.ParagraphReflow;
import ai.docsite.mdlint.reflow.Reflower;
import ai.docsite.mdlint.reflow.block.Block;
import ai.docsite.mdlint.reflow.block.BlockClassifier;
import ai.docsite.mdlint.reflow.block.BlockKind;
import ai.docsite.mdlint.reflow.block.SourceLine;
import ai.docsite.mdlint.reflow.width.WidthMeasurer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports lines longer than the configured limit and fixes them by rewrapping prose.
 */
public class LineLengthRule {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineLengthRule.class);

    private final LineLengthConfig config;
    private final BlockClassifier classifier;
    private final Reflower reflower;

    public LineLengthRule(LineLengthConfig config, BlockClassifier classifier, Reflower reflower) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.reflower = Objects.requireNonNull(reflower, "reflower");
    }

    public String id() {
        return LineLengthWarning.RULE_ID;
    }

    public List<LineLengthWarning> check(String content) {
        Objects.requireNonNull(content, "content");
        List<LineLengthWarning> warnings = new ArrayList<>();
        if (config.lineLength() == 0 || content.isEmpty()) {
            return warnings;
        }
        List<SourceLine> lines = SourceLine.split(content);
        int lineIndex = 0;
        for (Block block : classifier.classify(content)) {
            boolean checked = isChecked(block.kind());
            while (lineIndex < lines.size() && lines.get(lineIndex).start() < block.end()) {
                if (checked) {
                    measure(lines.get(lineIndex).text(), lineIndex + 1).ifPresent(warnings::add);
                }
                lineIndex++;
            }
        }
        LOGGER.debug("{} found {} over-long lines", id(), warnings.size());
        return warnings;
    }

    /**
     * Rewraps the document according to the configured reflow mode. The content is returned
     * unchanged when reflow is disabled, or in the default mode when no line is over the limit.
     */
    public String fix(String content) {
        Objects.requireNonNull(content, "content");
        if (!config.reflow()) {
            return content;
        }
        if (config.reflowMode() == ReflowMode.DEFAULT && check(content).isEmpty()) {
            return content;
        }
        return reflower.reflowMarkdown(content, config.toReflowOptions());
    }

    /**
     * Rewraps only the paragraph holding the 1-based {@code lineNumber}.
     */
    public String fixLine(String content, int lineNumber) {
        Objects.requireNonNull(content, "content");
        Optional<ParagraphReflow> reflow = reflower.reflowParagraphAtLine(content, lineNumber,
                config.toReflowOptions().withPreserveBreaks(false));
        if (reflow.isEmpty()) {
            return content;
        }
        ParagraphReflow paragraph = reflow.get();
        return content.substring(0, paragraph.start()) + paragraph.text() + content.substring(paragraph.end());
    }

    private boolean isChecked(BlockKind kind) {
        return switch (kind) {
            case FRONT_MATTER, LINK_DEFINITION, BLANK -> false;
            case CODE_BLOCK -> config.codeBlocks();
            case TABLE -> config.tables();
            case HEADING -> config.headings();
            case PARAGRAPH, LIST_ITEM, BLOCKQUOTE, DEFINITION_TERM, DEFINITION_ENTRY -> config.paragraphs();
            default -> true;
        };
    }

    private Optional<LineLengthWarning> measure(String line, int lineNumber) {
        String text = withoutHardBreak(line);
        int length = WidthMeasurer.measure(text, config.lengthMode());
        if (length <= config.lineLength()) {
            return Optional.empty();
        }
        if (!config.strict() && overflowIsSingleWord(text)) {
            return Optional.empty();
        }
        return Optional.of(new LineLengthWarning(lineNumber, length, config.lineLength()));
    }

    private boolean overflowIsSingleWord(String text) {
        int lastSpace = -1;
        for (int i = text.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                lastSpace = i;
                break;
            }
        }
        if (lastSpace < 0 || text.substring(0, lastSpace).isBlank()) {
            return true;
        }
        return WidthMeasurer.measure(text.substring(0, lastSpace), config.lengthMode()) <= config.lineLength();
    }

    private static String withoutHardBreak(String line) {
        String text = line.stripTrailing();
        int backslashes = 0;
        for (int i = text.length() - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1 ? text.substring(0, text.length() - 1) : text;
    }
}
