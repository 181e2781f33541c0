package ai.docsite.mdlint.reflow;

import ai.docsite.mdlint.reflow.block.Block;
import ai.docsite.mdlint.reflow.block.BlockClassifier;
import ai.docsite.mdlint.reflow.block.BlockKind;
import ai.docsite.mdlint.reflow.block.DefaultBlockClassifier;
import ai.docsite.mdlint.reflow.block.SourceLine;
import ai.docsite.mdlint.reflow.pack.Token;
import ai.docsite.mdlint.reflow.sentence.Sentence;
import ai.docsite.mdlint.reflow.span.AtomicSpanScanner;
import ai.docsite.mdlint.reflow.span.DefaultAtomicSpanScanner;
import ai.docsite.mdlint.reflow.span.ProtectedSpan;
import ai.docsite.mdlint.reflow.width.WidthMeasurer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies the document into blocks and rewraps the prose blocks; every other block is copied
 * verbatim. Stateless, so one instance may be shared between threads.
 */
public class DefaultReflower implements Reflower {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultReflower.class);
    private static final String SPACE_BREAK = "  ";
    private static final String BACKSLASH_BREAK = "\\";

    private final BlockClassifier classifier;
    private final AtomicSpanScanner scanner;

    public DefaultReflower() {
        this(new DefaultBlockClassifier(), new DefaultAtomicSpanScanner());
    }

    public DefaultReflower(BlockClassifier classifier, AtomicSpanScanner scanner) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    @Override
    public String reflowMarkdown(String text, ReflowOptions options) {
        Objects.requireNonNull(text, "text");
        ReflowContext context = ReflowContext.of(options);
        if (text.isEmpty()) {
            return text;
        }
        String lineEnding = lineEnding(text);
        List<Block> blocks = classifier.classify(text);
        StringBuilder result = new StringBuilder(text.length() + text.length() / 8);
        int reflowed = 0;
        for (Block block : blocks) {
            if (!block.isReflowable()) {
                result.append(text, block.start(), block.end());
                continue;
            }
            result.append(String.join(lineEnding, layout(block, context)));
            if (endsWithTerminator(text, block)) {
                result.append(lineEnding);
            }
            reflowed++;
        }
        LOGGER.debug("Reflowed {} of {} blocks ({} characters)", reflowed, blocks.size(), text.length());
        return result.toString();
    }

    @Override
    public List<String> reflowLine(String text, ReflowOptions options) {
        Objects.requireNonNull(text, "text");
        ReflowContext context = ReflowContext.of(options);
        if (options.sentenceMode()) {
            int width = options.semanticLineBreaks() ? options.lineLength() : 0;
            List<String> lines = sentenceLines(text, "", "", width, context);
            return lines.isEmpty() ? List.of(text) : lines;
        }
        if (fits(text, options)) {
            return List.of(text);
        }
        List<String> lines = context.packer().pack(context.tokenizer().tokenize(text, scanner.scan(text)),
                options.lineLength(), "");
        return lines.isEmpty() ? List.of(text) : lines;
    }

    @Override
    public Optional<ParagraphReflow> reflowParagraphAtLine(String text, int lineNumber, ReflowOptions options) {
        Objects.requireNonNull(text, "text");
        ReflowContext context = ReflowContext.of(options);
        List<SourceLine> lines = SourceLine.split(text);
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return Optional.empty();
        }
        int offset = lines.get(lineNumber - 1).start();
        for (Block block : classifier.classify(text)) {
            if (offset < block.start() || offset >= block.end()) {
                continue;
            }
            if (!block.isReflowable()) {
                LOGGER.debug("Line {} belongs to a {} block, nothing to reflow", lineNumber, block.kind());
                return Optional.empty();
            }
            String lineEnding = lineEnding(text);
            String replacement = String.join(lineEnding, layout(block, context));
            if (endsWithTerminator(text, block)) {
                replacement += lineEnding;
            }
            return Optional.of(new ParagraphReflow(block.start(), block.end(), replacement));
        }
        return Optional.empty();
    }

    private List<String> layout(Block block, ReflowContext context) {
        ReflowOptions options = context.options();
        List<Segment> segments = segments(block.lines(), options.preserveBreaks());
        List<String> output = new ArrayList<>();
        for (Segment segment : segments) {
            String firstPrefix = output.isEmpty() ? block.prefix() : block.continuationPrefix();
            List<String> lines = layoutSegment(block.kind(), segment, firstPrefix, block.continuationPrefix(), context);
            if (segment.marker() != null && !lines.isEmpty()) {
                int last = lines.size() - 1;
                lines.set(last, lines.get(last) + segment.marker());
            }
            output.addAll(lines);
        }
        return output;
    }

    private List<String> layoutSegment(BlockKind kind, Segment segment, String firstPrefix, String indent,
                                       ReflowContext context) {
        ReflowOptions options = context.options();
        if (kind == BlockKind.DEFINITION_ENTRY && options.sentenceMode()) {
            int width = options.semanticLineBreaks() ? options.lineLength() : 0;
            return widthLines(segment, firstPrefix, indent, width, context);
        }
        if (options.sentenceMode()) {
            int width = options.semanticLineBreaks() ? options.lineLength() : 0;
            return sentenceLines(segment.text(), firstPrefix, indent, width, context);
        }
        return widthLines(segment, firstPrefix, indent, options.lineLength(), context);
    }

    private List<String> widthLines(Segment segment, String firstPrefix, String indent, int width,
                                    ReflowContext context) {
        String text = segment.text();
        if (segment.sourceLines() == 1
                && (width == 0 || WidthMeasurer.measure(firstPrefix + text, context.options().lengthMode()) <= width)) {
            List<String> lines = new ArrayList<>(1);
            lines.add(firstPrefix + text);
            return lines;
        }
        List<Token> tokens = context.tokenizer().tokenize(text, scanner.scan(text));
        return context.packer().pack(tokens, width, firstPrefix, indent);
    }

    private List<String> sentenceLines(String text, String firstPrefix, String indent, int width,
                                       ReflowContext context) {
        List<ProtectedSpan> spans = scanner.scan(text);
        List<Token> tokens = new ArrayList<>();
        for (Sentence sentence : context.splitter().split(text, spans)) {
            List<Token> sentenceTokens = context.tokenizer().tokenize(text, sentence.start(), sentence.end(), spans,
                    span -> span.isEmphasis() ? context.continuation().wrap(text, span) : null);
            if (sentenceTokens.isEmpty()) {
                continue;
            }
            int last = sentenceTokens.size() - 1;
            sentenceTokens.set(last, sentenceTokens.get(last).endingSentence());
            tokens.addAll(sentenceTokens);
        }
        return context.packer().packSentences(tokens, width, firstPrefix, indent);
    }

    /**
     * Splits block content into runs of lines that may be joined: at every hard break, or at every
     * line when breaks are preserved. The last line of a block never carries a hard break.
     */
    private static List<Segment> segments(List<String> lines, boolean preserveBreaks) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean last = i == lines.size() - 1;
            String marker = last ? null : hardBreak(line);
            String content = line.stripTrailing();
            if (BACKSLASH_BREAK.equals(marker)) {
                content = content.substring(0, content.length() - 1).stripTrailing();
            }
            if (!content.isEmpty()) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(content);
                count++;
            }
            if ((marker != null || preserveBreaks || last) && text.length() > 0) {
                segments.add(new Segment(text.toString(), count, marker));
                text.setLength(0);
                count = 0;
            }
        }
        return segments;
    }

    private static String hardBreak(String line) {
        String content = line.stripTrailing();
        if (content.isEmpty()) {
            return null;
        }
        if (content.length() < line.length()) {
            return line.endsWith(SPACE_BREAK) ? SPACE_BREAK : null;
        }
        int backslashes = 0;
        for (int i = content.length() - 1; i >= 0 && content.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1 && backslashes < content.length() ? BACKSLASH_BREAK : null;
    }

    private static boolean fits(String text, ReflowOptions options) {
        return options.lineLength() == 0 || WidthMeasurer.measure(text, options.lengthMode()) <= options.lineLength();
    }

    private static String lineEnding(String text) {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    private static boolean endsWithTerminator(String text, Block block) {
        return block.end() > block.start() && text.charAt(block.end() - 1) == '\n';
    }

    /**
     * @param sourceLines number of non-blank source lines joined into {@code text}
     * @param marker      hard-break marker to restore after the last emitted line, if any
     */
    private record Segment(String text, int sourceLines, String marker) {
    }
}
