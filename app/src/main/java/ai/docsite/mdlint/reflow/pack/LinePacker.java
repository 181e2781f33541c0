package ai.docsite.mdlint.reflow.pack;

import ai.docsite.mdlint.reflow.width.LengthMode;
import ai.docsite.mdlint.reflow.width.WidthMeasurer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy first-fit line packing. Widths include the line prefixes; a width of zero means unlimited.
 */
public final class LinePacker {

    private final LengthMode lengthMode;

    public LinePacker(LengthMode lengthMode) {
        this.lengthMode = Objects.requireNonNull(lengthMode, "lengthMode");
    }

    public List<String> pack(List<Token> tokens, int width, String indent) {
        return pack(tokens, width, "", indent);
    }

    /**
     * Packs {@code tokens} into lines of at most {@code width}. The first line starts with
     * {@code firstPrefix}, every following line with {@code indent}. A token wider than the
     * remaining room starts a new line; a token that is wider than a whole line is placed alone.
     */
    public List<String> pack(List<Token> tokens, int width, String firstPrefix, String indent) {
        validate(tokens, width, firstPrefix, indent);
        List<String> lines = new ArrayList<>();
        if (!tokens.isEmpty()) {
            packInto(lines, tokens, width, firstPrefix, indent);
        }
        return lines;
    }

    /**
     * Starts a new line after every token that ends a sentence, then packs each sentence at
     * {@code width}. A sentence whose first token would open a block, or that follows a trailing
     * backslash, is joined to the previous line instead.
     */
    public List<String> packSentences(List<Token> tokens, int width, String firstPrefix, String indent) {
        validate(tokens, width, firstPrefix, indent);
        List<String> lines = new ArrayList<>();
        int groupStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            boolean last = i == tokens.size() - 1;
            Token token = tokens.get(i);
            if (last || (token.endsSentence() && !LineStartGuard.wouldEndInHardBreak(token.text())
                    && !LineStartGuard.wouldStartBlock(tokens.get(i + 1).text()))) {
                packInto(lines, tokens.subList(groupStart, i + 1), width, lines.isEmpty() ? firstPrefix : indent, indent);
                groupStart = i + 1;
            }
        }
        return lines;
    }

    private void packInto(List<String> lines, List<Token> tokens, int width, String firstPrefix, String indent) {
        int indentWidth = WidthMeasurer.measure(indent, lengthMode);
        StringBuilder line = new StringBuilder(firstPrefix);
        int lineWidth = WidthMeasurer.measure(firstPrefix, lengthMode);
        boolean empty = true;
        boolean hardBreakAhead = false;
        for (Token token : tokens) {
            if (empty) {
                line.append(token.text());
                lineWidth += token.width();
                empty = false;
                hardBreakAhead = LineStartGuard.wouldEndInHardBreak(token.text());
                continue;
            }
            boolean fits = width == 0 || lineWidth + 1 + token.width() <= width;
            if (fits || hardBreakAhead || LineStartGuard.wouldStartBlock(token.text())) {
                line.append(' ').append(token.text());
                lineWidth += 1 + token.width();
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(indent).append(token.text());
                lineWidth = indentWidth + token.width();
            }
            hardBreakAhead = LineStartGuard.wouldEndInHardBreak(token.text());
        }
        lines.add(line.toString());
    }

    private static void validate(List<Token> tokens, int width, String firstPrefix, String indent) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(firstPrefix, "firstPrefix");
        Objects.requireNonNull(indent, "indent");
        if (width < 0) {
            throw new IllegalArgumentException("width must be zero or greater");
        }
    }
}
