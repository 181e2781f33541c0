package ai.docsite.mdlint.reflow.block;

import ai.docsite.mdlint.reflow.block.LineSyntax.Fence;
import ai.docsite.mdlint.reflow.block.LineSyntax.ListMarker;
import ai.docsite.mdlint.reflow.block.LineSyntax.QuotePrefix;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line-driven classifier. Each step looks at the line where a block starts, decides its kind and
 * consumes the lines belonging to it, so every line lands in exactly one block.
 */
public class DefaultBlockClassifier implements BlockClassifier {

    @Override
    public List<Block> classify(String document) {
        Objects.requireNonNull(document, "document");
        List<SourceLine> lines = SourceLine.split(document);
        List<Block> blocks = new ArrayList<>();
        int index = frontMatter(lines, blocks);
        while (index < lines.size()) {
            int next = classifyAt(lines, index, blocks);
            if (next <= index) {
                throw new IllegalStateException("Classifier made no progress at line " + (index + 1));
            }
            index = next;
        }
        return blocks;
    }

    private int frontMatter(List<SourceLine> lines, List<Block> blocks) {
        if (lines.isEmpty()) {
            return 0;
        }
        String opening = lines.get(0).text().stripTrailing();
        if (!opening.equals("---") && !opening.equals("+++")) {
            return 0;
        }
        for (int j = 1; j < lines.size(); j++) {
            String candidate = lines.get(j).text().stripTrailing();
            if (candidate.equals(opening) || (opening.equals("---") && candidate.equals("..."))) {
                blocks.add(verbatim(BlockKind.FRONT_MATTER, lines, 0, j + 1));
                return j + 1;
            }
        }
        return 0;
    }

    private int classifyAt(List<SourceLine> lines, int i, List<Block> blocks) {
        String text = lines.get(i).text();
        if (text.isBlank()) {
            blocks.add(verbatim(BlockKind.BLANK, lines, i, i + 1));
            return i + 1;
        }
        if (LineSyntax.indentWidth(text) >= 4) {
            return indentedCode(lines, i, blocks);
        }
        Fence fence = LineSyntax.fenceOpening(text);
        if (fence != null) {
            return fencedCode(lines, i, fence, blocks);
        }
        if (LineSyntax.isAtxHeading(text)) {
            blocks.add(verbatim(BlockKind.HEADING, lines, i, i + 1));
            return i + 1;
        }
        if (LineSyntax.isThematicBreak(text)) {
            blocks.add(verbatim(BlockKind.HORIZONTAL_RULE, lines, i, i + 1));
            return i + 1;
        }
        if (startsTable(text, nextText(lines, i))) {
            return table(lines, i, blocks);
        }
        if (LineSyntax.isHtmlBlockStart(text)) {
            return htmlBlock(lines, i, blocks);
        }
        if (LineSyntax.isLinkDefinition(text)) {
            blocks.add(verbatim(BlockKind.LINK_DEFINITION, lines, i, i + 1));
            return i + 1;
        }
        if (LineSyntax.isTemplateDirective(text)) {
            blocks.add(verbatim(BlockKind.TEMPLATE_DIRECTIVE, lines, i, i + 1));
            return i + 1;
        }
        QuotePrefix quote = LineSyntax.quotePrefix(text);
        if (quote != null) {
            return blockquote(lines, i, quote, blocks);
        }
        if (LineSyntax.definitionContentStart(text) >= 0) {
            return definitionEntry(lines, i, blocks);
        }
        ListMarker marker = LineSyntax.listMarker(text);
        if (marker != null) {
            return listItem(lines, i, marker, blocks);
        }
        return paragraph(lines, i, blocks);
    }

    private int indentedCode(List<SourceLine> lines, int i, List<Block> blocks) {
        int j = i + 1;
        while (j < lines.size() && (lines.get(j).isBlank() || LineSyntax.indentWidth(lines.get(j).text()) >= 4)) {
            j++;
        }
        while (j > i + 1 && lines.get(j - 1).isBlank()) {
            j--;
        }
        blocks.add(verbatim(BlockKind.CODE_BLOCK, lines, i, j));
        return j;
    }

    private int fencedCode(List<SourceLine> lines, int i, Fence fence, List<Block> blocks) {
        int j = i + 1;
        while (j < lines.size()) {
            boolean closing = LineSyntax.closesFence(lines.get(j).text(), fence);
            j++;
            if (closing) {
                break;
            }
        }
        blocks.add(verbatim(BlockKind.CODE_BLOCK, lines, i, j));
        return j;
    }

    private int table(List<SourceLine> lines, int i, List<Block> blocks) {
        int j = i + 1;
        while (j < lines.size() && !lines.get(j).isBlank() && lines.get(j).text().indexOf('|') >= 0) {
            j++;
        }
        blocks.add(verbatim(BlockKind.TABLE, lines, i, j));
        return j;
    }

    private int htmlBlock(List<SourceLine> lines, int i, List<Block> blocks) {
        int j;
        if (lines.get(i).text().stripLeading().startsWith("<!--")) {
            j = i;
            while (j < lines.size() && !lines.get(j).text().contains("-->")) {
                j++;
            }
            j = Math.min(j + 1, lines.size());
        } else {
            j = i + 1;
            while (j < lines.size() && !lines.get(j).isBlank()) {
                j++;
            }
        }
        blocks.add(verbatim(BlockKind.HTML_BLOCK, lines, i, j));
        return j;
    }

    private int paragraph(List<SourceLine> lines, int i, List<Block> blocks) {
        int j = i + 1;
        while (j < lines.size()) {
            String text = lines.get(j).text();
            if (text.isBlank()) {
                break;
            }
            if (LineSyntax.isSetextUnderline(text)) {
                blocks.add(verbatim(BlockKind.HEADING, lines, i, j + 1));
                return j + 1;
            }
            if (interruptsParagraph(text, nextText(lines, j))) {
                break;
            }
            j++;
        }
        if (j < lines.size() && LineSyntax.definitionContentStart(lines.get(j).text()) >= 0) {
            if (j - 1 > i) {
                blocks.add(paragraphBlock(lines, i, j - 1));
            }
            blocks.add(verbatim(BlockKind.DEFINITION_TERM, lines, j - 1, j));
            return j;
        }
        blocks.add(paragraphBlock(lines, i, j));
        return j;
    }

    private Block paragraphBlock(List<SourceLine> lines, int from, int to) {
        String first = lines.get(from).text();
        String indent = first.substring(0, LineSyntax.firstNonWhitespace(first));
        List<String> content = new ArrayList<>(to - from);
        for (int k = from; k < to; k++) {
            content.add(lines.get(k).text().stripLeading());
        }
        return new Block(BlockKind.PARAGRAPH, lines.get(from).start(), lines.get(to - 1).end(), content,
                indent, indent, 0);
    }

    private int listItem(List<SourceLine> lines, int i, ListMarker marker, List<Block> blocks) {
        String text = lines.get(i).text();
        if (marker.contentStart() >= text.length()) {
            blocks.add(verbatim(BlockKind.LIST_ITEM, lines, i, i + 1));
            return i + 1;
        }
        String prefix = text.substring(0, marker.contentStart());
        int contentColumn = LineSyntax.columnWidth(prefix);
        List<String> content = new ArrayList<>();
        content.add(text.substring(marker.contentStart()));
        int j = i + 1;
        while (j < lines.size()) {
            String next = lines.get(j).text();
            if (next.isBlank() || LineSyntax.indentWidth(next) < contentColumn || startsConstruct(next)) {
                break;
            }
            content.add(next.stripLeading());
            j++;
        }
        blocks.add(new Block(BlockKind.LIST_ITEM, lines.get(i).start(), lines.get(j - 1).end(), content,
                prefix, " ".repeat(contentColumn), 0));
        return j;
    }

    private int definitionEntry(List<SourceLine> lines, int i, List<Block> blocks) {
        String text = lines.get(i).text();
        int contentStart = LineSyntax.definitionContentStart(text);
        if (contentStart >= text.length()) {
            blocks.add(verbatim(BlockKind.DEFINITION_ENTRY, lines, i, i + 1));
            return i + 1;
        }
        String prefix = text.substring(0, contentStart);
        List<String> content = new ArrayList<>();
        content.add(text.substring(contentStart));
        int j = i + 1;
        while (j < lines.size()) {
            String next = lines.get(j).text();
            if (next.isBlank() || LineSyntax.indentWidth(next) == 0 || startsConstruct(next)) {
                break;
            }
            content.add(next.stripLeading());
            j++;
        }
        blocks.add(new Block(BlockKind.DEFINITION_ENTRY, lines.get(i).start(), lines.get(j - 1).end(), content,
                prefix, " ".repeat(LineSyntax.columnWidth(prefix)), 0));
        return j;
    }

    private int blockquote(List<SourceLine> lines, int i, QuotePrefix quote, List<Block> blocks) {
        String text = lines.get(i).text();
        String inner = text.substring(quote.contentStart());
        int depth = quote.depth();
        String prefix = text.substring(0, quote.contentStart());

        if (inner.isBlank()) {
            blocks.add(verbatim(BlockKind.BLOCKQUOTE, lines, i, i + 1, depth));
            return i + 1;
        }
        if (LineSyntax.indentWidth(inner) >= 4) {
            blocks.add(verbatim(BlockKind.CODE_BLOCK, lines, i, i + 1, depth));
            return i + 1;
        }
        Fence fence = LineSyntax.fenceOpening(inner);
        if (fence != null) {
            int j = i + 1;
            while (j < lines.size()) {
                String nextInner = quotedContent(lines.get(j).text(), depth);
                if (nextInner == null) {
                    break;
                }
                j++;
                if (LineSyntax.closesFence(nextInner, fence)) {
                    break;
                }
            }
            blocks.add(verbatim(BlockKind.CODE_BLOCK, lines, i, j, depth));
            return j;
        }
        BlockKind single = quotedSingleLineKind(inner);
        if (single != null) {
            blocks.add(verbatim(single, lines, i, i + 1, depth));
            return i + 1;
        }
        if (LineSyntax.startsTableRow(inner)) {
            int j = i + 1;
            while (j < lines.size()) {
                String nextInner = quotedContent(lines.get(j).text(), depth);
                if (nextInner == null || nextInner.isBlank() || nextInner.indexOf('|') < 0) {
                    break;
                }
                j++;
            }
            blocks.add(verbatim(BlockKind.TABLE, lines, i, j, depth));
            return j;
        }
        ListMarker marker = LineSyntax.listMarker(inner);
        if (marker != null) {
            return quotedListItem(lines, i, inner, prefix, marker, depth, blocks);
        }

        List<String> content = new ArrayList<>();
        content.add(inner.stripLeading());
        int j = i + 1;
        while (j < lines.size()) {
            String nextInner = quotedContent(lines.get(j).text(), depth);
            if (nextInner == null || nextInner.isBlank()) {
                break;
            }
            if (LineSyntax.isSetextUnderline(nextInner)) {
                blocks.add(verbatim(BlockKind.HEADING, lines, i, j + 1, depth));
                return j + 1;
            }
            if (interruptsParagraph(nextInner, null)) {
                break;
            }
            content.add(nextInner.stripLeading());
            j++;
        }
        blocks.add(new Block(BlockKind.BLOCKQUOTE, lines.get(i).start(), lines.get(j - 1).end(), content,
                prefix, prefix, depth));
        return j;
    }

    private int quotedListItem(List<SourceLine> lines, int i, String inner, String quotePrefix, ListMarker marker,
                               int depth, List<Block> blocks) {
        if (marker.contentStart() >= inner.length()) {
            blocks.add(verbatim(BlockKind.LIST_ITEM, lines, i, i + 1, depth));
            return i + 1;
        }
        String listPrefix = inner.substring(0, marker.contentStart());
        int contentColumn = LineSyntax.columnWidth(listPrefix);
        List<String> content = new ArrayList<>();
        content.add(inner.substring(marker.contentStart()));
        int j = i + 1;
        while (j < lines.size()) {
            String nextInner = quotedContent(lines.get(j).text(), depth);
            if (nextInner == null || nextInner.isBlank() || LineSyntax.indentWidth(nextInner) < contentColumn
                    || startsConstruct(nextInner)) {
                break;
            }
            content.add(nextInner.stripLeading());
            j++;
        }
        blocks.add(new Block(BlockKind.LIST_ITEM, lines.get(i).start(), lines.get(j - 1).end(), content,
                quotePrefix + listPrefix, quotePrefix + " ".repeat(contentColumn), depth));
        return j;
    }

    private static BlockKind quotedSingleLineKind(String inner) {
        if (LineSyntax.isAtxHeading(inner)) {
            return BlockKind.HEADING;
        }
        if (LineSyntax.isThematicBreak(inner)) {
            return BlockKind.HORIZONTAL_RULE;
        }
        if (LineSyntax.isHtmlBlockStart(inner)) {
            return BlockKind.HTML_BLOCK;
        }
        if (LineSyntax.isLinkDefinition(inner)) {
            return BlockKind.LINK_DEFINITION;
        }
        if (LineSyntax.definitionContentStart(inner) >= 0) {
            return BlockKind.DEFINITION_ENTRY;
        }
        return null;
    }

    /**
     * Content of a quoted line at exactly {@code depth}, or {@code null} when the line is not quoted
     * at that depth.
     */
    private static String quotedContent(String line, int depth) {
        QuotePrefix quote = LineSyntax.quotePrefix(line);
        if (quote == null || quote.depth() != depth) {
            return null;
        }
        return line.substring(quote.contentStart());
    }

    private static boolean interruptsParagraph(String line, String nextLine) {
        if (LineSyntax.indentWidth(line) >= 4) {
            return false;
        }
        return LineSyntax.isAtxHeading(line)
                || LineSyntax.fenceOpening(line) != null
                || LineSyntax.isThematicBreak(line)
                || LineSyntax.quotePrefix(line) != null
                || startsTable(line, nextLine)
                || LineSyntax.isHtmlBlockStart(line)
                || LineSyntax.definitionContentStart(line) >= 0
                || LineSyntax.interruptsWithListItem(line);
    }

    /**
     * Whether a line ends a list item or definition body, whatever its indentation.
     */
    private static boolean startsConstruct(String line) {
        String stripped = line.stripLeading();
        return LineSyntax.isAtxHeading(stripped)
                || LineSyntax.fenceOpening(stripped) != null
                || LineSyntax.isThematicBreak(stripped)
                || LineSyntax.quotePrefix(stripped) != null
                || LineSyntax.startsTableRow(stripped)
                || LineSyntax.isHtmlBlockStart(stripped)
                || LineSyntax.definitionContentStart(stripped) >= 0
                || LineSyntax.isLinkDefinition(stripped)
                || LineSyntax.listMarker(stripped) != null;
    }

    private static boolean startsTable(String line, String nextLine) {
        if (LineSyntax.startsTableRow(line)) {
            return true;
        }
        return line.indexOf('|') >= 0 && nextLine != null && LineSyntax.isTableDelimiterRow(nextLine);
    }

    private static String nextText(List<SourceLine> lines, int index) {
        return index + 1 < lines.size() ? lines.get(index + 1).text() : null;
    }

    private static Block verbatim(BlockKind kind, List<SourceLine> lines, int from, int to) {
        return verbatim(kind, lines, from, to, 0);
    }

    private static Block verbatim(BlockKind kind, List<SourceLine> lines, int from, int to, int depth) {
        return Block.verbatim(kind, lines.get(from).start(), lines.get(to - 1).end(), depth);
    }
}
