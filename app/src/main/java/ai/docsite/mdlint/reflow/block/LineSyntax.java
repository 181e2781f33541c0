package ai.docsite.mdlint.reflow.block;

/**
 * Line-level recognizers for the block constructs the classifier distinguishes.
 */
final class LineSyntax {

    private static final int TAB_STOP = 4;
    private static final int MAX_ORDERED_DIGITS = 9;

    private LineSyntax() {
    }

    record Fence(char marker, int length) {
    }

    /**
     * @param indentEnd    offset of the marker
     * @param markerEnd    offset just after the marker
     * @param contentStart offset of the first content character after the marker
     */
    record ListMarker(int indentEnd, int markerEnd, int contentStart) {

        String marker(String line) {
            return line.substring(indentEnd, markerEnd);
        }
    }

    /**
     * @param markerEnd    offset just after the last {@code >}
     * @param contentStart offset after the single optional space following it
     */
    record QuotePrefix(int depth, int markerEnd, int contentStart) {
    }

    static int indentWidth(String line) {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                column++;
            } else if (ch == '\t') {
                column += TAB_STOP - (column % TAB_STOP);
            } else {
                break;
            }
        }
        return column;
    }

    static int columnWidth(String prefix) {
        int column = 0;
        for (int i = 0; i < prefix.length(); i++) {
            column = prefix.charAt(i) == '\t' ? column + TAB_STOP - (column % TAB_STOP) : column + 1;
        }
        return column;
    }

    static int firstNonWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    static boolean isAtxHeading(String line) {
        if (indentWidth(line) > 3) {
            return false;
        }
        int i = firstNonWhitespace(line);
        int hashes = 0;
        while (i < line.length() && line.charAt(i) == '#') {
            hashes++;
            i++;
        }
        return hashes >= 1 && hashes <= 6 && (i == line.length() || line.charAt(i) == ' ' || line.charAt(i) == '\t');
    }

    static Fence fenceOpening(String line) {
        if (indentWidth(line) > 3) {
            return null;
        }
        int start = firstNonWhitespace(line);
        if (start >= line.length()) {
            return null;
        }
        char marker = line.charAt(start);
        if (marker != '`' && marker != '~') {
            return null;
        }
        int i = start;
        while (i < line.length() && line.charAt(i) == marker) {
            i++;
        }
        int length = i - start;
        if (length < 3) {
            return null;
        }
        if (marker == '`' && line.indexOf('`', i) >= 0) {
            return null;
        }
        return new Fence(marker, length);
    }

    static boolean closesFence(String line, Fence fence) {
        if (indentWidth(line) > 3) {
            return false;
        }
        int start = firstNonWhitespace(line);
        int i = start;
        while (i < line.length() && line.charAt(i) == fence.marker()) {
            i++;
        }
        return i - start >= fence.length() && line.substring(i).isBlank();
    }

    static boolean isThematicBreak(String line) {
        if (indentWidth(line) > 3) {
            return false;
        }
        char marker = 0;
        int count = 0;
        for (int i = firstNonWhitespace(line); i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ' || ch == '\t') {
                continue;
            }
            if (ch != '-' && ch != '*' && ch != '_') {
                return false;
            }
            if (marker == 0) {
                marker = ch;
            } else if (ch != marker) {
                return false;
            }
            count++;
        }
        return count >= 3;
    }

    static boolean isSetextUnderline(String line) {
        if (indentWidth(line) > 3) {
            return false;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        char marker = trimmed.charAt(0);
        if (marker != '=' && marker != '-') {
            return false;
        }
        for (int i = 1; i < trimmed.length(); i++) {
            if (trimmed.charAt(i) != marker) {
                return false;
            }
        }
        return true;
    }

    static ListMarker listMarker(String line) {
        int indentEnd = firstNonWhitespace(line);
        if (indentEnd >= line.length()) {
            return null;
        }
        int markerEnd;
        char first = line.charAt(indentEnd);
        if (first == '-' || first == '*' || first == '+') {
            markerEnd = indentEnd + 1;
        } else {
            int i = indentEnd;
            while (i < line.length() && i - indentEnd < MAX_ORDERED_DIGITS
                    && line.charAt(i) >= '0' && line.charAt(i) <= '9') {
                i++;
            }
            if (i == indentEnd || i >= line.length() || (line.charAt(i) != '.' && line.charAt(i) != ')')) {
                return null;
            }
            markerEnd = i + 1;
        }
        if (markerEnd < line.length() && line.charAt(markerEnd) != ' ' && line.charAt(markerEnd) != '\t') {
            return null;
        }
        return new ListMarker(indentEnd, markerEnd, firstNonWhitespaceFrom(line, markerEnd));
    }

    /**
     * List items that may start while a paragraph is open: bullets, and ordered items numbered 1,
     * both with content.
     */
    static boolean interruptsWithListItem(String line) {
        ListMarker marker = listMarker(line);
        if (marker == null || marker.contentStart() >= line.length()) {
            return false;
        }
        String text = marker.marker(line);
        return text.length() == 1 || text.equals("1.") || text.equals("1)");
    }

    /**
     * Offset of the definition body after {@code ":"} and its whitespace, or -1.
     */
    static int definitionContentStart(String line) {
        if (indentWidth(line) > 3) {
            return -1;
        }
        int colon = firstNonWhitespace(line);
        if (colon >= line.length() || line.charAt(colon) != ':') {
            return -1;
        }
        int after = colon + 1;
        if (after >= line.length() || (line.charAt(after) != ' ' && line.charAt(after) != '\t')) {
            return -1;
        }
        return firstNonWhitespaceFrom(line, after);
    }

    static boolean isLinkDefinition(String line) {
        if (indentWidth(line) > 3) {
            return false;
        }
        int open = firstNonWhitespace(line);
        if (open >= line.length() || line.charAt(open) != '[') {
            return false;
        }
        int close = line.indexOf("]:", open);
        if (close <= open + 1) {
            return false;
        }
        String label = line.substring(open + 1, close);
        return label.indexOf('[') < 0 && label.indexOf(']') < 0;
    }

    static boolean isHtmlBlockStart(String line) {
        if (indentWidth(line) > 3) {
            return false;
        }
        int open = firstNonWhitespace(line);
        if (open + 1 >= line.length() || line.charAt(open) != '<') {
            return false;
        }
        char next = line.charAt(open + 1);
        if (next == '/' || next == '!' || next == '?') {
            return true;
        }
        return isAsciiLetter(next) && !isAutolink(line, open);
    }

    private static boolean isAutolink(String line, int open) {
        for (int i = open + 1; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ':' || ch == '@') {
                return true;
            }
            if (ch == '>' || Character.isWhitespace(ch)) {
                return false;
            }
        }
        return false;
    }

    static boolean isTemplateDirective(String line) {
        String trimmed = line.strip();
        return (trimmed.startsWith("{{") && trimmed.endsWith("}}"))
                || (trimmed.startsWith("{%") && trimmed.endsWith("%}"));
    }

    static boolean startsTableRow(String line) {
        return indentWidth(line) <= 3 && line.stripLeading().startsWith("|");
    }

    static boolean isTableDelimiterRow(String line) {
        String trimmed = line.strip();
        if (trimmed.indexOf('-') < 0) {
            return false;
        }
        if (trimmed.startsWith("|")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("|")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        boolean sawPipe = line.indexOf('|') >= 0;
        String[] cells = trimmed.split("\\|", -1);
        for (String cell : cells) {
            String value = cell.strip();
            if (value.startsWith(":")) {
                value = value.substring(1);
            }
            if (value.endsWith(":")) {
                value = value.substring(0, value.length() - 1);
            }
            if (value.isEmpty()) {
                return false;
            }
            for (int i = 0; i < value.length(); i++) {
                if (value.charAt(i) != '-') {
                    return false;
                }
            }
        }
        return sawPipe;
    }

    static QuotePrefix quotePrefix(String line) {
        if (indentWidth(line) > 3) {
            return null;
        }
        int i = firstNonWhitespace(line);
        if (i >= line.length() || line.charAt(i) != '>') {
            return null;
        }
        int depth = 0;
        int markerEnd;
        while (true) {
            depth++;
            markerEnd = i + 1;
            int next = markerEnd < line.length() && line.charAt(markerEnd) == ' ' ? markerEnd + 1 : markerEnd;
            if (next < line.length() && line.charAt(next) == '>') {
                i = next;
            } else {
                break;
            }
        }
        int contentStart = markerEnd < line.length() && line.charAt(markerEnd) == ' ' ? markerEnd + 1 : markerEnd;
        return new QuotePrefix(depth, markerEnd, contentStart);
    }

    private static int firstNonWhitespaceFrom(String line, int from) {
        int i = from;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }
}
