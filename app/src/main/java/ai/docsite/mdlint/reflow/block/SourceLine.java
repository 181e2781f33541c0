package ai.docsite.mdlint.reflow.block;

import java.util.ArrayList;
import java.util.List;

/**
 * One physical line of a document.
 *
 * @param start      offset of the first character
 * @param contentEnd offset just before the line terminator
 * @param end        offset just after the line terminator ({@code \n} or {@code \r\n})
 */
public record SourceLine(int start, int contentEnd, int end, String text) {

    public static List<SourceLine> split(String document) {
        List<SourceLine> lines = new ArrayList<>();
        int start = 0;
        int length = document.length();
        while (start < length) {
            int newline = document.indexOf('\n', start);
            int end = newline < 0 ? length : newline + 1;
            int contentEnd = newline < 0 ? length : newline;
            if (contentEnd > start && document.charAt(contentEnd - 1) == '\r') {
                contentEnd--;
            }
            lines.add(new SourceLine(start, contentEnd, end, document.substring(start, contentEnd)));
            start = end;
        }
        return lines;
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public boolean hasTerminator() {
        return end > contentEnd;
    }
}
