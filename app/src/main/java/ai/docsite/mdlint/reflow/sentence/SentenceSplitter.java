package ai.docsite.mdlint.reflow.sentence;

import ai.docsite.mdlint.reflow.span.ProtectedSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits inline text into sentences in a single left-to-right pass. Terminators inside protected
 * spans are ignored; the end of an emphasis span whose interior ends a sentence is a candidate
 * boundary of its own.
 */
public final class SentenceSplitter {

    private final AbbreviationTable abbreviations;

    public SentenceSplitter(AbbreviationTable abbreviations) {
        this.abbreviations = Objects.requireNonNull(abbreviations, "abbreviations");
    }

    public List<Sentence> split(String text, List<ProtectedSpan> spans) {
        return split(text, 0, text.length(), spans);
    }

    /**
     * @param spans spans inside {@code [from, to)}, sorted and non-overlapping
     */
    public List<Sentence> split(String text, int from, int to, List<ProtectedSpan> spans) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(spans, "spans");
        if (from < 0 || to > text.length() || from > to) {
            throw new IllegalArgumentException("Invalid range: [" + from + ", " + to + ")");
        }
        List<Sentence> sentences = new ArrayList<>();
        int sentenceStart = skipWhitespace(text, from, to);
        int spanIndex = 0;
        while (spanIndex < spans.size() && spans.get(spanIndex).end() <= sentenceStart) {
            spanIndex++;
        }
        int i = sentenceStart;
        while (i < to) {
            if (spanIndex < spans.size() && i >= spans.get(spanIndex).start()) {
                ProtectedSpan span = spans.get(spanIndex++);
                i = Math.max(i, span.end());
                int[] boundary = span.isEmphasis() ? boundaryAfterEmphasis(text, span, to) : null;
                if (boundary != null) {
                    sentences.add(new Sentence(sentenceStart, boundary[0]));
                    sentenceStart = boundary[1];
                    i = boundary[1];
                }
                continue;
            }
            char ch = text.charAt(i);
            if (isCjkTerminator(ch)) {
                int end = skipClosers(text, i + 1, to);
                int next = skipWhitespace(text, end, to);
                if (next < to) {
                    sentences.add(new Sentence(sentenceStart, end));
                    sentenceStart = next;
                    i = next;
                } else {
                    i = end;
                }
                continue;
            }
            if (ch == '.' || ch == '!' || ch == '?') {
                int[] boundary = asciiBoundary(text, i, to);
                if (boundary != null && (ch != '.' || !precededByAbbreviation(text, sentenceStart, i))) {
                    sentences.add(new Sentence(sentenceStart, boundary[0]));
                    sentenceStart = boundary[1];
                    i = boundary[1];
                    continue;
                }
            }
            i++;
        }
        int end = trimTrailingWhitespace(text, sentenceStart, to);
        if (end > sentenceStart) {
            sentences.add(new Sentence(sentenceStart, end));
        }
        return sentences;
    }

    /**
     * Returns {sentenceEnd, nextSentenceStart} when the ASCII terminator at {@code index} ends a
     * sentence, or {@code null}.
     */
    private int[] asciiBoundary(String text, int index, int to) {
        int end = index + 1;
        while (end < to && (isClosingQuote(text.charAt(end)) || isInlineMarker(text.charAt(end)))) {
            end++;
        }
        if (end >= to || !Character.isWhitespace(text.charAt(end))) {
            return null;
        }
        int next = skipWhitespace(text, end, to);
        return next < to && startsSentence(text, next, to) ? new int[] {end, next} : null;
    }

    private int[] boundaryAfterEmphasis(String text, ProtectedSpan span, int to) {
        char terminator = interiorTerminator(text, span);
        if (terminator == 0) {
            return null;
        }
        if (isCjkTerminator(terminator)) {
            int end = skipClosers(text, span.end(), to);
            int next = skipWhitespace(text, end, to);
            return next < to ? new int[] {end, next} : null;
        }
        return asciiBoundary(text, span.end() - 1, to);
    }

    /**
     * The terminator ending an emphasis interior, looking through trailing quotes and nested
     * emphasis, or 0 when the interior does not end a sentence.
     */
    private char interiorTerminator(String text, ProtectedSpan span) {
        ProtectedSpan current = span;
        while (true) {
            int from = current.contentStart();
            int last = current.contentEnd() - 1;
            while (last >= from && (Character.isWhitespace(text.charAt(last)) || isClosingQuote(text.charAt(last)))) {
                last--;
            }
            if (last < from) {
                return 0;
            }
            List<ProtectedSpan> children = current.children();
            if (!children.isEmpty()) {
                ProtectedSpan tail = children.get(children.size() - 1);
                if (tail.isEmphasis() && tail.end() == last + 1) {
                    current = tail;
                    continue;
                }
            }
            char ch = text.charAt(last);
            if (isCjkTerminator(ch) || ch == '!' || ch == '?') {
                return ch;
            }
            if (ch == '.' && !precededByAbbreviation(text, from, last)) {
                return ch;
            }
            return 0;
        }
    }

    private boolean precededByAbbreviation(String text, int lowerBound, int period) {
        int wordStart = period;
        while (wordStart > lowerBound && !Character.isWhitespace(text.charAt(wordStart - 1))) {
            wordStart--;
        }
        while (wordStart < period && isWordPrefix(text.charAt(wordStart))) {
            wordStart++;
        }
        return wordStart < period && abbreviations.contains(text.substring(wordStart, period));
    }

    private static boolean startsSentence(String text, int index, int to) {
        int i = index;
        while (i < to && (isOpeningQuote(text.charAt(i)) || isInlineMarker(text.charAt(i)))) {
            i++;
        }
        if (i >= to) {
            return false;
        }
        int codePoint = text.codePointAt(i);
        return Character.isUpperCase(codePoint) || Character.isTitleCase(codePoint) || isCjk(codePoint);
    }

    private static int skipClosers(String text, int from, int to) {
        int i = from;
        while (i < to && (isClosingQuote(text.charAt(i)) || isCjkCloser(text.charAt(i)))) {
            i++;
        }
        return i;
    }

    private static int skipWhitespace(String text, int from, int to) {
        int i = from;
        while (i < to && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int trimTrailingWhitespace(String text, int from, int to) {
        int end = to;
        while (end > from && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    static boolean isCjkTerminator(char ch) {
        return ch == '。' || ch == '！' || ch == '？';
    }

    static boolean isCjk(int codePoint) {
        return (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
                || (codePoint >= 0x3400 && codePoint <= 0x4DBF)
                || (codePoint >= 0x3040 && codePoint <= 0x309F)
                || (codePoint >= 0x30A0 && codePoint <= 0x30FF)
                || (codePoint >= 0xAC00 && codePoint <= 0xD7AF);
    }

    private static boolean isClosingQuote(char ch) {
        return ch == '"' || ch == '\'' || ch == '”' || ch == '’' || ch == '»' || ch == '›';
    }

    private static boolean isOpeningQuote(char ch) {
        return ch == '"' || ch == '\'' || ch == '“' || ch == '‘' || ch == '«' || ch == '‹';
    }

    private static boolean isCjkCloser(char ch) {
        return ch == '」' || ch == '』' || ch == '）' || ch == '】' || ch == '》' || ch == '〉';
    }

    private static boolean isInlineMarker(char ch) {
        return ch == '*' || ch == '_' || ch == '~';
    }

    private static boolean isWordPrefix(char ch) {
        return ch == '(' || ch == '[' || ch == '{' || isOpeningQuote(ch) || isInlineMarker(ch);
    }
}
