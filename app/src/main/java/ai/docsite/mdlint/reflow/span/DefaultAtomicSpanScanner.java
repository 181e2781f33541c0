package ai.docsite.mdlint.reflow.span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-pass scanner for protected spans. Delimiter pairs (brackets, parentheses, backtick runs)
 * are matched once up front, so every recognizer below runs in constant or amortized constant time
 * and the whole scan stays linear in the input length.
 */
public class DefaultAtomicSpanScanner implements AtomicSpanScanner {

    private static final int MAX_ENTITY_NAME = 32;
    private static final int MAX_NUMERIC_ENTITY = 7;
    private static final int MAX_SCHEME = 32;
    private static final int MAX_EMOJI_NAME = 40;

    @Override
    public List<ProtectedSpan> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return new Scan(text).run();
    }

    private static final class Scan {

        private final String text;
        private final int length;
        private final boolean[] escaped;
        private final boolean[] inCode;
        private final int[] codeSpanEnd;
        private final int[] bracketMatch;
        private final int[] parenMatch;
        private final int[] whitespaceBefore;
        private final Map<String, int[]> nextTables = new HashMap<>();

        Scan(String text) {
            this.text = text;
            this.length = text.length();
            this.escaped = new boolean[length];
            this.inCode = new boolean[length];
            this.codeSpanEnd = new int[length];
            this.bracketMatch = new int[length];
            this.parenMatch = new int[length];
            this.whitespaceBefore = new int[length + 1];
            Arrays.fill(codeSpanEnd, -1);
            Arrays.fill(bracketMatch, -1);
            Arrays.fill(parenMatch, -1);
        }

        List<ProtectedSpan> run() {
            markEscapes();
            matchCodeSpans();
            matchBrackets();
            List<ProtectedSpan> leaves = scanLeaves();
            List<EmphasisPair> emphasis = matchEmphasis(leaves);
            return nest(leaves, emphasis);
        }

        private void markEscapes() {
            for (int i = 0; i < length; i++) {
                char ch = text.charAt(i);
                whitespaceBefore[i + 1] = whitespaceBefore[i] + (Character.isWhitespace(ch) ? 1 : 0);
                if (ch == '\\' && !escaped[i] && i + 1 < length) {
                    escaped[i + 1] = true;
                }
            }
        }

        private void matchCodeSpans() {
            List<int[]> runs = new ArrayList<>();
            int i = 0;
            while (i < length) {
                if (text.charAt(i) != '`' || escaped[i]) {
                    i++;
                    continue;
                }
                int start = i;
                while (i < length && text.charAt(i) == '`') {
                    i++;
                }
                runs.add(new int[] {start, i - start});
            }
            int[] nextSameLength = new int[runs.size()];
            Map<Integer, Integer> lastSeen = new HashMap<>();
            for (int r = runs.size() - 1; r >= 0; r--) {
                int runLength = runs.get(r)[1];
                nextSameLength[r] = lastSeen.getOrDefault(runLength, -1);
                lastSeen.put(runLength, r);
            }
            int r = 0;
            while (r < runs.size()) {
                int closer = nextSameLength[r];
                if (closer < 0) {
                    r++;
                    continue;
                }
                int start = runs.get(r)[0];
                int end = runs.get(closer)[0] + runs.get(closer)[1];
                codeSpanEnd[start] = end;
                Arrays.fill(inCode, start, end, true);
                r = closer + 1;
            }
        }

        private void matchBrackets() {
            Deque<Integer> brackets = new ArrayDeque<>();
            Deque<Integer> parens = new ArrayDeque<>();
            for (int i = 0; i < length; i++) {
                if (inCode[i] || escaped[i]) {
                    continue;
                }
                switch (text.charAt(i)) {
                    case '[' -> brackets.push(i);
                    case ']' -> {
                        if (!brackets.isEmpty()) {
                            int open = brackets.pop();
                            bracketMatch[open] = i;
                            bracketMatch[i] = open;
                        }
                    }
                    case '(' -> parens.push(i);
                    case ')' -> {
                        if (!parens.isEmpty()) {
                            int open = parens.pop();
                            parenMatch[open] = i;
                            parenMatch[i] = open;
                        }
                    }
                    default -> {
                    }
                }
            }
        }

        private List<ProtectedSpan> scanLeaves() {
            List<ProtectedSpan> leaves = new ArrayList<>();
            int i = 0;
            while (i < length) {
                ProtectedSpan span = escaped[i] ? null : leafAt(i);
                if (span == null) {
                    i++;
                } else {
                    leaves.add(span);
                    i = span.end();
                }
            }
            return leaves;
        }

        private ProtectedSpan leafAt(int i) {
            return switch (text.charAt(i)) {
                case '`' -> codeSpanEnd[i] < 0 ? null : ProtectedSpan.leaf(SpanKind.INLINE_CODE, i, codeSpanEnd[i]);
                case '[' -> bracketed(i);
                case '!' -> image(i);
                case '^' -> inlineFootnote(i);
                case '<' -> angle(i);
                case '&' -> entity(i);
                case '{' -> shortcode(i);
                case '$' -> math(i);
                case ':' -> emoji(i);
                default -> null;
            };
        }

        private ProtectedSpan bracketed(int open) {
            int close = bracketMatch[open];
            if (close < 0) {
                return null;
            }
            ProtectedSpan badge = linkedImage(open, close);
            if (badge != null) {
                return badge;
            }
            if (open + 1 < length && text.charAt(open + 1) == '[' && bracketMatch[open + 1] == close - 1
                    && close - 1 > open + 1) {
                return ProtectedSpan.leaf(SpanKind.WIKI_LINK, open, close + 1);
            }
            if (open + 2 < close && text.charAt(open + 1) == '^') {
                SpanKind footnote = footnoteKind(open + 2, close);
                if (footnote != null) {
                    return ProtectedSpan.leaf(footnote, open, close + 1);
                }
            }
            int inlineEnd = inlineTarget(close + 1);
            if (inlineEnd > 0) {
                return ProtectedSpan.leaf(SpanKind.INLINE_LINK, open, inlineEnd);
            }
            int referenceEnd = referenceTarget(close + 1);
            if (referenceEnd > 0) {
                SpanKind kind = referenceEnd == close + 3 ? SpanKind.COLLAPSED_REFERENCE_LINK : SpanKind.REFERENCE_LINK;
                return ProtectedSpan.leaf(kind, open, referenceEnd);
            }
            return ProtectedSpan.leaf(SpanKind.SHORTCUT_REFERENCE_LINK, open, close + 1);
        }

        private ProtectedSpan linkedImage(int open, int close) {
            if (open + 1 >= length || text.charAt(open + 1) != '!') {
                return null;
            }
            ProtectedSpan image = image(open + 1);
            if (image == null || image.end() != close) {
                return null;
            }
            boolean inlineImage = image.kind() == SpanKind.INLINE_IMAGE;
            int inlineEnd = inlineTarget(close + 1);
            if (inlineEnd > 0) {
                SpanKind kind = inlineImage ? SpanKind.LINKED_IMAGE_INLINE_INLINE : SpanKind.LINKED_IMAGE_REFERENCE_INLINE;
                return ProtectedSpan.leaf(kind, open, inlineEnd);
            }
            int referenceEnd = referenceTarget(close + 1);
            if (referenceEnd > 0) {
                SpanKind kind = inlineImage ? SpanKind.LINKED_IMAGE_INLINE_REFERENCE : SpanKind.LINKED_IMAGE_REFERENCE_REFERENCE;
                return ProtectedSpan.leaf(kind, open, referenceEnd);
            }
            return null;
        }

        private ProtectedSpan image(int bang) {
            if (bang + 1 >= length || text.charAt(bang + 1) != '[' || inCode[bang + 1]) {
                return null;
            }
            int close = bracketMatch[bang + 1];
            if (close < 0) {
                return null;
            }
            int inlineEnd = inlineTarget(close + 1);
            if (inlineEnd > 0) {
                return ProtectedSpan.leaf(SpanKind.INLINE_IMAGE, bang, inlineEnd);
            }
            int referenceEnd = referenceTarget(close + 1);
            return ProtectedSpan.leaf(SpanKind.REFERENCE_IMAGE, bang, referenceEnd > 0 ? referenceEnd : close + 1);
        }

        private int inlineTarget(int position) {
            if (position < length && text.charAt(position) == '(' && parenMatch[position] > position) {
                return parenMatch[position] + 1;
            }
            return -1;
        }

        private int referenceTarget(int position) {
            if (position < length && text.charAt(position) == '[' && bracketMatch[position] > position) {
                return bracketMatch[position] + 1;
            }
            return -1;
        }

        private SpanKind footnoteKind(int from, int to) {
            boolean numeric = true;
            for (int i = from; i < to; i++) {
                char ch = text.charAt(i);
                if (Character.isWhitespace(ch)) {
                    return null;
                }
                numeric &= ch >= '0' && ch <= '9';
            }
            return numeric ? SpanKind.NUMERIC_FOOTNOTE : SpanKind.NAMED_FOOTNOTE;
        }

        private ProtectedSpan inlineFootnote(int caret) {
            if (caret + 1 < length && text.charAt(caret + 1) == '[' && bracketMatch[caret + 1] > caret + 1) {
                return ProtectedSpan.leaf(SpanKind.INLINE_FOOTNOTE, caret, bracketMatch[caret + 1] + 1);
            }
            return null;
        }

        private ProtectedSpan angle(int open) {
            int first = open + 1;
            if (first >= length) {
                return null;
            }
            int end = uriAutolinkEnd(first);
            if (end < 0) {
                end = emailAutolinkEnd(first);
            }
            if (end > 0) {
                return ProtectedSpan.leaf(SpanKind.AUTOLINK, open, end);
            }
            if (text.startsWith("<!--", open)) {
                int close = next("-->", open + 4);
                return close < 0 ? null : ProtectedSpan.leaf(SpanKind.HTML_TAG, open, close + 3);
            }
            char ch = text.charAt(first);
            boolean tagStart = isAsciiLetter(ch) || (ch == '/' && first + 1 < length && isAsciiLetter(text.charAt(first + 1)));
            if (!tagStart) {
                return null;
            }
            int i = first;
            while (i < length && text.charAt(i) != '>' && text.charAt(i) != '<') {
                i++;
            }
            return i < length && text.charAt(i) == '>' ? ProtectedSpan.leaf(SpanKind.HTML_TAG, open, i + 1) : null;
        }

        private int uriAutolinkEnd(int first) {
            if (!isAsciiLetter(text.charAt(first))) {
                return -1;
            }
            int i = first + 1;
            while (i < length && i - first < MAX_SCHEME && isSchemeChar(text.charAt(i))) {
                i++;
            }
            if (i - first < 2 || i >= length || text.charAt(i) != ':') {
                return -1;
            }
            i++;
            while (i < length && !isAutolinkStop(text.charAt(i))) {
                i++;
            }
            return i < length && text.charAt(i) == '>' ? i + 1 : -1;
        }

        private int emailAutolinkEnd(int first) {
            boolean at = false;
            boolean dotInDomain = false;
            int i = first;
            while (i < length && !isAutolinkStop(text.charAt(i))) {
                char ch = text.charAt(i);
                if (ch == '@') {
                    if (at || i == first) {
                        return -1;
                    }
                    at = true;
                } else if (ch == '.' && at) {
                    dotInDomain = true;
                }
                i++;
            }
            boolean closed = i < length && text.charAt(i) == '>';
            return closed && at && dotInDomain && text.charAt(i - 1) != '.' ? i + 1 : -1;
        }

        private ProtectedSpan entity(int ampersand) {
            int i = ampersand + 1;
            if (i < length && text.charAt(i) == '#') {
                i++;
                boolean hex = i < length && (text.charAt(i) == 'x' || text.charAt(i) == 'X');
                if (hex) {
                    i++;
                }
                int digits = i;
                while (i < length && i - digits < MAX_NUMERIC_ENTITY
                        && (hex ? Character.digit(text.charAt(i), 16) >= 0 : isAsciiDigit(text.charAt(i)))) {
                    i++;
                }
                if (i > digits && i < length && text.charAt(i) == ';') {
                    return ProtectedSpan.leaf(SpanKind.HTML_ENTITY, ampersand, i + 1);
                }
                return null;
            }
            int name = i;
            while (i < length && i - name < MAX_ENTITY_NAME && (isAsciiLetter(text.charAt(i)) || isAsciiDigit(text.charAt(i)))) {
                i++;
            }
            if (i > name && isAsciiLetter(text.charAt(name)) && i < length && text.charAt(i) == ';') {
                return ProtectedSpan.leaf(SpanKind.HTML_ENTITY, ampersand, i + 1);
            }
            return null;
        }

        private ProtectedSpan shortcode(int open) {
            if (text.startsWith("{{<", open)) {
                return closedBy(open, 3, ">}}");
            }
            if (text.startsWith("{{%", open)) {
                return closedBy(open, 3, "%}}");
            }
            if (text.startsWith("{{", open)) {
                return closedBy(open, 2, "}}");
            }
            if (text.startsWith("{%", open)) {
                return closedBy(open, 2, "%}");
            }
            return null;
        }

        private ProtectedSpan closedBy(int open, int openerLength, String closer) {
            int close = next(closer, open + openerLength);
            return close < 0 ? null : ProtectedSpan.leaf(SpanKind.SHORTCODE, open, close + closer.length());
        }

        private ProtectedSpan math(int dollar) {
            if (text.startsWith("$$", dollar)) {
                int close = next("$$", dollar + 2);
                return close < 0 ? null : ProtectedSpan.leaf(SpanKind.DISPLAY_MATH, dollar, close + 2);
            }
            int close = next("$", dollar + 1);
            if (close <= dollar + 1) {
                return null;
            }
            if (Character.isWhitespace(text.charAt(dollar + 1)) || Character.isWhitespace(text.charAt(close - 1))) {
                return null;
            }
            // "$5 and $10" is currency, not math
            if (close + 1 < length && isAsciiDigit(text.charAt(close + 1))) {
                return null;
            }
            return ProtectedSpan.leaf(SpanKind.INLINE_MATH, dollar, close + 1);
        }

        private ProtectedSpan emoji(int colon) {
            if (colon > 0 && Character.isLetterOrDigit(text.charAt(colon - 1))) {
                return null;
            }
            int i = colon + 1;
            boolean letter = false;
            while (i < length && i - colon <= MAX_EMOJI_NAME && isEmojiNameChar(text.charAt(i))) {
                letter |= isAsciiLetter(text.charAt(i));
                i++;
            }
            if (!letter || i >= length || text.charAt(i) != ':') {
                return null;
            }
            if (i + 1 < length && Character.isLetterOrDigit(text.charAt(i + 1))) {
                return null;
            }
            return ProtectedSpan.leaf(SpanKind.EMOJI_SHORTCODE, colon, i + 1);
        }

        private List<EmphasisPair> matchEmphasis(List<ProtectedSpan> leaves) {
            List<EmphasisPair> matched = new ArrayList<>();
            List<Delimiter> stack = new ArrayList<>();
            Map<Integer, Integer> openCounts = new HashMap<>();
            int leafIndex = 0;
            int i = 0;
            while (i < length) {
                int nextLeafStart = leafIndex < leaves.size() ? leaves.get(leafIndex).start() : length;
                if (i == nextLeafStart) {
                    i = leaves.get(leafIndex++).end();
                    continue;
                }
                char ch = text.charAt(i);
                if (escaped[i] || !EmphasisMarker.isMarkerChar(ch)) {
                    i++;
                    continue;
                }
                int start = i;
                while (i < nextLeafStart && text.charAt(i) == ch) {
                    i++;
                }
                int count = i - start;
                if (!EmphasisMarker.isSupportedRun(ch, count)) {
                    continue;
                }
                Delimiter delimiter = delimiter(ch, start, count);
                Delimiter opener = delimiter.canClose ? popOpener(stack, openCounts, delimiter.key()) : null;
                if (opener != null && acceptsInterior(delimiter, opener.end(), delimiter.start)) {
                    matched.add(new EmphasisPair(new EmphasisMarker(ch, count), opener.start, delimiter.end()));
                } else if (delimiter.canOpen) {
                    stack.add(delimiter);
                    openCounts.merge(delimiter.key(), 1, Integer::sum);
                }
            }
            return matched;
        }

        private Delimiter delimiter(char ch, int start, int count) {
            char before = start > 0 ? text.charAt(start - 1) : ' ';
            char after = start + count < length ? text.charAt(start + count) : ' ';
            boolean leftFlanking = !Character.isWhitespace(after)
                    && (!isPunctuation(after) || Character.isWhitespace(before) || isPunctuation(before));
            boolean rightFlanking = !Character.isWhitespace(before)
                    && (!isPunctuation(before) || Character.isWhitespace(after) || isPunctuation(after));
            if (ch == '_') {
                // intraword underscores never delimit
                return new Delimiter(ch, start, count,
                        leftFlanking && (!rightFlanking || isPunctuation(before)),
                        rightFlanking && (!leftFlanking || isPunctuation(after)));
            }
            return new Delimiter(ch, start, count, leftFlanking, rightFlanking);
        }

        private Delimiter popOpener(List<Delimiter> stack, Map<Integer, Integer> openCounts, int key) {
            if (openCounts.getOrDefault(key, 0) == 0) {
                return null;
            }
            while (!stack.isEmpty()) {
                Delimiter top = stack.remove(stack.size() - 1);
                openCounts.merge(top.key(), -1, Integer::sum);
                if (top.key() == key) {
                    return top;
                }
            }
            return null;
        }

        private boolean acceptsInterior(Delimiter closer, int from, int to) {
            boolean tight = closer.marker == '^' || (closer.marker == '~' && closer.count == 1);
            return !tight || whitespaceBefore[to] == whitespaceBefore[from];
        }

        private List<ProtectedSpan> nest(List<ProtectedSpan> leaves, List<EmphasisPair> emphasis) {
            if (emphasis.isEmpty()) {
                return leaves;
            }
            List<Node> nodes = new ArrayList<>(leaves.size() + emphasis.size());
            for (ProtectedSpan leaf : leaves) {
                nodes.add(new Node(leaf.kind(), leaf.start(), leaf.end(), null));
            }
            for (EmphasisPair pair : emphasis) {
                nodes.add(new Node(SpanKind.EMPHASIS, pair.start(), pair.end(), pair.marker()));
            }
            nodes.sort(Comparator.comparingInt((Node node) -> node.start).thenComparingInt(node -> -node.end));

            List<Node> roots = new ArrayList<>();
            Deque<Node> open = new ArrayDeque<>();
            for (Node node : nodes) {
                while (!open.isEmpty() && open.peek().end <= node.start) {
                    open.pop();
                }
                if (open.isEmpty()) {
                    roots.add(node);
                } else {
                    open.peek().children.add(node);
                }
                if (node.kind == SpanKind.EMPHASIS) {
                    open.push(node);
                }
            }
            // children always sort after their parent, so a reverse sweep builds them first
            for (int n = nodes.size() - 1; n >= 0; n--) {
                Node node = nodes.get(n);
                if (node.kind != SpanKind.EMPHASIS) {
                    node.built = ProtectedSpan.leaf(node.kind, node.start, node.end);
                } else {
                    List<ProtectedSpan> children = new ArrayList<>(node.children.size());
                    for (Node child : node.children) {
                        children.add(child.built);
                    }
                    node.built = ProtectedSpan.emphasis(node.marker, node.start, node.end, children);
                }
            }
            List<ProtectedSpan> result = new ArrayList<>(roots.size());
            for (Node root : roots) {
                result.add(root.built);
            }
            return result;
        }

        private int next(String pattern, int from) {
            if (from >= length) {
                return -1;
            }
            return nextTables.computeIfAbsent(pattern, this::buildNextTable)[from];
        }

        private int[] buildNextTable(String pattern) {
            int[] table = new int[length + 1];
            table[length] = -1;
            for (int i = length - 1; i >= 0; i--) {
                table[i] = !escaped[i] && text.startsWith(pattern, i) ? i : table[i + 1];
            }
            return table;
        }
    }

    private record Delimiter(char marker, int start, int count, boolean canOpen, boolean canClose) {

        int end() {
            return start + count;
        }

        int key() {
            return marker * 4 + count;
        }
    }

    private record EmphasisPair(EmphasisMarker marker, int start, int end) {
    }

    private static final class Node {
        private final SpanKind kind;
        private final int start;
        private final int end;
        private final List<Node> children = new ArrayList<>();
        private final EmphasisMarker marker;
        private ProtectedSpan built;

        Node(SpanKind kind, int start, int end, EmphasisMarker marker) {
            this.kind = kind;
            this.start = start;
            this.end = end;
            this.marker = marker;
        }
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isSchemeChar(char ch) {
        return isAsciiLetter(ch) || isAsciiDigit(ch) || ch == '+' || ch == '.' || ch == '-';
    }

    private static boolean isAutolinkStop(char ch) {
        return ch == '<' || ch == '>' || Character.isWhitespace(ch);
    }

    /**
     * ASCII punctuation plus the Unicode punctuation and symbol categories, as used by the
     * emphasis flanking rules.
     */
    static boolean isPunctuation(char ch) {
        if (ch < 0x80) {
            return (ch >= '!' && ch <= '/') || (ch >= ':' && ch <= '@') || (ch >= '[' && ch <= '`')
                    || (ch >= '{' && ch <= '~');
        }
        switch (Character.getType(ch)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
            case Character.OTHER_SYMBOL:
                return true;
            default:
                return false;
        }
    }

    private static boolean isEmojiNameChar(char ch) {
        return (ch >= 'a' && ch <= 'z') || isAsciiDigit(ch) || ch == '_' || ch == '+' || ch == '-';
    }
}
