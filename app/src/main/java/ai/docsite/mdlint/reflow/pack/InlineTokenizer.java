package ai.docsite.mdlint.reflow.pack;

import ai.docsite.mdlint.reflow.span.ProtectedSpan;
import ai.docsite.mdlint.reflow.width.LengthMode;
import ai.docsite.mdlint.reflow.width.WidthMeasurer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Cuts inline text into packing tokens. A token is a maximal run of non-whitespace characters in
 * which protected spans count as single characters, so {@code (`Mr`,} stays one token.
 * Punctuation-only words are merged into the preceding token and words made only of opening
 * brackets into the following one; the resulting token list is stable under re-tokenization of
 * its own output, which keeps packing idempotent.
 */
public final class InlineTokenizer {

    private static final String TRAILING_PUNCTUATION = ",.:;!?)]}";
    private static final String OPENING_BRACKETS = "([{";

    private final LengthMode lengthMode;

    public InlineTokenizer(LengthMode lengthMode) {
        this.lengthMode = Objects.requireNonNull(lengthMode, "lengthMode");
    }

    public List<Token> tokenize(String text, List<ProtectedSpan> spans) {
        return tokenize(text, 0, text.length(), spans, span -> null);
    }

    /**
     * @param expander returns replacement pieces for a span (each but the last ends a sentence),
     *                 or {@code null} to keep the span as is
     */
    public List<Token> tokenize(String text, int from, int to, List<ProtectedSpan> spans,
                                Function<ProtectedSpan, List<String>> expander) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(spans, "spans");
        Objects.requireNonNull(expander, "expander");
        List<Token> words = new ArrayList<>();
        int spanIndex = firstSpanAtOrAfter(spans, from);
        StringBuilder word = new StringBuilder();
        boolean atomic = false;
        int i = from;
        while (i < to) {
            ProtectedSpan span = spanIndex < spans.size() ? spans.get(spanIndex) : null;
            if (span != null && span.start() == i) {
                spanIndex++;
                List<String> pieces = expander.apply(span);
                if (pieces == null || pieces.size() < 2) {
                    word.append(text, span.start(), span.end());
                } else {
                    word.append(pieces.get(0));
                    words.add(token(word.toString(), true, true));
                    for (int p = 1; p < pieces.size() - 1; p++) {
                        words.add(token(pieces.get(p), true, true));
                    }
                    word.setLength(0);
                    word.append(pieces.get(pieces.size() - 1));
                }
                atomic = true;
                i = span.end();
                continue;
            }
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                if (word.length() > 0) {
                    words.add(token(word.toString(), atomic, false));
                    word.setLength(0);
                    atomic = false;
                }
            } else {
                word.append(ch);
            }
            i++;
        }
        if (word.length() > 0) {
            words.add(token(word.toString(), atomic, false));
        }
        return glue(words);
    }

    /**
     * Merges words into tokens. Merged words are always adjacent, so each token is built from a
     * range of words in one pass, which keeps long punctuation runs linear.
     */
    private List<Token> glue(List<Token> words) {
        List<int[]> ranges = new ArrayList<>();
        boolean openersOnly = false;
        boolean pendingOpener = false;
        for (int w = 0; w < words.size(); w++) {
            Token word = words.get(w);
            boolean opener = isOpeningBrackets(word.text());
            if (pendingOpener) {
                ranges.get(ranges.size() - 1)[1] = w + 1;
                openersOnly = openersOnly && opener;
            } else if (isTrailingPunctuation(word.text()) && !ranges.isEmpty() && !words.get(w - 1).endsSentence()) {
                ranges.get(ranges.size() - 1)[1] = w + 1;
                openersOnly = false;
            } else {
                ranges.add(new int[] {w, w + 1});
                openersOnly = opener;
            }
            pendingOpener = openersOnly && !word.endsSentence();
        }
        List<Token> tokens = new ArrayList<>(ranges.size());
        for (int[] range : ranges) {
            if (range[1] - range[0] == 1) {
                tokens.add(words.get(range[0]));
                continue;
            }
            StringBuilder text = new StringBuilder();
            boolean atomic = false;
            for (int k = range[0]; k < range[1]; k++) {
                text.append(words.get(k).text());
                atomic |= words.get(k).atomic();
            }
            tokens.add(token(text.toString(), atomic, words.get(range[1] - 1).endsSentence()));
        }
        return tokens;
    }

    private Token token(String text, boolean atomic, boolean endsSentence) {
        return new Token(text, WidthMeasurer.measure(text, lengthMode), atomic, endsSentence);
    }

    private static int firstSpanAtOrAfter(List<ProtectedSpan> spans, int offset) {
        int low = 0;
        int high = spans.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (spans.get(mid).start() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    static boolean isTrailingPunctuation(String word) {
        return consistsOf(word, TRAILING_PUNCTUATION);
    }

    static boolean isOpeningBrackets(String word) {
        return consistsOf(word, OPENING_BRACKETS);
    }

    private static boolean consistsOf(String word, String alphabet) {
        if (word.isEmpty()) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            if (alphabet.indexOf(word.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
