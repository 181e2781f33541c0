package ai.docsite.mdlint.reflow.width;

import java.util.Objects;

/**
 * Measures text according to a {@link LengthMode}. Pure and safe for any string, including
 * strings with unpaired surrogates.
 */
public final class WidthMeasurer {

    private static final int VARIATION_SELECTOR_16 = 0xFE0F;

    private WidthMeasurer() {
    }

    public static int measure(CharSequence text, LengthMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (text == null || text.length() == 0) {
            return 0;
        }
        return switch (mode) {
            case CHARS -> Character.codePointCount(text, 0, text.length());
            case BYTES -> utf8Length(text);
            case VISUAL -> visualWidth(text);
        };
    }

    /**
     * Width of a single code point in terminal columns.
     */
    public static int codePointWidth(int codePoint) {
        if (isZeroWidth(codePoint)) {
            return 0;
        }
        return EastAsianWidth.isWide(codePoint) ? 2 : 1;
    }

    private static int visualWidth(CharSequence text) {
        int width = 0;
        int index = 0;
        int length = text.length();
        while (index < length) {
            int codePoint = Character.codePointAt(text, index);
            index += Character.charCount(codePoint);
            int columns = codePointWidth(codePoint);
            // a text-presentation symbol turned into an emoji by VS16 occupies two columns
            if (columns == 1 && index < length && text.charAt(index) == VARIATION_SELECTOR_16
                    && Character.getType(codePoint) == Character.OTHER_SYMBOL) {
                columns = 2;
            }
            width += columns;
        }
        return width;
    }

    private static boolean isZeroWidth(int codePoint) {
        if (codePoint == 0) {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.NON_SPACING_MARK:
            case Character.ENCLOSING_MARK:
            case Character.FORMAT:
            case Character.CONTROL:
                return true;
            default:
                break;
        }
        // Hangul medial vowels and final consonants join the preceding syllable
        return codePoint >= 0x1160 && codePoint <= 0x11FF;
    }

    private static int utf8Length(CharSequence text) {
        int bytes = 0;
        int index = 0;
        int length = text.length();
        while (index < length) {
            int codePoint = Character.codePointAt(text, index);
            index += Character.charCount(codePoint);
            if (codePoint < 0x80) {
                bytes += 1;
            } else if (codePoint < 0x800) {
                bytes += 2;
            } else if (codePoint < 0x10000) {
                // an unpaired surrogate is written as U+FFFD, three bytes as well
                bytes += 3;
            } else {
                bytes += 4;
            }
        }
        return bytes;
    }
}
