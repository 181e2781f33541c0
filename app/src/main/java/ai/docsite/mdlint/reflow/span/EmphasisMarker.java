package ai.docsite.mdlint.reflow.span;

/**
 * Delimiter of an emphasis span: the marker character and how many times it repeats.
 * Underscore and asterisk markers are kept apart so rewrapped text keeps the author's choice.
 */
public record EmphasisMarker(char marker, int count) {

    public EmphasisMarker {
        if (!isMarkerChar(marker)) {
            throw new IllegalArgumentException("Unsupported emphasis marker: " + marker);
        }
        if (count < 1 || count > 3) {
            throw new IllegalArgumentException("Emphasis marker count must be between 1 and 3");
        }
    }

    public static boolean isMarkerChar(char ch) {
        return ch == '*' || ch == '_' || ch == '~' || ch == '^' || ch == '=';
    }

    /**
     * Run lengths the scanner accepts for each marker character.
     */
    public static boolean isSupportedRun(char marker, int count) {
        return switch (marker) {
            case '*', '_' -> count >= 1 && count <= 3;
            case '~' -> count == 1 || count == 2;
            case '^' -> count == 1;
            case '=' -> count == 2;
            default -> false;
        };
    }

    public EmphasisStyle style() {
        return switch (marker) {
            case '~' -> count == 2 ? EmphasisStyle.STRIKETHROUGH : EmphasisStyle.SUBSCRIPT;
            case '^' -> EmphasisStyle.SUPERSCRIPT;
            case '=' -> EmphasisStyle.HIGHLIGHT;
            default -> switch (count) {
                case 1 -> EmphasisStyle.ITALIC;
                case 2 -> EmphasisStyle.BOLD;
                default -> EmphasisStyle.BOLD_ITALIC;
            };
        };
    }

    public String delimiter() {
        return String.valueOf(marker).repeat(count);
    }
}
