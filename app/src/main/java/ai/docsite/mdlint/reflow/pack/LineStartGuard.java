package ai.docsite.mdlint.reflow.pack;

/**
 * Recognizes tokens that would turn a wrapped continuation line into a different block: a list
 * item, heading, blockquote, table row, code fence, definition, setext underline, HTML block or
 * link reference definition. Such tokens are kept on the preceding line, as is any token that
 * follows an odd run of backslashes.
 */
final class LineStartGuard {

    private static final int MAX_ORDERED_DIGITS = 9;

    private LineStartGuard() {
    }

    /**
     * True when a line ending with {@code token} would end in a backslash hard break.
     */
    static boolean wouldEndInHardBreak(String token) {
        int backslashes = 0;
        for (int i = token.length() - 1; i >= 0 && token.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    static boolean wouldStartBlock(String token) {
        if (token.isEmpty()) {
            return false;
        }
        char first = token.charAt(0);
        if (first == '>' || first == '|') {
            return true;
        }
        if (token.startsWith("```") || token.startsWith("~~~")) {
            return true;
        }
        if (token.equals(":") || token.equals("+")) {
            return true;
        }
        if (isRunOf(token, '-') || isRunOf(token, '*') || isRunOf(token, '_') || isRunOf(token, '=')) {
            return true;
        }
        if (isRunOf(token, '#') && token.length() <= 6) {
            return true;
        }
        return isOrderedMarker(token) || isReferenceDefinitionLabel(token) || isHtmlOpening(token);
    }

    private static boolean isHtmlOpening(String token) {
        if (token.charAt(0) != '<' || token.length() < 2) {
            return false;
        }
        char next = token.charAt(1);
        if (next == '/' || next == '!' || next == '?') {
            return true;
        }
        if (!(next >= 'a' && next <= 'z') && !(next >= 'A' && next <= 'Z')) {
            return false;
        }
        for (int i = 1; i < token.length(); i++) {
            char ch = token.charAt(i);
            if (ch == ':' || ch == '@') {
                return false;
            }
            if (ch == '>') {
                return true;
            }
        }
        return true;
    }

    private static boolean isRunOf(String token, char ch) {
        for (int i = 0; i < token.length(); i++) {
            if (token.charAt(i) != ch) {
                return false;
            }
        }
        return true;
    }

    private static boolean isOrderedMarker(String token) {
        int digits = token.length() - 1;
        if (digits < 1 || digits > MAX_ORDERED_DIGITS) {
            return false;
        }
        char last = token.charAt(digits);
        if (last != '.' && last != ')') {
            return false;
        }
        for (int i = 0; i < digits; i++) {
            if (token.charAt(i) < '0' || token.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isReferenceDefinitionLabel(String token) {
        if (token.charAt(0) != '[') {
            return false;
        }
        int close = token.indexOf("]:");
        return close > 1;
    }
}
