package ai.docsite.mdlint.reflow.pack;

import java.util.Objects;

/**
 * Unit of line packing: a word or a word containing protected spans. Tokens are never split.
 *
 * @param width        visible width under the active length mode
 * @param atomic       whether the token contains a protected span
 * @param endsSentence whether a sentence ends with this token
 */
public record Token(String text, int width, boolean atomic, boolean endsSentence) {

    public Token {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Token text must not be empty");
        }
        if (width < 0) {
            throw new IllegalArgumentException("Token width must be zero or greater");
        }
    }

    public Token endingSentence() {
        return endsSentence ? this : new Token(text, width, atomic, true);
    }
}
