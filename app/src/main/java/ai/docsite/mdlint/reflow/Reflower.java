package ai.docsite.mdlint.reflow;

import java.util.List;
import java.util.Optional;

/**
 * Re-wraps Markdown prose without changing the document structure.
 */
public interface Reflower {

    String reflowMarkdown(String text, ReflowOptions options);

    /**
     * Reflows a single logical line or paragraph, without block classification.
     */
    List<String> reflowLine(String text, ReflowOptions options);

    /**
     * Reflows only the block holding the 1-based {@code lineNumber}; empty when that line is out
     * of range or does not belong to prose.
     */
    Optional<ParagraphReflow> reflowParagraphAtLine(String text, int lineNumber, ReflowOptions options);
}
