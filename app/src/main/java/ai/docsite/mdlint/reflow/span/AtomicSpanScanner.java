package ai.docsite.mdlint.reflow.span;

import java.util.List;

/**
 * Finds the protected inline spans of a run of inline Markdown text.
 */
public interface AtomicSpanScanner {

    /**
     * Returns the top-level spans in document order. Emphasis spans carry nested spans as children.
     */
    List<ProtectedSpan> scan(String text);
}
