package ai.docsite.mdlint.reflow.span;

/**
 * Rendering style implied by an emphasis delimiter run.
 */
public enum EmphasisStyle {
    ITALIC,
    BOLD,
    BOLD_ITALIC,
    STRIKETHROUGH,
    SUBSCRIPT,
    SUPERSCRIPT,
    HIGHLIGHT
}
