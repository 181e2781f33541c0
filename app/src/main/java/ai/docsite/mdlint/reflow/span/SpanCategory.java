package ai.docsite.mdlint.reflow.span;

/**
 * Coarse grouping of {@link SpanKind}s.
 */
public enum SpanCategory {
    CODE,
    LINK,
    IMAGE,
    LINKED_IMAGE,
    FOOTNOTE,
    SHORTCODE,
    HTML,
    MATH,
    EMOJI,
    EMPHASIS
}
