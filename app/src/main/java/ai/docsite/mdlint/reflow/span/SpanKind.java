package ai.docsite.mdlint.reflow.span;

/**
 * Inline constructs that must never be split across lines.
 */
public enum SpanKind {
    INLINE_CODE(SpanCategory.CODE),

    INLINE_LINK(SpanCategory.LINK),
    REFERENCE_LINK(SpanCategory.LINK),
    COLLAPSED_REFERENCE_LINK(SpanCategory.LINK),
    SHORTCUT_REFERENCE_LINK(SpanCategory.LINK),
    AUTOLINK(SpanCategory.LINK),
    WIKI_LINK(SpanCategory.LINK),

    INLINE_IMAGE(SpanCategory.IMAGE),
    REFERENCE_IMAGE(SpanCategory.IMAGE),

    /** {@code [![alt](img)](link)} */
    LINKED_IMAGE_INLINE_INLINE(SpanCategory.LINKED_IMAGE),
    /** {@code [![alt][img]](link)} */
    LINKED_IMAGE_REFERENCE_INLINE(SpanCategory.LINKED_IMAGE),
    /** {@code [![alt](img)][link]} */
    LINKED_IMAGE_INLINE_REFERENCE(SpanCategory.LINKED_IMAGE),
    /** {@code [![alt][img]][link]} */
    LINKED_IMAGE_REFERENCE_REFERENCE(SpanCategory.LINKED_IMAGE),

    INLINE_FOOTNOTE(SpanCategory.FOOTNOTE),
    NUMERIC_FOOTNOTE(SpanCategory.FOOTNOTE),
    NAMED_FOOTNOTE(SpanCategory.FOOTNOTE),

    SHORTCODE(SpanCategory.SHORTCODE),

    HTML_TAG(SpanCategory.HTML),
    HTML_ENTITY(SpanCategory.HTML),

    INLINE_MATH(SpanCategory.MATH),
    DISPLAY_MATH(SpanCategory.MATH),

    EMOJI_SHORTCODE(SpanCategory.EMOJI),

    EMPHASIS(SpanCategory.EMPHASIS);

    private final SpanCategory category;

    SpanKind(SpanCategory category) {
        this.category = category;
    }

    public SpanCategory category() {
        return category;
    }
}
