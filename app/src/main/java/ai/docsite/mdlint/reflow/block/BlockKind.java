package ai.docsite.mdlint.reflow.block;

/**
 * Classification of Markdown blocks. Only the prose-carrying kinds are rewrapped; everything else
 * is copied through verbatim.
 */
public enum BlockKind {
    PARAGRAPH(true),
    LIST_ITEM(true),
    BLOCKQUOTE(true),
    DEFINITION_TERM(false),
    DEFINITION_ENTRY(true),
    HEADING(false),
    CODE_BLOCK(false),
    TABLE(false),
    HTML_BLOCK(false),
    FRONT_MATTER(false),
    BLANK(false),
    HORIZONTAL_RULE(false),
    LINK_DEFINITION(false),
    TEMPLATE_DIRECTIVE(false);

    private final boolean reflowEligible;

    BlockKind(boolean reflowEligible) {
        this.reflowEligible = reflowEligible;
    }

    public boolean reflowEligible() {
        return reflowEligible;
    }
}
