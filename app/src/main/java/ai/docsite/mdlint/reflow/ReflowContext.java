package ai.docsite.mdlint.reflow;

import ai.docsite.mdlint.reflow.pack.InlineTokenizer;
import ai.docsite.mdlint.reflow.pack.LinePacker;
import ai.docsite.mdlint.reflow.sentence.AbbreviationTable;
import ai.docsite.mdlint.reflow.sentence.EmphasisContinuation;
import ai.docsite.mdlint.reflow.sentence.SentenceSplitter;
import java.util.Objects;

/**
 * Collaborators derived from one set of options, built once per call.
 */
record ReflowContext(
        ReflowOptions options,
        SentenceSplitter splitter,
        EmphasisContinuation continuation,
        InlineTokenizer tokenizer,
        LinePacker packer
) {

    ReflowContext {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(splitter, "splitter");
        Objects.requireNonNull(continuation, "continuation");
        Objects.requireNonNull(tokenizer, "tokenizer");
        Objects.requireNonNull(packer, "packer");
    }

    static ReflowContext of(ReflowOptions options) {
        Objects.requireNonNull(options, "options");
        SentenceSplitter splitter = new SentenceSplitter(AbbreviationTable.withCustom(options.abbreviations()));
        return new ReflowContext(options, splitter, new EmphasisContinuation(splitter),
                new InlineTokenizer(options.lengthMode()), new LinePacker(options.lengthMode()));
    }
}
