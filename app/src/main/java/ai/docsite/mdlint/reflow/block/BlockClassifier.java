package ai.docsite.mdlint.reflow.block;

import java.util.List;

/**
 * Splits a Markdown document into an ordered, gap-free sequence of blocks.
 */
public interface BlockClassifier {

    List<Block> classify(String document);
}
