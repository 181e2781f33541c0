package ai.docsite.mdlint.reflow.block;

import java.util.List;
import java.util.Objects;

/**
 * A block of the source document covering {@code [start, end)}, line terminators included.
 *
 * @param lines              inline text of each source line with the structural prefix removed;
 *                           empty for blocks that are copied verbatim
 * @param prefix             prefix of the first emitted line, such as {@code "- "} or {@code "> "}
 * @param continuationPrefix prefix of every following emitted line
 * @param depth              blockquote nesting depth, 0 outside quotes
 */
public record Block(BlockKind kind, int start, int end, List<String> lines, String prefix, String continuationPrefix,
                    int depth) {

    public Block {
        Objects.requireNonNull(kind, "kind");
        lines = lines == null ? List.of() : List.copyOf(lines);
        prefix = prefix == null ? "" : prefix;
        continuationPrefix = continuationPrefix == null ? "" : continuationPrefix;
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid block boundaries: [" + start + ", " + end + ")");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be zero or greater");
        }
    }

    public static Block verbatim(BlockKind kind, int start, int end) {
        return verbatim(kind, start, end, 0);
    }

    public static Block verbatim(BlockKind kind, int start, int end, int depth) {
        return new Block(kind, start, end, List.of(), "", "", depth);
    }

    /**
     * Whether the block carries prose that may be rewrapped.
     */
    public boolean isReflowable() {
        if (!kind.reflowEligible()) {
            return false;
        }
        for (String line : lines) {
            if (!line.isBlank()) {
                return true;
            }
        }
        return false;
    }

    public String source(String document) {
        return document.substring(start, end);
    }
}
