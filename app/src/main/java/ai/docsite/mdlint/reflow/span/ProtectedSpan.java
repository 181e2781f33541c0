package ai.docsite.mdlint.reflow.span;

import java.util.List;
import java.util.Objects;

/**
 * A {@code [start, end)} range of text that must not be broken across lines. Only emphasis
 * spans carry a marker and may contain children; children lie strictly inside the interior.
 */
public record ProtectedSpan(SpanKind kind, int start, int end, EmphasisMarker marker, List<ProtectedSpan> children) {

    public ProtectedSpan {
        Objects.requireNonNull(kind, "kind");
        children = children == null ? List.of() : List.copyOf(children);
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span boundaries: [" + start + ", " + end + ")");
        }
        if ((kind == SpanKind.EMPHASIS) != (marker != null)) {
            throw new IllegalArgumentException("Only emphasis spans carry a marker");
        }
        if (kind != SpanKind.EMPHASIS && !children.isEmpty()) {
            throw new IllegalArgumentException("Only emphasis spans may contain children");
        }
    }

    public static ProtectedSpan leaf(SpanKind kind, int start, int end) {
        return new ProtectedSpan(kind, start, end, null, List.of());
    }

    public static ProtectedSpan emphasis(EmphasisMarker marker, int start, int end, List<ProtectedSpan> children) {
        return new ProtectedSpan(SpanKind.EMPHASIS, start, end, marker, children);
    }

    public boolean isEmphasis() {
        return kind == SpanKind.EMPHASIS;
    }

    public int length() {
        return end - start;
    }

    /** First offset after the opening delimiter; equals {@link #start()} for leaf spans. */
    public int contentStart() {
        return isEmphasis() ? start + marker.count() : start;
    }

    /** Offset of the closing delimiter; equals {@link #end()} for leaf spans. */
    public int contentEnd() {
        return isEmphasis() ? end - marker.count() : end;
    }

    public String text(CharSequence source) {
        return source.subSequence(start, end).toString();
    }
}
