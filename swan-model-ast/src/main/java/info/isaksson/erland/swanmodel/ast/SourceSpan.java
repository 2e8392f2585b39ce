package info.isaksson.erland.swanmodel.ast;

/**
 * Half-open character range {@code [start, end)} of a node inside its source unit,
 * with 1-based line/column positions for both ends.
 */
public record SourceSpan(String sourceName, int start, int end,
                         int startLine, int startColumn, int endLine, int endColumn) {

    /** Span of nodes built programmatically rather than parsed. */
    public static final SourceSpan NONE = new SourceSpan("", 0, 0, 0, 0, 0, 0);

    public SourceSpan {
        if (sourceName == null) sourceName = "";
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    public boolean isKnown() {
        return startLine > 0;
    }

    public int length() {
        return end - start;
    }

    public boolean contains(SourceSpan other) {
        return other != null && start <= other.start && other.end <= end;
    }

    @Override public String toString() {
        if (!isKnown()) return "<synthetic>";
        return sourceName + ":" + startLine + ":" + startColumn;
    }
}
