package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** Enumeration tag or constant. */
public final class PathIdPattern extends Pattern {

    private final PathIdentifier path;

    public PathIdPattern(SourceSpan span, PathIdentifier path) {
        super(span);
        if (path == null) throw new IllegalArgumentException("path is null");
        this.path = path;
    }

    @Override public PatternKind kind() {
        return PatternKind.PATH_ID;
    }

    public PathIdentifier path() {
        return path;
    }

    @Override public void write(SwanWriter out) {
        out.text(path.toString());
    }
}
