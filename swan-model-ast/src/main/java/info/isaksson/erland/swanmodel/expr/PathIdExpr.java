package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class PathIdExpr extends Expression {

    private final PathIdentifier path;

    public PathIdExpr(SourceSpan span, PathIdentifier path) {
        super(span);
        if (path == null) throw new IllegalArgumentException("path is null");
        this.path = path;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.PATH_ID;
    }

    public PathIdentifier path() {
        return path;
    }

    @Override public void write(SwanWriter out) {
        out.text(path.toString());
    }
}
