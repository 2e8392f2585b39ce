package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** User operator called by path. */
public final class PathOperatorCall extends OperatorCall {

    private final PathIdentifier path;

    public PathOperatorCall(SourceSpan span, PathIdentifier path, List<Expression> sizes) {
        super(span, sizes);
        if (path == null) throw new IllegalArgumentException("path is null");
        this.path = path;
        adoptSizes();
    }

    @Override public OperatorCallKind kind() {
        return OperatorCallKind.PATH;
    }

    public PathIdentifier path() {
        return path;
    }

    @Override public void write(SwanWriter out) {
        out.text(path.toString());
        writeSizes(out);
    }
}
