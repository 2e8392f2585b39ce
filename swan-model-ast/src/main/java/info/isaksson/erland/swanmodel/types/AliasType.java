package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** Reference to a declared type by path. */
public final class AliasType extends TypeExpression {

    private final PathIdentifier path;

    public AliasType(SourceSpan span, PathIdentifier path) {
        super(span);
        if (path == null) throw new IllegalArgumentException("path is null");
        this.path = path;
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.ALIAS;
    }

    public PathIdentifier path() {
        return path;
    }

    @Override public void write(SwanWriter out) {
        out.text(path.toString());
    }
}
