package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class PredefinedType extends TypeExpression {

    private final PredefinedTypeName name;

    public PredefinedType(SourceSpan span, PredefinedTypeName name) {
        super(span);
        if (name == null) throw new IllegalArgumentException("name is null");
        this.name = name;
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.PREDEFINED;
    }

    public PredefinedTypeName name() {
        return name;
    }

    @Override public void write(SwanWriter out) {
        out.text(name.keyword());
    }
}
