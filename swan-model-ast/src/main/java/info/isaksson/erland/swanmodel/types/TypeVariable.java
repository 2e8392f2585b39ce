package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code 'T} */
public final class TypeVariable extends TypeExpression {

    private final Identifier name;

    public TypeVariable(SourceSpan span, Identifier name) {
        super(span);
        if (name == null || !name.isName()) throw new IllegalArgumentException("type variable must be a 'name");
        this.name = name;
    }

    @Override public TypeExpressionKind kind() {
        return TypeExpressionKind.VARIABLE;
    }

    public Identifier name() {
        return name;
    }

    @Override public void write(SwanWriter out) {
        out.text(name.value());
    }
}
