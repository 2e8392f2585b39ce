package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class ExprTypeDefinition extends TypeDefinition {

    private final TypeExpression type;

    public ExprTypeDefinition(SourceSpan span, TypeExpression type) {
        super(span);
        if (type == null) throw new IllegalArgumentException("type is null");
        this.type = adopt(type);
    }

    public TypeExpression type() {
        return type;
    }

    @Override public void write(SwanWriter out) {
        out.node(type);
    }
}
