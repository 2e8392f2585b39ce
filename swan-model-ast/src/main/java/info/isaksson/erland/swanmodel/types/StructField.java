package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class StructField extends SwanNode {

    private final Identifier identifier;
    private final TypeExpression type;

    public StructField(SourceSpan span, Identifier identifier, TypeExpression type) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        if (type == null) throw new IllegalArgumentException("type is null");
        this.identifier = identifier;
        this.type = adopt(type);
    }

    public Identifier identifier() {
        return identifier;
    }

    public TypeExpression type() {
        return type;
    }

    @Override public void write(SwanWriter out) {
        out.text(identifier.render()).text(": ").node(type);
    }
}
