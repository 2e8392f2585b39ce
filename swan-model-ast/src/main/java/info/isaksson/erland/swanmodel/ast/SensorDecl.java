package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.types.TypeExpression;

/** {@code S: T} */
public final class SensorDecl extends SwanNode implements Declaration {

    private final Identifier identifier;
    private final TypeExpression type;

    public SensorDecl(SourceSpan span, Identifier identifier, TypeExpression type) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        if (type == null) throw new IllegalArgumentException("sensor type is null");
        this.identifier = identifier;
        this.type = adopt(type);
    }

    @Override public Identifier identifier() {
        return identifier;
    }

    public TypeExpression type() {
        return type;
    }

    @Override public void write(SwanWriter out) {
        out.text(identifier.render()).text(": ").node(type);
    }
}
