package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.types.TypeExpression;

import java.util.Optional;

/** {@code C [: T] [= value]} */
public final class ConstDecl extends SwanNode implements Declaration {

    private final Identifier identifier;
    private final TypeExpression type;
    private final Expression value;

    public ConstDecl(SourceSpan span, Identifier identifier, TypeExpression type, Expression value) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        this.identifier = identifier;
        this.type = adopt(type);
        this.value = adopt(value);
    }

    @Override public Identifier identifier() {
        return identifier;
    }

    public Optional<TypeExpression> type() {
        return Optional.ofNullable(type);
    }

    public Optional<Expression> value() {
        return Optional.ofNullable(value);
    }

    @Override public void write(SwanWriter out) {
        out.text(identifier.render());
        if (type != null) out.text(": ").node(type);
        if (value != null) out.text(" = ").node(value);
    }
}
