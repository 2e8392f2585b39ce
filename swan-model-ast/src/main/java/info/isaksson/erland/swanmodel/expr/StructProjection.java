package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e.label} */
public final class StructProjection extends Expression {

    private final Expression expression;
    private final Identifier label;

    public StructProjection(SourceSpan span, Expression expression, Identifier label) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        if (label == null) throw new IllegalArgumentException("label is null");
        this.expression = adopt(expression);
        this.label = label;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.STRUCT_PROJECTION;
    }

    public Expression expression() {
        return expression;
    }

    public Identifier label() {
        return label;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text(".").text(label.value());
    }
}
