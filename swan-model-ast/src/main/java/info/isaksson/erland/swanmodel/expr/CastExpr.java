package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;
import info.isaksson.erland.swanmodel.types.TypeExpression;

/** {@code (e :> T)} */
public final class CastExpr extends Expression {

    private final Expression expression;
    private final TypeExpression type;

    public CastExpr(SourceSpan span, Expression expression, TypeExpression type) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        if (type == null) throw new IllegalArgumentException("type is null");
        this.expression = adopt(expression);
        this.type = adopt(type);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.CAST;
    }

    public Expression expression() {
        return expression;
    }

    public TypeExpression type() {
        return type;
    }

    @Override public void write(SwanWriter out) {
        out.text("(").node(expression).text(" :> ").node(type).text(")");
    }
}
