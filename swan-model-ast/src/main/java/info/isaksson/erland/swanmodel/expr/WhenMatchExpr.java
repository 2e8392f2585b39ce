package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e when match Tag} */
public final class WhenMatchExpr extends Expression {

    private final Expression expression;
    private final PathIdentifier when;

    public WhenMatchExpr(SourceSpan span, Expression expression, PathIdentifier when) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        if (when == null) throw new IllegalArgumentException("when is null");
        this.expression = adopt(expression);
        this.when = when;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.WHEN_MATCH;
    }

    public Expression expression() {
        return expression;
    }

    public PathIdentifier when() {
        return when;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text(" when match ").text(when.toString());
    }
}
