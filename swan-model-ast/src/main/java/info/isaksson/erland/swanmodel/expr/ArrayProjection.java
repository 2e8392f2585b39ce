package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e[index]} */
public final class ArrayProjection extends Expression {

    private final Expression expression;
    private final Expression index;

    public ArrayProjection(SourceSpan span, Expression expression, Expression index) {
        super(span);
        if (expression == null || index == null) throw new IllegalArgumentException("operand is null");
        this.expression = adopt(expression);
        this.index = adopt(index);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.ARRAY_PROJECTION;
    }

    public Expression expression() {
        return expression;
    }

    public Expression index() {
        return index;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text("[").node(index).text("]");
    }
}
