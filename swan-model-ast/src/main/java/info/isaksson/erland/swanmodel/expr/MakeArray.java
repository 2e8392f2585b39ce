package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e ^ size}: array of {@code size} copies. */
public final class MakeArray extends Expression {

    private final Expression expression;
    private final Expression size;

    public MakeArray(SourceSpan span, Expression expression, Expression size) {
        super(span);
        if (expression == null || size == null) throw new IllegalArgumentException("operand is null");
        this.expression = adopt(expression);
        this.size = adopt(size);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.MAKE_ARRAY;
    }

    public Expression expression() {
        return expression;
    }

    public Expression size() {
        return size;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text(" ^ ").node(size);
    }
}
