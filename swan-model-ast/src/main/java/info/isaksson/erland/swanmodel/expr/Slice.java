package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e[from .. to]} */
public final class Slice extends Expression {

    private final Expression expression;
    private final Expression from;
    private final Expression to;

    public Slice(SourceSpan span, Expression expression, Expression from, Expression to) {
        super(span);
        if (expression == null || from == null || to == null) throw new IllegalArgumentException("operand is null");
        this.expression = adopt(expression);
        this.from = adopt(from);
        this.to = adopt(to);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.SLICE;
    }

    public Expression expression() {
        return expression;
    }

    public Expression from() {
        return from;
    }

    public Expression to() {
        return to;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text("[").node(from).text(" .. ").node(to).text("]");
    }
}
