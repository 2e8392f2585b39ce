package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e when clock} */
public final class WhenClockExpr extends Expression {

    private final Expression expression;
    private final ClockExpr clock;

    public WhenClockExpr(SourceSpan span, Expression expression, ClockExpr clock) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        if (clock == null) throw new IllegalArgumentException("clock is null");
        this.expression = adopt(expression);
        this.clock = adopt(clock);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.WHEN_CLOCK;
    }

    public Expression expression() {
        return expression;
    }

    public ClockExpr clock() {
        return clock;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text(" when ").node(clock);
    }
}
