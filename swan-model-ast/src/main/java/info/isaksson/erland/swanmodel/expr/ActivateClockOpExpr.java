package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code activate Op every clock} */
public final class ActivateClockOpExpr extends OperatorExpression {

    private final OperatorCall operator;
    private final ClockExpr clock;

    public ActivateClockOpExpr(SourceSpan span, OperatorCall operator, ClockExpr clock) {
        super(span);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        if (clock == null) throw new IllegalArgumentException("clock is null");
        this.operator = adopt(operator);
        this.clock = adopt(clock);
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.ACTIVATE_CLOCK;
    }

    public OperatorCall operator() {
        return operator;
    }

    public ClockExpr clock() {
        return clock;
    }

    @Override public void write(SwanWriter out) {
        out.text("activate ").node(operator).text(" every ").node(clock);
    }
}
