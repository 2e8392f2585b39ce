package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code activate Op every cond last init} or {@code ... default init}. */
public final class ActivateEveryOpExpr extends OperatorExpression {

    private final OperatorCall operator;
    private final Expression condition;
    private final boolean last;
    private final Expression initial;

    public ActivateEveryOpExpr(SourceSpan span, OperatorCall operator, Expression condition,
                               boolean last, Expression initial) {
        super(span);
        if (operator == null || condition == null || initial == null) {
            throw new IllegalArgumentException("operand is null");
        }
        this.operator = adopt(operator);
        this.condition = adopt(condition);
        this.last = last;
        this.initial = adopt(initial);
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.ACTIVATE_EVERY;
    }

    public OperatorCall operator() {
        return operator;
    }

    public Expression condition() {
        return condition;
    }

    /** True for {@code last}, false for {@code default}. */
    public boolean isLast() {
        return last;
    }

    public Expression initial() {
        return initial;
    }

    @Override public void write(SwanWriter out) {
        out.text("activate ").node(operator).text(" every ").node(condition)
                .text(last ? " last " : " default ").node(initial);
    }
}
