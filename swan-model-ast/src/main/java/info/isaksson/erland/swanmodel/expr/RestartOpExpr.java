package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code restart Op every cond} */
public final class RestartOpExpr extends OperatorExpression {

    private final OperatorCall operator;
    private final Expression condition;

    public RestartOpExpr(SourceSpan span, OperatorCall operator, Expression condition) {
        super(span);
        if (operator == null || condition == null) throw new IllegalArgumentException("operand is null");
        this.operator = adopt(operator);
        this.condition = adopt(condition);
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.RESTART;
    }

    public OperatorCall operator() {
        return operator;
    }

    public Expression condition() {
        return condition;
    }

    @Override public void write(SwanWriter out) {
        out.text("restart ").node(operator).text(" every ").node(condition);
    }
}
