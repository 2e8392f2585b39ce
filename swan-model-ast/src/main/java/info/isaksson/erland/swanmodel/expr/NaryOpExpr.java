package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** N-ary operator used as an operator: {@code (+)}. */
public final class NaryOpExpr extends OperatorExpression {

    private final NaryOperator operator;

    public NaryOpExpr(SourceSpan span, NaryOperator operator) {
        super(span);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        this.operator = operator;
    }

    @Override public OperatorExpressionKind kind() {
        return OperatorExpressionKind.NARY;
    }

    public NaryOperator operator() {
        return operator;
    }

    @Override public void write(SwanWriter out) {
        out.text(operator.symbol());
    }
}
