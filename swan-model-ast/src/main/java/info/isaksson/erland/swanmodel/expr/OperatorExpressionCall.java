package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code (op_expr) [<<sizes>>]} */
public final class OperatorExpressionCall extends OperatorCall {

    private final OperatorExpression expression;

    public OperatorExpressionCall(SourceSpan span, OperatorExpression expression, List<Expression> sizes) {
        super(span, sizes);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.expression = adopt(expression);
        adoptSizes();
    }

    @Override public OperatorCallKind kind() {
        return OperatorCallKind.OPERATOR_EXPRESSION;
    }

    public OperatorExpression expression() {
        return expression;
    }

    @Override public void write(SwanWriter out) {
        out.text("(").node(expression).text(")");
        writeSizes(out);
    }
}
