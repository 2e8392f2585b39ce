package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class UnaryExpr extends Expression {

    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryExpr(SourceSpan span, UnaryOperator operator, Expression operand) {
        super(span);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        if (operand == null) throw new IllegalArgumentException("operand is null");
        this.operator = operator;
        this.operand = adopt(operand);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.UNARY;
    }

    public UnaryOperator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override public void write(SwanWriter out) {
        out.text(operator.symbol());
        // "- -x" must not become the comment "--x"
        if (operator.isKeyword() || operand instanceof UnaryExpr u && !u.operator.isKeyword()) out.text(" ");
        out.node(operand);
    }
}
