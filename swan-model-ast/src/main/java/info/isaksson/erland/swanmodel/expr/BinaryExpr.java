package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class BinaryExpr extends Expression {

    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpr(SourceSpan span, BinaryOperator operator, Expression left, Expression right) {
        super(span);
        if (operator == null) throw new IllegalArgumentException("operator is null");
        if (left == null || right == null) throw new IllegalArgumentException("operand is null");
        this.operator = operator;
        this.left = adopt(left);
        this.right = adopt(right);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.BINARY;
    }

    public BinaryOperator operator() {
        return operator;
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override public void write(SwanWriter out) {
        out.node(left).text(" ").text(operator.symbol()).text(" ").node(right);
    }
}
