package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

public final class IfThenElse extends Expression {

    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public IfThenElse(SourceSpan span, Expression condition, Expression thenExpr, Expression elseExpr) {
        super(span);
        if (condition == null || thenExpr == null || elseExpr == null) {
            throw new IllegalArgumentException("operand is null");
        }
        this.condition = adopt(condition);
        this.thenExpr = adopt(thenExpr);
        this.elseExpr = adopt(elseExpr);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.IF_THEN_ELSE;
    }

    public Expression condition() {
        return condition;
    }

    public Expression thenExpr() {
        return thenExpr;
    }

    public Expression elseExpr() {
        return elseExpr;
    }

    @Override public void write(SwanWriter out) {
        out.text("if ").node(condition).text(" then ").node(thenExpr).text(" else ").node(elseExpr);
    }
}
