package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.expr.Expression;

/** {@code lhs = expr;} */
public final class ExprEquation extends Equation {

    private final EquationLhs lhs;
    private final Expression expression;

    public ExprEquation(SourceSpan span, EquationLhs lhs, Expression expression) {
        super(span);
        if (lhs == null) throw new IllegalArgumentException("lhs is null");
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.lhs = adopt(lhs);
        this.expression = adopt(expression);
    }

    @Override public EquationKind kind() {
        return EquationKind.EXPR;
    }

    public EquationLhs lhs() {
        return lhs;
    }

    public Expression expression() {
        return expression;
    }

    @Override public void write(SwanWriter out) {
        out.node(lhs).text(" = ").node(expression).text(";");
    }
}
