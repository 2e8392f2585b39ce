package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.expr.Expression;

/** {@code #luid: expr} in an assume or guarantee section. */
public final class FormalProperty extends SwanNode {

    private final Luid luid;
    private final Expression expression;

    public FormalProperty(SourceSpan span, Luid luid, Expression expression) {
        super(span);
        if (luid == null) throw new IllegalArgumentException("luid is null");
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.luid = luid;
        this.expression = adopt(expression);
    }

    public Luid luid() {
        return luid;
    }

    public Expression expression() {
        return expression;
    }

    @Override public void write(SwanWriter out) {
        out.text(luid.toString()).text(": ").node(expression);
    }
}
