package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code e .(renamings)} */
public final class GroupProjection extends Expression {

    private final Expression expression;
    private final GroupAdaptation adaptation;

    public GroupProjection(SourceSpan span, Expression expression, GroupAdaptation adaptation) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        if (adaptation == null) throw new IllegalArgumentException("adaptation is null");
        this.expression = adopt(expression);
        this.adaptation = adopt(adaptation);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.GROUP_ADAPTATION;
    }

    public Expression expression() {
        return expression;
    }

    public GroupAdaptation adaptation() {
        return adaptation;
    }

    @Override public void write(SwanWriter out) {
        out.node(expression).text(" ").node(adaptation);
    }
}
