package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code (e . [i].l default d)} */
public final class DynamicProjection extends Expression {

    private final Expression expression;
    private final List<LabelOrIndex> steps;
    private final Expression defaultValue;

    public DynamicProjection(SourceSpan span, Expression expression, List<LabelOrIndex> steps, Expression defaultValue) {
        super(span);
        if (expression == null || defaultValue == null) throw new IllegalArgumentException("operand is null");
        this.expression = adopt(expression);
        this.steps = adoptAll(steps);
        if (this.steps.isEmpty()) throw new IllegalArgumentException("dynamic projection has no step");
        this.defaultValue = adopt(defaultValue);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.DYNAMIC_PROJECTION;
    }

    public Expression expression() {
        return expression;
    }

    public List<LabelOrIndex> steps() {
        return steps;
    }

    public Expression defaultValue() {
        return defaultValue;
    }

    @Override public void write(SwanWriter out) {
        out.text("(").node(expression).text(" . ").join(steps, "").text(" default ").node(defaultValue).text(")");
    }
}
