package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code (e with .a = 1; [0] = 2)} */
public final class FunctionalUpdate extends Expression {

    private final Expression expression;
    private final List<Modifier> modifiers;

    public FunctionalUpdate(SourceSpan span, Expression expression, List<Modifier> modifiers) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.expression = adopt(expression);
        this.modifiers = adoptAll(modifiers);
        if (this.modifiers.isEmpty()) throw new IllegalArgumentException("functional update has no modifier");
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.FUNCTIONAL_UPDATE;
    }

    public Expression expression() {
        return expression;
    }

    public List<Modifier> modifiers() {
        return modifiers;
    }

    @Override public void write(SwanWriter out) {
        out.text("(").node(expression).text(" with ").join(modifiers, "; ").text(")");
    }
}
