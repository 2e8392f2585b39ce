package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code | pattern: expr} */
public final class CaseBranch extends SwanNode {

    private final Pattern pattern;
    private final Expression expression;

    public CaseBranch(SourceSpan span, Pattern pattern, Expression expression) {
        super(span);
        if (pattern == null || expression == null) throw new IllegalArgumentException("operand is null");
        this.pattern = adopt(pattern);
        this.expression = adopt(expression);
    }

    public Pattern pattern() {
        return pattern;
    }

    public Expression expression() {
        return expression;
    }

    @Override public void write(SwanWriter out) {
        out.text("| ").node(pattern).text(": ").node(expression);
    }
}
