package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code (case e of | p1: e1 | p2: e2)} */
public final class CaseExpr extends Expression {

    private final Expression expression;
    private final List<CaseBranch> branches;

    public CaseExpr(SourceSpan span, Expression expression, List<CaseBranch> branches) {
        super(span);
        if (expression == null) throw new IllegalArgumentException("expression is null");
        this.expression = adopt(expression);
        this.branches = adoptAll(branches);
        if (this.branches.isEmpty()) throw new IllegalArgumentException("case has no branch");
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.CASE;
    }

    public Expression expression() {
        return expression;
    }

    public List<CaseBranch> branches() {
        return branches;
    }

    @Override public void write(SwanWriter out) {
        out.text("(case ").node(expression).text(" of ").join(branches, " ").text(")");
    }
}
