package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code merge (g1) (g2) ...} */
public final class MergeExpr extends Expression {

    private final List<Group> groups;

    public MergeExpr(SourceSpan span, List<Group> groups) {
        super(span);
        this.groups = adoptAll(groups);
        if (this.groups.isEmpty()) throw new IllegalArgumentException("merge has no group");
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.MERGE;
    }

    public List<Group> groups() {
        return groups;
    }

    @Override public void write(SwanWriter out) {
        out.text("merge");
        for (Group g : groups) out.text(" (").node(g).text(")");
    }
}
