package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code [group]} */
public final class ArrayGroupExpr extends Expression {

    private final Group group;

    public ArrayGroupExpr(SourceSpan span, Group group) {
        super(span);
        if (group == null) throw new IllegalArgumentException("group is null");
        this.group = adopt(group);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.ARRAY_GROUP;
    }

    public Group group() {
        return group;
    }

    @Override public void write(SwanWriter out) {
        out.text("[").node(group).text("]");
    }
}
