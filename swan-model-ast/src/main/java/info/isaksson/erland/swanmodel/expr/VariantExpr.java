package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

/** {@code Tag {group}} */
public final class VariantExpr extends Expression {

    private final PathIdentifier tag;
    private final Group group;

    public VariantExpr(SourceSpan span, PathIdentifier tag, Group group) {
        super(span);
        if (tag == null) throw new IllegalArgumentException("tag is null");
        if (group == null) throw new IllegalArgumentException("group is null");
        this.tag = tag;
        this.group = adopt(group);
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.VARIANT;
    }

    public PathIdentifier tag() {
        return tag;
    }

    public Group group() {
        return group;
    }

    @Override public void write(SwanWriter out) {
        out.text(tag.toString()).text(" {").node(group).text("}");
    }
}
