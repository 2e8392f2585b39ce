package info.isaksson.erland.swanmodel.expr;

import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code {group} [: T]} */
public final class MakeStruct extends Expression {

    private final Group group;
    private final PathIdentifier type;

    public MakeStruct(SourceSpan span, Group group, PathIdentifier type) {
        super(span);
        if (group == null) throw new IllegalArgumentException("group is null");
        this.group = adopt(group);
        this.type = type;
    }

    @Override public ExpressionKind kind() {
        return ExpressionKind.MAKE_STRUCT;
    }

    public Group group() {
        return group;
    }

    public Optional<PathIdentifier> type() {
        return Optional.ofNullable(type);
    }

    @Override public void write(SwanWriter out) {
        out.text("{").node(group).text("}");
        if (type != null) out.text(" : ").text(type.toString());
    }
}
