package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** Positional item {@code T} or named item {@code id: T}. */
public final class GroupTypeItem extends SwanNode {

    private final Identifier label;
    private final GroupTypeExpression type;

    public GroupTypeItem(SourceSpan span, Identifier label, GroupTypeExpression type) {
        super(span);
        if (type == null) throw new IllegalArgumentException("type is null");
        this.label = label;
        this.type = adopt(type);
    }

    public Optional<Identifier> label() {
        return Optional.ofNullable(label);
    }

    public GroupTypeExpression type() {
        return type;
    }

    @Override public void write(SwanWriter out) {
        if (label != null) out.text(label.render()).text(": ");
        out.node(type);
    }
}
