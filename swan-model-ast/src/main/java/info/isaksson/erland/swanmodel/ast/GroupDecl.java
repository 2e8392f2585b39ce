package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.types.GroupTypeExpression;

/** {@code G = group_type} */
public final class GroupDecl extends SwanNode implements Declaration {

    private final Identifier identifier;
    private final GroupTypeExpression type;

    public GroupDecl(SourceSpan span, Identifier identifier, GroupTypeExpression type) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        if (type == null) throw new IllegalArgumentException("group type is null");
        this.identifier = identifier;
        this.type = adopt(type);
    }

    @Override public Identifier identifier() {
        return identifier;
    }

    public GroupTypeExpression type() {
        return type;
    }

    @Override public void write(SwanWriter out) {
        out.text(identifier.render()).text(" = ").node(type);
    }
}
