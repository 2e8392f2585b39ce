package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class GroupDeclarations extends DeclarationList<GroupDecl> {

    public GroupDeclarations(SourceSpan span, List<GroupDecl> items) {
        super(span, items);
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.GROUPS;
    }

    @Override protected String keyword() {
        return "group";
    }
}
