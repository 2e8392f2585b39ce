package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class TypeDeclarations extends DeclarationList<TypeDecl> {

    public TypeDeclarations(SourceSpan span, List<TypeDecl> items) {
        super(span, items);
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.TYPES;
    }

    @Override protected String keyword() {
        return "type";
    }
}
