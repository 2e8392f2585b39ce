package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class ConstDeclarations extends DeclarationList<ConstDecl> {

    public ConstDeclarations(SourceSpan span, List<ConstDecl> items) {
        super(span, items);
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.CONSTANTS;
    }

    @Override protected String keyword() {
        return "const";
    }
}
