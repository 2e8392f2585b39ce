package info.isaksson.erland.swanmodel.ast;

import java.util.List;

/** Top-level item of a module. */
public abstract class GlobalDeclaration extends SwanNode {

    protected GlobalDeclaration(SourceSpan span) {
        super(span);
    }

    public abstract GlobalDeclarationKind kind();

    /**
     * Named declarations introduced by this item: the entries of a declaration list,
     * the item itself otherwise.
     */
    public List<? extends SwanNode> members() {
        return List.of(this);
    }
}
