package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

/** {@code use P::Q [as A];} */
public final class UseDirective extends GlobalDeclaration {

    private final PathIdentifier path;
    private final Identifier alias;

    public UseDirective(SourceSpan span, PathIdentifier path, Identifier alias) {
        super(span);
        if (path == null) throw new IllegalArgumentException("path is null");
        this.path = path;
        this.alias = alias;
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.USE;
    }

    public PathIdentifier path() {
        return path;
    }

    public Optional<Identifier> alias() {
        return Optional.ofNullable(alias);
    }

    /** Name under which the used module is visible: the alias, or the last path segment. */
    public String visibleName() {
        if (alias != null) return alias.value();
        return path.isProtected() ? path.toString() : path.last().value();
    }

    @Override public void write(SwanWriter out) {
        out.text("use ").text(path.toString());
        if (alias != null) out.text(" as ").text(alias.render());
        out.text(";");
    }
}
