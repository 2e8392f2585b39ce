package info.isaksson.erland.swanmodel.ast;

import info.isaksson.erland.swanmodel.types.TypeDefinition;

import java.util.Optional;

/** {@code T = definition}, or an abstract {@code T}. */
public final class TypeDecl extends SwanNode implements Declaration {

    private final Identifier identifier;
    private final TypeDefinition definition;

    public TypeDecl(SourceSpan span, Identifier identifier, TypeDefinition definition) {
        super(span);
        if (identifier == null) throw new IllegalArgumentException("identifier is null");
        this.identifier = identifier;
        this.definition = adopt(definition);
    }

    @Override public Identifier identifier() {
        return identifier;
    }

    public Optional<TypeDefinition> definition() {
        return Optional.ofNullable(definition);
    }

    @Override public void write(SwanWriter out) {
        out.text(identifier.render());
        if (definition != null) out.text(" = ").node(definition);
    }
}
