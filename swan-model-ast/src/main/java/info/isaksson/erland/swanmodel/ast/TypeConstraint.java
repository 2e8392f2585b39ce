package info.isaksson.erland.swanmodel.ast;

import java.util.List;
import java.util.Optional;

/** {@code where 'T, 'U numeric}; the variable list may be protected. */
public final class TypeConstraint extends SwanNode {

    private final List<Identifier> typeVariables;
    private final ProtectedText protectedVariables;
    private final NumericKind kind;

    public TypeConstraint(SourceSpan span, List<Identifier> typeVariables, NumericKind kind) {
        this(span, typeVariables, null, kind);
    }

    public TypeConstraint(SourceSpan span, ProtectedText protectedVariables, NumericKind kind) {
        this(span, List.of(), protectedVariables, kind);
    }

    private TypeConstraint(SourceSpan span, List<Identifier> typeVariables, ProtectedText protectedVariables, NumericKind kind) {
        super(span);
        if (kind == null) throw new IllegalArgumentException("kind is null");
        this.typeVariables = typeVariables == null ? List.of() : List.copyOf(typeVariables);
        this.protectedVariables = protectedVariables;
        this.kind = kind;
    }

    public List<Identifier> typeVariables() {
        return typeVariables;
    }

    public Optional<ProtectedText> protectedVariables() {
        return Optional.ofNullable(protectedVariables);
    }

    public NumericKind kind() {
        return kind;
    }

    @Override public void write(SwanWriter out) {
        out.text("where ");
        if (protectedVariables != null) {
            out.raw(protectedVariables.rawText());
        } else {
            for (int i = 0; i < typeVariables.size(); i++) {
                if (i > 0) out.text(", ");
                out.text(typeVariables.get(i).render());
            }
        }
        out.text(" ").text(kind.keyword());
    }
}
