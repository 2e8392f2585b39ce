package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.Optional;

/** {@code Tag {}}, {@code Tag {T}} or {@code Tag {f: T, ...}} (a struct type). */
public final class VariantComponent extends SwanNode {

    private final Identifier tag;
    private final TypeExpression type;

    public VariantComponent(SourceSpan span, Identifier tag, TypeExpression type) {
        super(span);
        if (tag == null) throw new IllegalArgumentException("tag is null");
        this.tag = tag;
        this.type = adopt(type);
    }

    public Identifier tag() {
        return tag;
    }

    public Optional<TypeExpression> type() {
        return Optional.ofNullable(type);
    }

    @Override public void write(SwanWriter out) {
        out.text(tag.render()).text(" ");
        if (type instanceof StructType) {
            out.node(type);
        } else {
            out.text("{").node(type).text("}");
        }
    }
}
