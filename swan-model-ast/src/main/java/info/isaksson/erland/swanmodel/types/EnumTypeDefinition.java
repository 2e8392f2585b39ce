package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code enum {A, B}} */
public final class EnumTypeDefinition extends TypeDefinition {

    private final List<Identifier> tags;

    public EnumTypeDefinition(SourceSpan span, List<Identifier> tags) {
        super(span);
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public List<Identifier> tags() {
        return tags;
    }

    @Override public void write(SwanWriter out) {
        out.text("enum {");
        for (int i = 0; i < tags.size(); i++) {
            if (i > 0) out.text(", ");
            out.text(tags.get(i).render());
        }
        out.text("}");
    }
}
