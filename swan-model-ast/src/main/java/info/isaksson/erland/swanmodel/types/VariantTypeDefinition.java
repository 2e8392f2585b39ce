package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.List;

/** {@code A {int32} | B {x: bool} | C {}} */
public final class VariantTypeDefinition extends TypeDefinition {

    private final List<VariantComponent> components;

    public VariantTypeDefinition(SourceSpan span, List<VariantComponent> components) {
        super(span);
        this.components = adoptAll(components);
        if (this.components.isEmpty()) throw new IllegalArgumentException("variant type has no component");
    }

    public List<VariantComponent> components() {
        return components;
    }

    @Override public void write(SwanWriter out) {
        out.join(components, " | ");
    }
}
