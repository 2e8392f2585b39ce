package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class SensorDeclarations extends DeclarationList<SensorDecl> {

    public SensorDeclarations(SourceSpan span, List<SensorDecl> items) {
        super(span, items);
    }

    @Override public GlobalDeclarationKind kind() {
        return GlobalDeclarationKind.SENSORS;
    }

    @Override protected String keyword() {
        return "sensor";
    }
}
