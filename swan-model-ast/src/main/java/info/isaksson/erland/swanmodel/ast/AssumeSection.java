package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class AssumeSection extends ScopeSection {

    private final List<FormalProperty> properties;

    public AssumeSection(SourceSpan span, List<FormalProperty> properties) {
        super(span);
        this.properties = adoptAll(properties);
    }

    @Override public ScopeSectionKind kind() {
        return ScopeSectionKind.ASSUME;
    }

    public List<FormalProperty> properties() {
        return properties;
    }

    @Override public void write(SwanWriter out) {
        writeItems(out, "assume", properties, ";");
    }
}
