package info.isaksson.erland.swanmodel.ast;

import java.util.List;

public final class EmitSection extends ScopeSection {

    private final List<EmissionBody> emissions;

    public EmitSection(SourceSpan span, List<EmissionBody> emissions) {
        super(span);
        this.emissions = adoptAll(emissions);
    }

    @Override public ScopeSectionKind kind() {
        return ScopeSectionKind.EMIT;
    }

    public List<EmissionBody> emissions() {
        return emissions;
    }

    @Override public void write(SwanWriter out) {
        writeItems(out, "emit", emissions, ";");
    }
}
